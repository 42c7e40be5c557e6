package com.tapas.skus.credential.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.skus.credential.domain.OrderCreds;
import com.tapas.skus.credential.domain.SigningOrderRequestOutbox;
import com.tapas.skus.credential.domain.TimeLimitedV2Creds;
import com.tapas.skus.credential.exception.ConflictException;
import com.tapas.skus.credential.exception.DataIntegrityException;
import com.tapas.skus.credential.exception.InvalidArgumentException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * PostgreSQL adapter for {@link CredentialStore}. Credential token lists are stored as jsonb arrays.
 */
@Repository
public class JdbcCredentialStore implements CredentialStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private static final String OUTBOX_COLUMNS =
            "request_id, order_id, item_id, message_data::text AS message_data, created_at, submitted_at, completed_at";

    private static final String ORDER_CREDS_COLUMNS =
            "item_id, order_id, issuer_id, blinded_creds::text AS blinded_creds, signed_creds::text AS signed_creds, "
                    + "batch_proof, public_key, created_at";

    private static final String TLV2_COLUMNS =
            "order_id, item_id, request_id, issuer_id, blinded_creds::text AS blinded_creds, "
                    + "signed_creds::text AS signed_creds, batch_proof, public_key, valid_from, valid_to";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<SigningOrderRequestOutbox> outboxMapper = (rs, rowNum) -> new SigningOrderRequestOutbox(
            rs.getObject("request_id", UUID.class),
            rs.getObject("order_id", UUID.class),
            rs.getObject("item_id", UUID.class),
            rs.getString("message_data"),
            instant(rs, "created_at"),
            instant(rs, "submitted_at"),
            instant(rs, "completed_at"));

    private final RowMapper<OrderCreds> orderCredsMapper = (rs, rowNum) -> new OrderCreds(
            rs.getObject("item_id", UUID.class),
            rs.getObject("order_id", UUID.class),
            rs.getObject("issuer_id", UUID.class),
            fromJson(rs.getString("blinded_creds")),
            fromJson(rs.getString("signed_creds")),
            rs.getString("batch_proof"),
            rs.getString("public_key"),
            instant(rs, "created_at"));

    private final RowMapper<TimeLimitedV2Creds> tlv2Mapper = (rs, rowNum) -> new TimeLimitedV2Creds(
            rs.getObject("order_id", UUID.class),
            rs.getObject("item_id", UUID.class),
            rs.getObject("request_id", UUID.class),
            rs.getObject("issuer_id", UUID.class),
            fromJson(rs.getString("blinded_creds")),
            fromJson(rs.getString("signed_creds")),
            rs.getString("batch_proof"),
            rs.getString("public_key"),
            instant(rs, "valid_from"),
            instant(rs, "valid_to"));

    public JdbcCredentialStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void insertSigningOrderRequestOutbox(UUID requestId, UUID orderId, UUID itemId, String messageData) {
        String sql = """
                INSERT INTO signing_order_request_outbox (request_id, order_id, item_id, message_data)
                VALUES (?, ?, ?, ?::jsonb)
                ON CONFLICT (request_id) DO NOTHING
                """;

        int inserted = jdbcTemplate.update(sql, requestId, orderId, itemId, messageData);
        if (inserted == 0) {
            throw new ConflictException("signing request " + requestId + " is already enqueued");
        }
    }

    @Override
    public List<SigningOrderRequestOutbox> lockUnsubmittedOutbox(int limit) {
        String sql = "SELECT " + OUTBOX_COLUMNS + """

                FROM signing_order_request_outbox
                WHERE submitted_at IS NULL
                ORDER BY created_at ASC
                LIMIT ?
                FOR UPDATE SKIP LOCKED
                """;

        return jdbcTemplate.query(sql, outboxMapper, limit);
    }

    @Override
    public int markOutboxSubmitted(Collection<UUID> requestIds, Instant submittedAt) {
        if (requestIds == null || requestIds.isEmpty()) {
            return 0;
        }

        // Dynamic IN clause
        String in = String.join(",", Collections.nCopies(requestIds.size(), "?"));
        String sql = String.format(
                "UPDATE signing_order_request_outbox SET submitted_at = ? WHERE submitted_at IS NULL AND request_id IN (%s)",
                in);

        List<Object> args = new ArrayList<>();
        args.add(Timestamp.from(submittedAt));
        args.addAll(requestIds);

        return jdbcTemplate.update(sql, args.toArray());
    }

    @Override
    public int markOutboxCompleted(UUID requestId, Instant completedAt) {
        return jdbcTemplate.update(
                "UPDATE signing_order_request_outbox SET completed_at = ? WHERE request_id = ? AND completed_at IS NULL",
                Timestamp.from(completedAt), requestId);
    }

    @Override
    public Optional<SigningOrderRequestOutbox> findOutboxByRequestId(UUID requestId) {
        String sql = "SELECT " + OUTBOX_COLUMNS + " FROM signing_order_request_outbox WHERE request_id = ?";
        return jdbcTemplate.query(sql, outboxMapper, requestId).stream().findFirst();
    }

    @Override
    public List<SigningOrderRequestOutbox> findOutboxByOrder(UUID orderId) {
        String sql = "SELECT " + OUTBOX_COLUMNS
                + " FROM signing_order_request_outbox WHERE order_id = ? ORDER BY created_at ASC";
        return jdbcTemplate.query(sql, outboxMapper, orderId);
    }

    @Override
    public List<SigningOrderRequestOutbox> findOutboxByOrderItem(UUID orderId, UUID itemId) {
        String sql = "SELECT " + OUTBOX_COLUMNS
                + " FROM signing_order_request_outbox WHERE order_id = ? AND item_id = ? ORDER BY created_at ASC";
        return jdbcTemplate.query(sql, outboxMapper, orderId, itemId);
    }

    @Override
    public OptionalDouble outboxAverageCompletionSeconds(int window) {
        String sql = """
                SELECT AVG(EXTRACT(EPOCH FROM (recent.completed_at - recent.created_at))) AS avg_seconds
                FROM (
                    SELECT created_at, completed_at
                    FROM signing_order_request_outbox
                    WHERE completed_at IS NOT NULL
                    ORDER BY completed_at DESC
                    LIMIT ?
                ) recent
                """;

        Double avg = jdbcTemplate.query(sql, rs -> {
            if (!rs.next()) {
                return null;
            }
            double value = rs.getDouble("avg_seconds");
            return rs.wasNull() ? null : value;
        }, window);

        return avg == null ? OptionalDouble.empty() : OptionalDouble.of(avg);
    }

    @Override
    public boolean insertOrderCreds(OrderCreds creds) {
        String sql = """
                INSERT INTO order_creds
                (item_id, order_id, issuer_id, blinded_creds, signed_creds, batch_proof, public_key)
                VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
                ON CONFLICT (item_id) DO NOTHING
                """;

        return jdbcTemplate.update(sql,
                creds.itemId(),
                creds.orderId(),
                creds.issuerId(),
                toJson(creds.blindedCreds()),
                toJson(creds.signedCreds()),
                creds.batchProof(),
                creds.publicKey()) > 0;
    }

    @Override
    public boolean insertTimeLimitedV2Creds(TimeLimitedV2Creds creds) {
        String sql = """
                INSERT INTO time_limited_v2_order_creds
                (item_id, order_id, issuer_id, blinded_creds, signed_creds, batch_proof, public_key,
                 valid_to, valid_from, request_id)
                VALUES (?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)
                ON CONFLICT (item_id, request_id, valid_from, valid_to) DO NOTHING
                """;

        return jdbcTemplate.update(sql,
                creds.itemId(),
                creds.orderId(),
                creds.issuerId(),
                toJson(creds.blindedCreds()),
                toJson(creds.signedCreds()),
                creds.batchProof(),
                creds.publicKey(),
                Timestamp.from(creds.validTo()),
                Timestamp.from(creds.validFrom()),
                creds.requestId()) > 0;
    }

    @Override
    public TimeLimitedV2SubmissionReport timeLimitedV2SubmissionReport(UUID requestId, List<String> blindedCreds) {
        if (blindedCreds == null || blindedCreds.isEmpty()) {
            throw new InvalidArgumentException("at least one blinded credential is required");
        }

        String first = blindedCreds.get(0);
        String sql = """
                SELECT
                    EXISTS(SELECT 1 FROM time_limited_v2_order_creds
                           WHERE blinded_creds->>0 = ?) AS already_submitted,
                    EXISTS(SELECT 1 FROM time_limited_v2_order_creds
                           WHERE request_id = ? AND blinded_creds->>0 <> ?) AS mismatch
                """;

        return jdbcTemplate.queryForObject(sql,
                (rs, rowNum) -> new TimeLimitedV2SubmissionReport(
                        rs.getBoolean("already_submitted"),
                        rs.getBoolean("mismatch")),
                first, requestId, first);
    }

    @Override
    public Optional<OrderCreds> findOrderCredsByItem(UUID orderId, UUID itemId) {
        String sql = "SELECT " + ORDER_CREDS_COLUMNS + " FROM order_creds WHERE order_id = ? AND item_id = ?";
        return jdbcTemplate.query(sql, orderCredsMapper, orderId, itemId).stream().findFirst();
    }

    @Override
    public List<OrderCreds> findOrderCredsByOrder(UUID orderId) {
        String sql = "SELECT " + ORDER_CREDS_COLUMNS + " FROM order_creds WHERE order_id = ?";
        return jdbcTemplate.query(sql, orderCredsMapper, orderId);
    }

    @Override
    public List<TimeLimitedV2Creds> findTimeLimitedV2Creds(UUID orderId, UUID itemId, UUID requestId) {
        String sql = "SELECT " + TLV2_COLUMNS + """

                FROM time_limited_v2_order_creds
                WHERE order_id = ? AND item_id = ? AND request_id = ?
                ORDER BY valid_from ASC
                """;
        return jdbcTemplate.query(sql, tlv2Mapper, orderId, itemId, requestId);
    }

    @Override
    public List<TimeLimitedV2Creds> findTimeLimitedV2CredsByOrder(UUID orderId) {
        String sql = "SELECT " + TLV2_COLUMNS
                + " FROM time_limited_v2_order_creds WHERE order_id = ? ORDER BY valid_from ASC";
        return jdbcTemplate.query(sql, tlv2Mapper, orderId);
    }

    @Override
    public int deleteOutboxByOrder(UUID orderId) {
        return jdbcTemplate.update("DELETE FROM signing_order_request_outbox WHERE order_id = ?", orderId);
    }

    @Override
    public int deleteOrderCredsByOrder(UUID orderId) {
        return jdbcTemplate.update("DELETE FROM order_creds WHERE order_id = ?", orderId);
    }

    @Override
    public int deleteTimeLimitedV2CredsByOrder(UUID orderId) {
        return jdbcTemplate.update("DELETE FROM time_limited_v2_order_creds WHERE order_id = ?", orderId);
    }

    private String toJson(List<String> values) {
        if (values == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("Failed to serialize credential list", e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new DataIntegrityException("Stored credential list is not a json array", e);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }
}
