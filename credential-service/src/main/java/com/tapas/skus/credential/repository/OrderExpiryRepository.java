package com.tapas.skus.credential.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class OrderExpiryRepository {

    private final JdbcTemplate jdbcTemplate;

    public OrderExpiryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Expiry the order gets when its paid period starts at {@code last_paid_at} (now when never paid).
     * The longest item period wins, one month when no item declares one.
     */
    public Optional<Instant> findExpiresAtAfterIsoPeriod(UUID orderId) {
        String sql = """
                SELECT COALESCE(o.last_paid_at, now()) + COALESCE(MAX(oi.valid_for_iso::interval), interval '1 month') AS expires_at
                FROM orders o
                LEFT JOIN order_items oi ON oi.order_id = o.id
                WHERE o.id = ?
                GROUP BY o.last_paid_at
                """;

        List<Timestamp> rows = jdbcTemplate.query(sql,
                (rs, rowNum) -> rs.getTimestamp("expires_at"),
                orderId);

        return rows.stream().findFirst().map(Timestamp::toInstant);
    }
}
