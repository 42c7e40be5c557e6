package com.tapas.skus.credential.repository;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class OrderExpiryRepositoryTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

    private static final Instant LAST_PAID_AT = Instant.parse("2024-01-15T00:00:00Z");

    private static DriverManagerDataSource dataSource;

    private JdbcTemplate jdbcTemplate;
    private OrderExpiryRepository repository;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("TRUNCATE orders CASCADE");
        repository = new OrderExpiryRepository(jdbcTemplate);
    }

    @Test
    void findExpiresAtAfterIsoPeriod_usesLongestItemPeriod() {
        UUID orderId = order(LAST_PAID_AT);
        item(orderId, "P1M");
        item(orderId, "P1Y");

        assertThat(repository.findExpiresAtAfterIsoPeriod(orderId))
                .hasValue(LAST_PAID_AT.atZone(ZoneOffset.UTC).plusYears(1).toInstant());
    }

    @Test
    void findExpiresAtAfterIsoPeriod_defaultsToOneMonth() {
        UUID orderId = order(LAST_PAID_AT);
        item(orderId, null);

        assertThat(repository.findExpiresAtAfterIsoPeriod(orderId))
                .hasValue(LAST_PAID_AT.atZone(ZoneOffset.UTC).plusMonths(1).toInstant());
    }

    @Test
    void findExpiresAtAfterIsoPeriod_unknownOrderIsEmpty() {
        assertThat(repository.findExpiresAtAfterIsoPeriod(UUID.randomUUID())).isEmpty();
    }

    private UUID order(Instant lastPaidAt) {
        UUID id = UUID.randomUUID();
        jdbcTemplate.update("""
                        INSERT INTO orders (id, merchant_id, status, currency, total_price, last_paid_at)
                        VALUES (?, 'brave.com', 'paid', 'USD', 9.99, ?)
                        """,
                id, Timestamp.from(lastPaidAt));
        return id;
    }

    private void item(UUID orderId, String validForIso) {
        jdbcTemplate.update("""
                        INSERT INTO order_items
                        (id, order_id, sku, currency, quantity, price, subtotal, credential_type, valid_for_iso)
                        VALUES (?, ?, 'brave-vpn-premium', 'USD', 1, 9.99, 9.99, 'time-limited-v2', ?)
                        """,
                UUID.randomUUID(), orderId, validForIso);
    }
}
