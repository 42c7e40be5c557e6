package com.tapas.skus.credential.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "orders")
public class Order {
    @Id
    private UUID id;

    private String merchantId;

    private String status;

    private String currency;

    private BigDecimal totalPrice;

    private String location;

    private Integer trialDays;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant lastPaidAt;

    // null until the first payment lands
    private Instant expiresAt;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> metadata;

    public boolean isPaid() {
        return OrderStatus.PAID.value().equals(status);
    }
}
