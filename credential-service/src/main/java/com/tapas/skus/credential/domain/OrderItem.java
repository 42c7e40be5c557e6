package com.tapas.skus.credential.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "order_items")
public class OrderItem {
    @Id
    private UUID id;

    private UUID orderId;

    private String sku;

    private String currency;

    private Integer quantity;

    private BigDecimal price;

    private BigDecimal subtotal;

    private String location;

    private String description;

    private String credentialType;

    private String validForIso;

    private String eachCredentialValidForIso;

    private String issuanceInterval;

    private Instant createdAt;
}
