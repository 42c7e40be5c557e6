package com.tapas.skus.credential.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "order_cred_issuers")
public class Issuer {
    @Id
    private UUID id;

    // encoded as merchantId?sku=<sku>
    @Column(name = "merchant_id")
    private String name;

    private String publicKey;

    private Instant createdAt;
}
