package com.tapas.skus.credential.api.dto;

import com.tapas.skus.credential.domain.Order;

import java.time.Instant;
import java.util.UUID;

public record OrderResponse(
        UUID id,
        String status,
        Instant lastPaidAt,
        Instant expiresAt
) {
    public static OrderResponse from(Order order) {
        return new OrderResponse(
                order.getId(),
                order.getStatus(),
                order.getLastPaidAt(),
                order.getExpiresAt()
        );
    }
}
