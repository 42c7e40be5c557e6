package com.tapas.skus.credential.api;

import com.tapas.skus.credential.api.dto.OrderResponse;
import com.tapas.skus.credential.api.dto.RecordPaymentRequest;
import com.tapas.skus.credential.service.OrderExpiryGate;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

@RestController
@RequestMapping("/v1/orders")
public class OrderController {

    private final OrderExpiryGate orderExpiryGate;

    public OrderController(OrderExpiryGate orderExpiryGate) {
        this.orderExpiryGate = orderExpiryGate;
    }

    @Operation(
            summary = "Record a confirmed payment",
            description = "Marks the order paid and extends its expiry by the longest item period."
    )
    @PostMapping("/{orderId}/payments")
    public ResponseEntity<OrderResponse> recordPayment(
            @PathVariable UUID orderId,
            @RequestBody(required = false) RecordPaymentRequest request
    ) {
        Instant paidAt = request != null && request.paidAt() != null ? request.paidAt() : Instant.now();
        return ResponseEntity.ok(OrderResponse.from(orderExpiryGate.recordPayment(orderId, paidAt)));
    }
}
