package com.tapas.skus.credential.service;

import com.tapas.skus.credential.domain.Order;
import com.tapas.skus.credential.domain.OrderStatus;
import com.tapas.skus.credential.exception.NotFoundException;
import com.tapas.skus.credential.repository.OrderExpiryRepository;
import com.tapas.skus.credential.repository.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * The order's {@code expires_at} bounds every credential window persisted for it.
 */
@Service
@Slf4j
public class OrderExpiryGate {

    private final OrderRepository orderRepository;
    private final OrderExpiryRepository orderExpiryRepository;

    public OrderExpiryGate(OrderRepository orderRepository, OrderExpiryRepository orderExpiryRepository) {
        this.orderRepository = orderRepository;
        this.orderExpiryRepository = orderExpiryRepository;
    }

    /**
     * Current expiry of the order, read fresh from the store.
     *
     * @throws NotFoundException when the order does not exist
     */
    public Optional<Instant> currentExpiry(UUID orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("order " + orderId + " not found"));
        return Optional.ofNullable(order.getExpiresAt());
    }

    /**
     * A window may be persisted only when the order has an expiry and the window does not start after it.
     */
    public boolean allows(UUID orderId, Instant validFrom) {
        return currentExpiry(orderId)
                .map(expiresAt -> !validFrom.isAfter(expiresAt))
                .orElse(false);
    }

    /**
     * Marks the order paid at {@code paidAt} and moves its expiry to the end of the paid period.
     */
    @Transactional
    public Order recordPayment(UUID orderId, Instant paidAt) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("order " + orderId + " not found"));

        order.setStatus(OrderStatus.PAID.value());
        order.setLastPaidAt(paidAt);
        order.setUpdatedAt(paidAt);
        orderRepository.saveAndFlush(order);

        Instant expiresAt = orderExpiryRepository.findExpiresAtAfterIsoPeriod(orderId)
                .orElseThrow(() -> new NotFoundException("order " + orderId + " not found"));
        order.setExpiresAt(expiresAt);
        log.info("Order {} paid at {}, expires at {}", orderId, paidAt, expiresAt);

        return orderRepository.save(order);
    }
}
