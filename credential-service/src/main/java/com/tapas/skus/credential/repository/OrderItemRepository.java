package com.tapas.skus.credential.repository;

import com.tapas.skus.credential.domain.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface OrderItemRepository extends JpaRepository<OrderItem, UUID> {

    Optional<OrderItem> findByIdAndOrderId(UUID id, UUID orderId);
}
