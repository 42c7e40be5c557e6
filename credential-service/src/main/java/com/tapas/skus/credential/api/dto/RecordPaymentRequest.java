package com.tapas.skus.credential.api.dto;

import java.time.Instant;

/**
 * @param paidAt payment time, now when absent
 */
public record RecordPaymentRequest(Instant paidAt) {
}
