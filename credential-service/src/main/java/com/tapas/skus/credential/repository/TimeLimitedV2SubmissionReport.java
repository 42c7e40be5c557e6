package com.tapas.skus.credential.repository;

/**
 * Outcome of checking a time-limited-v2 submission against stored credentials.
 *
 * @param alreadySubmitted a row already holds the caller's first blinded credential
 * @param mismatch         the request id is taken by a row with a different first blinded credential
 */
public record TimeLimitedV2SubmissionReport(boolean alreadySubmitted, boolean mismatch) {
}
