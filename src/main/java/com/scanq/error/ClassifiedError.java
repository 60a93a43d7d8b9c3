package com.scanq.error;

/**
 * Outcome of {@link ErrorClassifier#classify(Throwable)}.
 *
 * @param kind        taxonomy bucket
 * @param message     raw failure message
 * @param userMessage message safe to show to dashboard users
 * @param retryable   whether the failure is considered transient
 * @param vendorCode  warehouse error code, when the failure carried one
 */
public record ClassifiedError(
        ErrorKind kind,
        String message,
        String userMessage,
        boolean retryable,
        String vendorCode) {
}
