package com.scanq.error;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void connectionRefusedIsRetryable() {
        ClassifiedError error = classifier.classify(new RuntimeException("connect ECONNREFUSED 10.0.0.1:443"));

        assertEquals(ErrorKind.CONNECTION_FAILED, error.kind());
        assertTrue(error.retryable());
        assertThat(error.userMessage()).contains("Unable to connect");
    }

    @Test
    void connectExceptionInCauseChainIsConnectionFailure() {
        RuntimeException wrapped = new RuntimeException("request failed", new ConnectException("nope"));

        assertEquals(ErrorKind.CONNECTION_FAILED, classifier.classify(wrapped).kind());
    }

    @Test
    void socketTimeoutIsConnectionTimeout() {
        ClassifiedError error = classifier.classify(new IllegalStateException("boom", new SocketTimeoutException()));

        assertEquals(ErrorKind.CONNECTION_TIMEOUT, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void vendorCodeIdentifiesInvalidCredentials() {
        ClassifiedError error = classifier.classify(new WarehouseException("login rejected", "390100"));

        assertEquals(ErrorKind.AUTH_INVALID_CREDENTIALS, error.kind());
        assertFalse(error.retryable());
        assertEquals("390100", error.vendorCode());
    }

    @Test
    void expiredSessionIsNotRetryable() {
        ClassifiedError error = classifier.classify(new WarehouseException("session gone", "390114"));

        assertEquals(ErrorKind.AUTH_EXPIRED, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void syntaxErrorsAreNotRetryable() {
        ClassifiedError error = classifier.classify(
                new WarehouseException("SQL compilation error: unexpected 'FROM'", "001003"));

        assertEquals(ErrorKind.QUERY_SYNTAX_ERROR, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void missingObjectIsDataNotFound() {
        ClassifiedError error = classifier.classify(new RuntimeException("Table 'ORDERS' does not exist"));

        assertEquals(ErrorKind.DATA_NOT_FOUND, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void permissionDeniedIsNotRetryable() {
        ClassifiedError error = classifier.classify(new WarehouseException("Insufficient privileges", "003001"));

        assertEquals(ErrorKind.QUERY_PERMISSION_DENIED, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void statementTimeoutIsQueryTimeout() {
        ClassifiedError error = classifier.classify(
                new RuntimeException("Query execution time exceeded the limit"));

        assertEquals(ErrorKind.QUERY_TIMEOUT, error.kind());
        assertTrue(error.retryable());
    }

    @Test
    void illegalArgumentIsValidationError() {
        ClassifiedError error = classifier.classify(new IllegalArgumentException("table must not be blank"));

        assertEquals(ErrorKind.VALIDATION_ERROR, error.kind());
        assertFalse(error.retryable());
    }

    @Test
    void firstMatchingRuleWins() {
        // matches both the connection-timeout and the query-timeout fragments
        ClassifiedError error = classifier.classify(new RuntimeException("statement timeout"));

        assertEquals(ErrorKind.CONNECTION_TIMEOUT, error.kind());
    }

    @Test
    void unknownFailuresDefaultToRetryableInternalError() {
        ClassifiedError error = classifier.classify(new IllegalStateException("something odd"));

        assertEquals(ErrorKind.INTERNAL_ERROR, error.kind());
        assertTrue(error.retryable());
        assertTrue(classifier.isRetryable(new IllegalStateException("something odd")));
    }

    @Test
    void messageFallsBackToTypeAndUnknown() {
        assertEquals("java.lang.IllegalStateException", classifier.classify(new IllegalStateException()).message());
        assertEquals("Unknown error", classifier.classify(null).message());
    }

    @Test
    void errorResponseCarriesCodeAndRetryability() {
        ClassifiedError classified = classifier.classify(new WarehouseException("login rejected", "390100"));
        OffsetDateTime timestamp = OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC);

        ErrorResponse response = ErrorResponse.of(classified, timestamp);

        assertFalse(response.success());
        assertEquals(ErrorKind.AUTH_INVALID_CREDENTIALS, response.error().code());
        assertEquals("login rejected", response.error().message());
        assertEquals(timestamp, response.metadata().timestamp());
        assertFalse(response.metadata().retryable());
    }
}
