package com.scanq.error;

/**
 * Failure taxonomy shared by the retry executor, the scheduler driver and the HTTP layer.
 */
public enum ErrorKind {

    CONNECTION_FAILED,
    CONNECTION_TIMEOUT,
    CONNECTION_LOST,

    AUTH_FAILED,
    AUTH_INVALID_CREDENTIALS,
    AUTH_EXPIRED,

    QUERY_FAILED,
    QUERY_TIMEOUT,
    QUERY_SYNTAX_ERROR,
    QUERY_PERMISSION_DENIED,

    DATA_NOT_FOUND,
    DATA_INVALID,

    INTERNAL_ERROR,
    SERVICE_UNAVAILABLE,

    VALIDATION_ERROR,
    MISSING_PARAMETER
}
