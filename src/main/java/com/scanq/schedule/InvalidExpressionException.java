package com.scanq.schedule;

public class InvalidExpressionException extends IllegalArgumentException {

    public InvalidExpressionException(String expression) {
        super("Invalid cron expression: " + expression);
    }

    public InvalidExpressionException(String expression, Throwable cause) {
        super("Invalid cron expression: " + expression, cause);
    }
}
