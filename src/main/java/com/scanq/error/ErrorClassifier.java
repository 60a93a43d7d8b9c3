package com.scanq.error;

import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Maps arbitrary failures onto {@link ErrorKind} and decides whether they may be retried.
 * Rules are evaluated in declaration order and the first match wins. Anything unrecognized is
 * classified as a retryable {@link ErrorKind#INTERNAL_ERROR}.
 */
@Component
public class ErrorClassifier {

    private static final String UNKNOWN_MESSAGE = "Unknown error";

    private final List<Rule> rules = List.of(
            new Rule(ErrorKind.CONNECTION_FAILED, true,
                    "Unable to connect to the data warehouse. Please check your connection settings.",
                    f -> f.messageContains("ECONNREFUSED", "ENOTFOUND", "Connection refused")
                            || f.causedBy(ConnectException.class, UnknownHostException.class)),
            new Rule(ErrorKind.CONNECTION_TIMEOUT, true,
                    "Connection to the data warehouse timed out. Please try again.",
                    f -> f.messageContains("timeout", "ETIMEDOUT")
                            || f.causedBy(SocketTimeoutException.class)),
            new Rule(ErrorKind.AUTH_INVALID_CREDENTIALS, false,
                    "Invalid warehouse credentials. Please check your username and password.",
                    f -> f.messageContains("Incorrect username or password", "Authentication failed")
                            || f.hasCode("390100")),
            new Rule(ErrorKind.AUTH_EXPIRED, false,
                    "Your warehouse session has expired. Please reconnect.",
                    f -> f.messageContains("expired") || f.hasCode("390114")),
            new Rule(ErrorKind.QUERY_SYNTAX_ERROR, false,
                    "Invalid query syntax. Please contact support.",
                    f -> f.messageContains("SQL compilation error", "syntax error") || f.hasCode("001003")),
            new Rule(ErrorKind.DATA_NOT_FOUND, false,
                    "Requested data not found in the warehouse.",
                    f -> f.messageContains("does not exist", "Object") || f.hasCode("002003")),
            new Rule(ErrorKind.QUERY_PERMISSION_DENIED, false,
                    "Permission denied. Please check your warehouse role permissions.",
                    f -> f.messageContains("permission", "access denied") || f.hasCode("003001")),
            new Rule(ErrorKind.QUERY_TIMEOUT, true,
                    "Query took too long to execute. Please try again or contact support.",
                    f -> f.messageContains("Query execution time exceeded", "statement timeout")),
            new Rule(ErrorKind.VALIDATION_ERROR, false,
                    "The request is invalid. Please check the submitted values.",
                    f -> f.causedBy(IllegalArgumentException.class)));

    public ClassifiedError classify(Throwable error) {
        Failure failure = new Failure(error);
        for (Rule rule : rules) {
            if (rule.matcher().test(failure)) {
                return new ClassifiedError(rule.kind(), failure.message(), rule.userMessage(), rule.retryable(),
                        failure.vendorCode());
            }
        }
        return new ClassifiedError(ErrorKind.INTERNAL_ERROR, failure.message(),
                "An unexpected error occurred. Please try again later.", true, failure.vendorCode());
    }

    public boolean isRetryable(Throwable error) {
        return classify(error).retryable();
    }

    private record Rule(ErrorKind kind, boolean retryable, String userMessage, Predicate<Failure> matcher) {
    }

    private static final class Failure {

        private final Throwable error;
        private final String message;
        private final String vendorCode;

        private Failure(Throwable error) {
            this.error = error;
            this.message = resolveMessage(error);
            this.vendorCode = resolveVendorCode(error);
        }

        String message() {
            return message;
        }

        String vendorCode() {
            return vendorCode;
        }

        boolean messageContains(String... fragments) {
            for (String fragment : fragments) {
                if (message.contains(fragment)) {
                    return true;
                }
            }
            return false;
        }

        boolean hasCode(String code) {
            return code.equals(vendorCode);
        }

        @SafeVarargs
        final boolean causedBy(Class<? extends Throwable>... types) {
            Set<Class<? extends Throwable>> candidates = Set.of(types);
            Throwable current = error;
            while (current != null) {
                for (Class<? extends Throwable> candidate : candidates) {
                    if (candidate.isInstance(current)) {
                        return true;
                    }
                }
                current = current.getCause() == current ? null : current.getCause();
            }
            return false;
        }

        private static String resolveMessage(Throwable error) {
            if (error == null) {
                return UNKNOWN_MESSAGE;
            }
            if (error.getMessage() != null && !error.getMessage().isBlank()) {
                return error.getMessage();
            }
            return error.toString();
        }

        private static String resolveVendorCode(Throwable error) {
            Throwable current = error;
            while (current != null) {
                if (current instanceof WarehouseException warehouseException
                        && warehouseException.getVendorCode() != null) {
                    return warehouseException.getVendorCode();
                }
                current = current.getCause() == current ? null : current.getCause();
            }
            return null;
        }
    }
}
