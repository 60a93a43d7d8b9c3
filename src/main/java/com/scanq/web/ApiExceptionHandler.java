package com.scanq.web;

import com.scanq.error.ClassifiedError;
import com.scanq.error.ErrorClassifier;
import com.scanq.error.ErrorKind;
import com.scanq.error.ErrorResponse;
import com.scanq.schedule.ScheduleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.OffsetDateTime;

/**
 * Renders failures as {@link ErrorResponse}: 400 for invalid input, 404 for unknown schedules and
 * jobs, 500 for everything else.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final ErrorClassifier errorClassifier;
    private final Clock clock;

    public ApiExceptionHandler(ErrorClassifier errorClassifier, Clock clock) {
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    @ExceptionHandler({ ScheduleNotFoundException.class, JobNotFoundException.class })
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, new ClassifiedError(ErrorKind.DATA_NOT_FOUND, e.getMessage(),
                "The requested resource was not found.", false, null));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> missingParameter(MissingServletRequestParameterException e) {
        return respond(HttpStatus.BAD_REQUEST, new ClassifiedError(ErrorKind.MISSING_PARAMETER, e.getMessage(),
                "Missing required parameter '" + e.getParameterName() + "'.", false, null));
    }

    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class })
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, new ClassifiedError(ErrorKind.VALIDATION_ERROR, e.getMessage(),
                "The request is invalid. Please check the submitted values.", false, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        ClassifiedError classified = errorClassifier.classify(e);
        log.error("Request failed with {}", classified.kind(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, classified);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ClassifiedError classified) {
        return ResponseEntity.status(status).body(ErrorResponse.of(classified, OffsetDateTime.now(clock)));
    }
}
