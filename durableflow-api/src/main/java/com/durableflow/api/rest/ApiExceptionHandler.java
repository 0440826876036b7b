package com.durableflow.api.rest;

import com.durableflow.core.exception.AlreadyExistsException;
import com.durableflow.core.exception.ConcurrencyConflictException;
import com.durableflow.core.exception.InvalidStateTransitionException;
import com.durableflow.core.exception.NotFoundException;
import com.durableflow.core.exception.DurableFlowException;
import com.durableflow.core.exception.RegistrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps engine exceptions to HTTP responses.
 *
 * <pre>
 * NotFoundException                      404
 * AlreadyExists, ConcurrencyConflict,
 * InvalidStateTransition                 409
 * RegistrationException, bad arguments   400
 * other engine errors                    500
 * </pre>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({
        AlreadyExistsException.class,
        ConcurrencyConflictException.class,
        InvalidStateTransitionException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(DurableFlowException e) {
        log.info("Request rejected: {} {}", e.getErrorCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(RegistrationException.class)
    public ResponseEntity<ErrorResponse> handleRegistration(RegistrationException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    @ExceptionHandler(DurableFlowException.class)
    public ResponseEntity<ErrorResponse> handleEngineError(DurableFlowException e) {
        log.error("Engine error {}", e.getErrorCode(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }

    public record ErrorResponse(String error, String message) {}
}
