package com.chaski.deliveryservice.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@ControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(DeliveryException.class)
    public ResponseEntity<Map<String, Object>> handleDeliveryException(DeliveryException ex) {
        HttpStatus status = statusFor(ex.getKind());
        log.warn("Request rejected: kind={}, message={}", ex.getKind(), ex.getMessage());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (ex.getKind() == ErrorKind.BUSY) {
            // Lock waits are a few seconds at most
            response.header(HttpHeaders.RETRY_AFTER, "1");
        }
        return response.body(body(ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler(ServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleServiceUnavailable(ServiceUnavailableException ex) {
        log.error("Collaborator {} unavailable: {}", ex.getService(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body("SERVICE_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(err ->
                fieldErrors.put(err.getField(), err.getDefaultMessage()));

        log.warn("Validation failed: {}", fieldErrors);

        Map<String, Object> body = body("VALIDATION_ERROR", "Validation error");
        body.put("errors", fieldErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("VALIDATION_ERROR", ex.getMessage()));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_OWNER, COURIER_NOT_ELIGIBLE -> HttpStatus.FORBIDDEN;
            case INVALID_TRANSITION, PACKAGE_NOT_BIDDABLE, DUPLICATE_BID, ALREADY_TERMINAL -> HttpStatus.CONFLICT;
            case BUSY -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static Map<String, Object> body(String kind, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("kind", kind);
        body.put("message", message);
        return body;
    }
}
