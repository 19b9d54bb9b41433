package dao.tron.claim.controller;

import dao.tron.claim.exception.ClaimErrorKind;
import dao.tron.claim.exception.ClaimException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class ClaimExceptionHandler {

    @ExceptionHandler(ClaimException.class)
    public ResponseEntity<Map<String, Object>> handleClaim(ClaimException e) {
        return error(statusOf(e.getKind()), e.getKind().name(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is required")
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", message);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Missing header " + e.getHeaderName());
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        log.warn("Request rejected: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getMessage());
    }

    static HttpStatus statusOf(ClaimErrorKind kind) {
        return switch (kind) {
            case INVALID_PROOF -> HttpStatus.BAD_REQUEST;
            case ALREADY_CLAIMED -> HttpStatus.CONFLICT;
            case CLAIMS_PAUSED -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case TRANSFER_FAILED -> HttpStatus.BAD_GATEWAY;
            case TRANSFER_UNCONFIRMED -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ERROR");
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
