package com.storefront.orders.api;

import com.storefront.orders.compliance.SecretMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps order processing errors to HTTP statuses. Every error body is
 * {@code { "error": CODE, "message": ... }}; validation failures carry per-field details instead.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", messageOf(ex)));
    }

    @ExceptionHandler(OrderProcessingException.class)
    public ResponseEntity<Map<String, String>> handleOrderProcessing(OrderProcessingException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Order processing failed: code={} message={}", ex.getErrorCode(), SecretMasker.maskMessage(ex.getMessage()), ex);
        } else {
            log.info("Order request rejected: code={} message={}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity
                .status(status)
                .body(Map.of("error", ex.getErrorCode(), "message", messageOf(ex)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    static HttpStatus statusFor(OrderProcessingException ex) {
        if (ex instanceof InvalidTransitionException || ex instanceof OrderConcurrentModificationException
                || ex instanceof InsufficientStockException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof CaptureException || ex instanceof ReturnNotEligibleException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof GatewayUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (ex instanceof PaymentExpiredException) {
            return HttpStatus.GONE;
        }
        if (ex instanceof RefundFailedException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (ex instanceof OrderNotFoundException || ex instanceof ReturnRequestNotFoundException
                || ex instanceof UnknownPaymentReferenceException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof ForbiddenActionException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof InvalidWebhookSignatureException || ex instanceof MissingPrincipalException) {
            return HttpStatus.UNAUTHORIZED;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String messageOf(Throwable ex) {
        return ex.getMessage() != null ? SecretMasker.maskMessage(ex.getMessage()) : ex.getClass().getSimpleName();
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return SecretMasker.maskMessage(t.getMessage());
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
