package com.flagship.celebration_ledger.celebration.exception;

import com.flagship.celebration_ledger.compliance.ContributionRejectedException;
import com.flagship.celebration_ledger.compliance.LimitUndeterminedException;
import com.flagship.celebration_ledger.compliance.RejectionReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain failures to HTTP responses with a consistent error body.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body could not be parsed", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request",
                "Invalid value for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(UnknownRecordException.class)
    public ResponseEntity<ErrorResponse> handleUnknownRecord(UnknownRecordException e) {
        log.info("Unknown celebration: {}", e.getReference());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
        log.info("Invalid transition: {}", e.getMessage());
        Map<String, String> details = new HashMap<>();
        details.put("from", String.valueOf(e.getFrom()));
        details.put("to", String.valueOf(e.getTo()));
        return respond(HttpStatus.CONFLICT, "Invalid Transition", e.getMessage(), details);
    }

    @ExceptionHandler(ContributionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleRejected(ContributionRejectedException e) {
        Map<String, String> details = new HashMap<>();
        details.put("reason", e.getReason().name());
        if (e.getRemaining() != null) {
            details.put("remaining", e.getRemaining().toPlainString());
        }
        if (e.getReason() == RejectionReason.LIMIT_UNDETERMINED) {
            return respond(HttpStatus.SERVICE_UNAVAILABLE, "Limit Undetermined", e.getMessage(), details);
        }
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Contribution Rejected", e.getMessage(), details);
    }

    @ExceptionHandler(LimitUndeterminedException.class)
    public ResponseEntity<ErrorResponse> handleLimitUndetermined(LimitUndeterminedException e) {
        log.warn("Limit undetermined for {}: {}", e.getJurisdiction(), e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Limit Undetermined", e.getMessage(),
                Map.of("jurisdiction", String.valueOf(e.getJurisdiction())));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message,
                                                         Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
