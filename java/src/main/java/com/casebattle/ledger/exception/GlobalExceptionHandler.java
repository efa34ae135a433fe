package com.casebattle.ledger.exception;

import com.casebattle.ledger.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidAmountException.class)
    public ResponseEntity<ApiError> handleInvalidAmount(InvalidAmountException e) {
        log.warn("Rejected amount '{}': {}", e.getRawAmount(), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Amount",
                e.getMessage() + ". Enter a positive number, for example 1000 or 1000,50", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing
                ));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleBadRequest(RuntimeException e) {
        log.warn("Bad request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage(), null);
    }

    @ExceptionHandler(LedgerStorageException.class)
    public ResponseEntity<ApiError> handleStorage(LedgerStorageException e) {
        log.error("Ledger storage failure, request aborted", e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
                "The ledger could not be updated, nothing was changed. Please retry later", null);
    }

    private static ResponseEntity<ApiError> build(HttpStatus status, String error, String message,
                                                  Map<String, String> errors) {
        ApiError body = ApiError.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .errors(errors)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
