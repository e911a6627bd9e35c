package com.custodyledger.api.controller;

import com.custodyledger.common.exception.LedgerException;
import com.custodyledger.common.exception.NotAuthorizedException;
import com.custodyledger.common.exception.ReentrancyRejectedException;
import com.custodyledger.common.exception.TransferFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotAuthorizedException.class)
    public ResponseEntity<Map<String, Object>> handleNotAuthorized(NotAuthorizedException e) {
        return buildLedgerErrorResponse(HttpStatus.FORBIDDEN, e);
    }

    @ExceptionHandler(ReentrancyRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleReentrancy(ReentrancyRejectedException e) {
        return buildLedgerErrorResponse(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(TransferFailedException.class)
    public ResponseEntity<Map<String, Object>> handleTransferFailed(TransferFailedException e) {
        log.warn("Withdrawal failed at transfer: {}", e.getMessage());
        return buildLedgerErrorResponse(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<Map<String, Object>> handleRejection(LedgerException e) {
        return buildLedgerErrorResponse(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred: " + e.getMessage());
    }

    private ResponseEntity<Map<String, Object>> buildLedgerErrorResponse(HttpStatus status, LedgerException e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", e.getMessage());
        error.put("code", e.getCode().name());
        error.put("status", String.valueOf(status.value()));
        error.put("details", e.getDetails());
        return ResponseEntity.status(status).body(error);
    }

    private ResponseEntity<Map<String, Object>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
