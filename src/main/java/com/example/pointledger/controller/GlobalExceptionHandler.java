package com.example.pointledger.controller;

import com.example.pointledger.exception.BatchAlreadyTerminalException;
import com.example.pointledger.exception.ConflictingIdempotencyKeyException;
import com.example.pointledger.exception.InsufficientBalanceException;
import com.example.pointledger.exception.InvalidTransferRequestStateException;
import com.example.pointledger.exception.PointBatchNotFoundException;
import com.example.pointledger.exception.TransferRequestAlreadyDecidedException;
import com.example.pointledger.exception.TransferRequestNotFoundException;
import com.example.pointledger.exception.UnauthorizedTransferActionException;
import com.example.pointledger.facade.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({TransferRequestNotFoundException.class, PointBatchNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(UnauthorizedTransferActionException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorizedAction(
            UnauthorizedTransferActionException ex, HttpServletRequest request) {
        log.warn("UnauthorizedTransferActionException: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
    }

    @ExceptionHandler(ConflictingIdempotencyKeyException.class)
    public ResponseEntity<ErrorResponse> handleConflictingIdempotencyKey(
            ConflictingIdempotencyKeyException ex, HttpServletRequest request) {
        log.warn("ConflictingIdempotencyKeyException: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Idempotency Key Conflict", ex.getMessage(), request);
    }

    @ExceptionHandler({TransferRequestAlreadyDecidedException.class, InvalidTransferRequestStateException.class})
    public ResponseEntity<ErrorResponse> handleInvalidTransferRequestState(
            RuntimeException ex, HttpServletRequest request) {
        log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid Transfer Request State", ex.getMessage(), request);
    }

    @ExceptionHandler(BatchAlreadyTerminalException.class)
    public ResponseEntity<ErrorResponse> handleBatchAlreadyTerminal(
            BatchAlreadyTerminalException ex, HttpServletRequest request) {
        log.warn("BatchAlreadyTerminalException: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Batch Already Terminal", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(
            InsufficientBalanceException ex, HttpServletRequest request) {
        log.warn("InsufficientBalanceException: {}", ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Balance", ex.getMessage(), request);
    }

    /**
     * 重試耗盡後仍失敗的暫時性儲存錯誤（鎖等待逾時、死結）
     */
    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<ErrorResponse> handleTransientDataAccess(
            TransientDataAccessException ex, HttpServletRequest request) {
        log.error("TransientDataAccessException after retries: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable",
                "The ledger is temporarily unavailable, please retry", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex, HttpServletRequest request) {
        log.warn("MissingRequestHeaderException: header={}", ex.getHeaderName());
        return build(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Required header '" + ex.getHeaderName() + "' is missing", request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("HttpMessageNotReadableException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request body is not readable", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        log.warn("MethodArgumentNotValidException: validation failed for @RequestBody");

        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> {
                    if (error instanceof FieldError fieldError) {
                        return fieldError.getField() + ": " + error.getDefaultMessage();
                    } else {
                        return error.getDefaultMessage();  // Object-level validation
                    }
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        log.warn("ConstraintViolationException: validation failed for @PathVariable, @RequestParam or @RequestHeader");

        String message = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String propertyPath = violation.getPropertyPath().toString();
                    String paramName = propertyPath.substring(propertyPath.lastIndexOf('.') + 1);
                    return paramName + ": " + violation.getMessage();
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        log.error("Unexpected exception: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
