package com.nosota.msettle.exception;

import com.nosota.msettle.dto.ErrorResponse;
import com.nosota.msettle.error.*;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Validation error [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    }

    @ExceptionHandler(AuthorizationException.class)
    public ResponseEntity<ErrorResponse> handleAuthorization(
            AuthorizationException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Authorization error [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(
            InvalidStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid state [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.CONFLICT, "Invalid State", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Insufficient funds error [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Insufficient Funds", ex.getMessage(), request);
    }

    @ExceptionHandler(ExpiredException.class)
    public ResponseEntity<ErrorResponse> handleExpired(
            ExpiredException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Expired [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.CONFLICT, "Expired", ex.getMessage(), request);
    }

    @ExceptionHandler(ThresholdException.class)
    public ResponseEntity<ErrorResponse> handleThreshold(
            ThresholdException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Threshold not met [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, "Threshold Not Met", ex.getMessage(), request);
    }

    @ExceptionHandler(ExternalCallFailedException.class)
    public ResponseEntity<ErrorResponse> handleExternalCallFailed(
            ExternalCallFailedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("External call failed [correlationId={}]: {}", correlationId, ex.getMessage(), ex.getCause());
        return build(HttpStatus.BAD_GATEWAY, "External Call Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "Entity Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Request validation failed [correlationId={}]: {}", MDC.get("correlationId"), message);
        return build(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex, HttpServletRequest request) {
        log.warn("Bad request [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
