package com.fleet.backend.exception;

import com.fleet.backend.config.RequestCorrelationFilter;
import com.fleet.backend.dto.ApiError;
import com.fleet.backend.dto.ApiErrorDetail;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getBindingResult().getFieldErrors().stream()
                .map(this::toDetail)
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraint(ConstraintViolationException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getConstraintViolations().stream()
                .map(violation -> ApiErrorDetail.builder()
                        .field(violation.getPropertyPath().toString())
                        .issue(violation.getMessage())
                        .build())
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(HandlerMethodValidationException ex,
                                                           HttpServletRequest request) {
        List<ApiErrorDetail> details = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(error -> ApiErrorDetail.builder()
                                .field(result.getMethodParameter().getParameterName())
                                .issue(error.getDefaultMessage())
                                .build()))
                .collect(Collectors.toList());
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException ex,
                                                           HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field(ex.getParameterName())
                .issue("is required")
                .build());
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field(ex.getName())
                .issue("has an invalid value")
                .build());
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Validation failed", details, request, ex);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request body", List.of(), request, ex);
    }

    @ExceptionHandler(InvalidWindowException.class)
    public ResponseEntity<ApiError> handleInvalidWindow(InvalidWindowException ex, HttpServletRequest request) {
        List<ApiErrorDetail> details = List.of(ApiErrorDetail.builder()
                .field("limit")
                .issue(ex.getMessage())
                .build());
        return buildError(HttpStatus.BAD_REQUEST, "INVALID_WINDOW", ex.getMessage(), details, request, ex);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        return buildError(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", ex.getMessage(), List.of(), request, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "Unexpected error",
                List.of(), request, ex);
    }

    private ApiErrorDetail toDetail(FieldError error) {
        return ApiErrorDetail.builder()
                .field(error.getField())
                .issue(error.getDefaultMessage())
                .build();
    }

    private ResponseEntity<ApiError> buildError(HttpStatus status, String errorCode, String message,
                                                List<ApiErrorDetail> details, HttpServletRequest request,
                                                Exception ex) {
        ApiError error = ApiError.builder()
                .timestamp(Instant.now())
                .path(request.getRequestURI())
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorCode(errorCode)
                .message(message)
                .requestId(MDC.get(RequestCorrelationFilter.MDC_REQUEST_ID))
                .correlationId(MDC.get(RequestCorrelationFilter.MDC_CORRELATION_ID))
                .details(details)
                .build();
        log.warn("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        return ResponseEntity.status(status).body(error);
    }
}
