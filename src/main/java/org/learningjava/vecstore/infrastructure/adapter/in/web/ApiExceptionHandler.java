package org.learningjava.vecstore.infrastructure.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import org.learningjava.vecstore.domain.exception.BackendException;
import org.learningjava.vecstore.domain.exception.ConversionException;
import org.learningjava.vecstore.domain.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps store failures to HTTP responses: caller mistakes are 400, backend failures 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorResponse(String error, String message) {
    }

    @ExceptionHandler({ValidationException.class, ConversionException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(RuntimeException ex, HttpServletRequest request) {
        log.warn("[{}] {} - rejected: {}", request.getMethod(), request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ex.getClass().getSimpleName(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError first = ex.getBindingResult().getFieldError();
        String message = first != null ? first.getField() + " " + first.getDefaultMessage() : "invalid request";
        log.warn("[{}] {} - invalid body: {}", request.getMethod(), request.getRequestURI(), message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("ValidationException", message));
    }

    @ExceptionHandler(BackendException.class)
    public ResponseEntity<ErrorResponse> backend(BackendException ex, HttpServletRequest request) {
        log.error("[{}] {} - backend failure: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(new ErrorResponse("BackendException", ex.getMessage()));
    }
}
