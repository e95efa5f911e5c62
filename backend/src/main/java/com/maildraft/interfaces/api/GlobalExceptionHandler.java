package com.maildraft.interfaces.api;

import com.maildraft.application.email.EmailGenerationException;
import com.maildraft.domain.email.model.FailureKind;
import com.maildraft.domain.email.model.PipelineOutcome;
import com.maildraft.global.filter.CorrelationIdFilter;
import com.maildraft.interfaces.api.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EmailGenerationException.class)
    public ResponseEntity<ErrorResponse> handleEmailGeneration(EmailGenerationException e) {
        PipelineOutcome.Failure failure = e.getFailure();
        return ResponseEntity.status(statusOf(failure.kind()))
                .body(new ErrorResponse(failure.reasonCode(), failure.message(), failure.correlationId()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getDefaultMessage())
                .orElse("Request is invalid");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", message, correlationId()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("VALIDATION_ERROR", "Request body is not readable", correlationId()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", "Internal server error, please try again later", correlationId()));
    }

    static HttpStatus statusOf(FailureKind kind) {
        return switch (kind) {
            case INPUT_REJECTED -> HttpStatus.BAD_REQUEST;
            case OUTPUT_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case MALFORMED_OUTPUT -> HttpStatus.BAD_GATEWAY;
            case GENERATION_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private static String correlationId() {
        return MDC.get(CorrelationIdFilter.MDC_KEY);
    }
}
