package com.specforge.orchestrator.api;

import com.specforge.orchestrator.api.dto.ErrorResponse;
import com.specforge.orchestrator.pipeline.PipelineException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.UUID;

/**
 * Renders every API error as an {@link ErrorResponse}.
 *
 * Each error gets a short trace id that appears both in the body and in
 * the log line, so a caller's report can be matched to the server log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(PipelineException ex, HttpServletRequest request) {
        HttpStatus status = ex.getKind() == PipelineException.Kind.SPECIFICATION_MISSING
                ? HttpStatus.NOT_FOUND
                : HttpStatus.UNPROCESSABLE_ENTITY;
        return respond(status, ex.getKind().name(), ex.getMessage(), request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, HttpServletRequest request) {
        return respond(ex.getStatusCode(), codeFor(ex.getStatusCode()), ex.getReason(), request);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MethodArgumentTypeMismatchException.class,
                       IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        String traceId = traceId();
        log.error("[traceId={}] Unhandled error | URI={}", traceId, request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR",
                        "An unexpected error occurred. Quote the trace id when reporting it.",
                        traceId, Instant.now().toString()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ResponseEntity<ErrorResponse> respond(HttpStatusCode status, String code, String message,
                                                  HttpServletRequest request) {
        String traceId = traceId();
        log.warn("[traceId={}] {} {} | URI={}", traceId, status.value(), message, request.getRequestURI());
        return ResponseEntity.status(status)
                .body(new ErrorResponse(code, message, traceId, Instant.now().toString()));
    }

    private static String codeFor(HttpStatusCode status) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved == null ? "HTTP_" + status.value() : resolved.name();
    }

    private static String traceId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
