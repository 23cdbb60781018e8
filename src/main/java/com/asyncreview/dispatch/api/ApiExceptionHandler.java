package com.asyncreview.dispatch.api;

import com.asyncreview.core.AsyncReviewException;
import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.llm.ModelInvocationException;
import com.asyncreview.core.session.SessionNotFoundException;
import com.asyncreview.provider.TransientProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Maps the exception hierarchy to HTTP responses with an {@code {"error": ...}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(SessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<Map<String, String>> badRequest(InvalidInputException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(TransientProviderException.class)
    public ResponseEntity<Map<String, String>> providerFailure(TransientProviderException e) {
        log.warn("Provider call failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, String>> busy(RejectedExecutionException e) {
        log.warn("Question stream rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Too many questions in progress, retry later"));
    }

    @ExceptionHandler({ModelInvocationException.class, AsyncReviewException.class})
    public ResponseEntity<Map<String, String>> internal(AsyncReviewException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
