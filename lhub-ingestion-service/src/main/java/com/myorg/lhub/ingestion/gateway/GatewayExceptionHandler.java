package com.myorg.lhub.ingestion.gateway;

import com.myorg.lhub.ingestion.namespace.NamespaceAlreadyExistsException;
import com.myorg.lhub.ingestion.namespace.NamespaceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.time.Instant;

/**
 * Maps gateway and admin failures to RFC 7807 {@link ProblemDetail} bodies. Per-event problems
 * never get here: they are reported inside the ingest result.
 */
@Slf4j
@RestControllerAdvice
public class GatewayExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request body is not valid JSON for this endpoint");
    }

    @ExceptionHandler(NamespaceNotFoundException.class)
    public ProblemDetail handleNotFound(NamespaceNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "namespace-not-found", ex.getMessage());
    }

    @ExceptionHandler(NamespaceAlreadyExistsException.class)
    public ProblemDetail handleConflict(NamespaceAlreadyExistsException ex) {
        return problem(HttpStatus.CONFLICT, "Conflict", "namespace-exists", ex.getMessage());
    }

    // unknown routes, wrong methods and the like keep the status Spring MVC assigned
    @ExceptionHandler({ErrorResponseException.class, HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ProblemDetail handleFramework(Exception ex) {
        ProblemDetail body = ((ErrorResponse) ex).getBody();
        body.setProperty("timestamp", Instant.now().toString());
        return body;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create("https://lineage-hub.dev/errors/" + type));
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
