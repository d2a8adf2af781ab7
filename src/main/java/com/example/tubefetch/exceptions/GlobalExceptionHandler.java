package com.example.tubefetch.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.net.URI;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Global Exception Handler using @RestControllerAdvice.
 * Every error leaves the service as an RFC 7807 Problem Detail that also carries an {@code error}
 * property holding the human-readable message shown by the client.
 * Internal detail (tool output, paths) is logged, never returned.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String TIMESTAMP_PROPERTY = "timestamp";
    static final String ERROR_PROPERTY = "error";
    private static final String ERRORS_PROPERTY = "errors"; // For validation errors

    // --- Application specific exceptions ---

    @ExceptionHandler(JobNotFoundException.class)
    public ProblemDetail handleJobNotFound(JobNotFoundException ex, WebRequest request) {
        log.debug("Job lookup failed for {}: {}", request.getDescription(false), ex.getJobId());
        return problem(HttpStatus.NOT_FOUND, "Download not found", request);
    }

    @ExceptionHandler(JobNotReadyException.class)
    public ProblemDetail handleJobNotReady(JobNotReadyException ex, WebRequest request) {
        log.debug("File requested for job {} in state {}", ex.getJobId(), ex.getState());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), request);
    }

    @ExceptionHandler(ExtractionException.class)
    public ProblemDetail handleExtractionException(ExtractionException ex, WebRequest request) {
        log.warn("Metadata extraction failed for request {}: {}", request.getDescription(false), ex.getMessage(), ex);
        return problem(HttpStatus.BAD_GATEWAY, ex.getMessage(), request);
    }

    @ExceptionHandler(MetadataTimeoutException.class)
    public ProblemDetail handleMetadataTimeout(MetadataTimeoutException ex, WebRequest request) {
        log.warn("Metadata lookup timed out for request {}: {}", request.getDescription(false), ex.getMessage());
        return problem(HttpStatus.GATEWAY_TIMEOUT,
                "Fetching video information took too long. Please try again.", request);
    }

    @ExceptionHandler(WorkspaceStorageException.class)
    public ProblemDetail handleWorkspaceStorageException(WorkspaceStorageException ex, WebRequest request) {
        log.error("Workspace storage operation failed: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "The downloaded file could not be read. Please start the download again.", request);
    }

    @ExceptionHandler(PipelineException.class)
    public ProblemDetail handlePipelineException(PipelineException ex, WebRequest request) {
        // Log the detailed error internally, including tool output if available
        if (ex.getToolOutput() != null && !ex.getToolOutput().isBlank()) {
            log.error("Pipeline failed for request: {} (exit code {}) - output:\n{}",
                    ex.getMessage(), ex.getExitCode(), ex.getToolOutput(), ex);
        } else {
            log.error("Pipeline failed for request: {}", ex.getMessage(), ex);
        }
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "Video processing failed. Please try a different format.", request);
    }

    // --- Bean Validation Exceptions ---

    @ExceptionHandler(ConstraintViolationException.class)
    public ProblemDetail handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Constraint violation for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }

        Map<String, String> errors = ex.getConstraintViolations().stream()
                .collect(Collectors.toMap(
                        violation -> getPropertyName(violation.getPropertyPath().toString()),
                        ConstraintViolation::getMessage,
                        (first, second) -> first,
                        LinkedHashMap::new
                ));

        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST,
                "Input validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERROR_PROPERTY, firstMessageOr(errors, problemDetail.getDetail()));
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return problemDetail;
    }

    // --- General Spring Web Exceptions (Overrides from ResponseEntityExceptionHandler) ---

    // Override for @Valid on @RequestBody
    @Override
    protected ResponseEntity<Object> handleMethodArgumentNotValid(
            @NonNull MethodArgumentNotValidException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Method argument validation failed for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.putIfAbsent(fieldName, error.getDefaultMessage());
        });

        String detail = "Request body validation failed. Check the 'errors' field for details.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(getReasonPhrase(status, "Validation Failed"));
        decorate(problemDetail, firstMessageOr(errors, detail), request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);

        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleHttpRequestMethodNotSupported(
            @NonNull HttpRequestMethodNotSupportedException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("HTTP method not supported for {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(getReasonPhrase(status, "Method Not Allowed"));
        decorate(problemDetail, ex.getMessage(), request);

        String[] supportedMethodsArray = ex.getSupportedMethods();
        if (supportedMethodsArray != null && supportedMethodsArray.length > 0) {
            try {
                Set<HttpMethod> allowedMethods = Arrays.stream(supportedMethodsArray)
                        .map(HttpMethod::valueOf)
                        .collect(Collectors.toSet());
                headers.setAllow(allowedMethods);
            } catch (IllegalArgumentException illegalArgEx) {
                log.error("Could not parse supported HTTP methods provided by exception: {}",
                        Arrays.toString(supportedMethodsArray), illegalArgEx);
            }
        }
        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMediaTypeNotSupported(
            @NonNull HttpMediaTypeNotSupportedException ex,
            @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status,
            @NonNull WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("HTTP media type not supported for {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problemDetail.setTitle(getReasonPhrase(status, "Unsupported Media Type"));
        decorate(problemDetail, ex.getMessage(), request);

        if (!ex.getSupportedMediaTypes().isEmpty()) {
            headers.setAccept(ex.getSupportedMediaTypes());
        }

        return new ResponseEntity<>(problemDetail, headers, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        if (log.isInfoEnabled()) {
            log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                    request.getDescription(false), ex.getStatusCode(), ex.getReason());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        problemDetail.setTitle(getReasonPhrase(ex.getStatusCode()));
        decorate(problemDetail, ex.getReason(), request);
        return problemDetail;
    }

    // --- Generic Fallback Handler and Override for Internal Exceptions ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        // Log ALL unhandled exceptions with full stack trace for internal debugging
        if (log.isErrorEnabled()) {
            log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                    request.getDescription(false), ex);
        }
        return problem(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later.", request);
    }

    /**
     * Ensures the Problem Details produced by the base class (unreadable bodies, missing
     * parameters, unknown paths) carry the same extra properties as ours.
     */
    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        ProblemDetail problemDetailToReturn;

        if (body instanceof ProblemDetail pdBody) {
            problemDetailToReturn = pdBody;
            if (problemDetailToReturn.getTitle() == null) {
                problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail in handleExceptionInternal for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetailToReturn = ProblemDetail.forStatus(statusCode);
            problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            problemDetailToReturn.setDetail(statusCode.is4xxClientError()
                    ? "The request could not be processed."
                    : "An unexpected internal error occurred. Please try again later.");
        }
        Map<String, Object> properties = problemDetailToReturn.getProperties();
        String message = problemDetailToReturn.getDetail() != null
                ? problemDetailToReturn.getDetail()
                : problemDetailToReturn.getTitle();
        if (properties == null || !properties.containsKey(ERROR_PROPERTY)) {
            problemDetailToReturn.setProperty(ERROR_PROPERTY, message);
        }
        if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
            problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        }
        if (problemDetailToReturn.getInstance() == null) {
            problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
        }

        return new ResponseEntity<>(problemDetailToReturn, headers, statusCode);
    }


    // --- Helper Methods ---

    private ProblemDetail problem(HttpStatus status, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(status.getReasonPhrase());
        decorate(problemDetail, detail, request);
        return problemDetail;
    }

    private void decorate(ProblemDetail problemDetail, String errorMessage, WebRequest request) {
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(ERROR_PROPERTY, errorMessage);
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
    }

    private String firstMessageOr(Map<String, String> errors, String fallback) {
        return errors.values().stream()
                .filter(message -> message != null && !message.isBlank())
                .findFirst()
                .orElse(fallback);
    }

    private String getPropertyName(String propertyPath) {
        if (propertyPath == null || propertyPath.isEmpty()) {
            return "unknown";
        }
        int lastDot = propertyPath.lastIndexOf('.');
        int lastBracket = propertyPath.lastIndexOf('[');
        int lastSeparator = Math.max(lastDot, lastBracket);
        return (lastSeparator == -1) ? propertyPath : propertyPath.substring(lastSeparator + 1);
    }

    /**
     * Helper to safely get the standard reason phrase or a fallback.
     */
    private String getReasonPhrase(HttpStatusCode statusCode) {
        return getReasonPhrase(statusCode, "Status");
    }

    private String getReasonPhrase(HttpStatusCode statusCode, String fallbackTitle) {
        if (statusCode instanceof HttpStatus httpStatus) {
            return httpStatus.getReasonPhrase();
        } else {
            return fallbackTitle;
        }
    }
}
