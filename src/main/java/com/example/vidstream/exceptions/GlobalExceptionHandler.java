package com.example.vidstream.exceptions;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.*;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
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
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Global Exception Handler using @RestControllerAdvice.
 * Maps the queue, catalog and delivery error taxonomy onto RFC 7807 Problem Details.
 * Extends ResponseEntityExceptionHandler to leverage Spring's handling of common web exceptions.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TIMESTAMP_PROPERTY = "timestamp";
    private static final String ERRORS_PROPERTY = "errors";
    private static final String JOB_ID_PROPERTY = "jobId";

    // --- Queue / catalog / delivery exceptions ---

    @ExceptionHandler(ResourceNotFoundException.class)
    public ProblemDetail handleResourceNotFoundException(ResourceNotFoundException ex, WebRequest request) {
        log.debug("Resource not found for {}: {}", request.getDescription(false), ex.getMessage());
        return buildProblemDetail(HttpStatus.NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidProfileException.class)
    public ProblemDetail handleInvalidProfileException(InvalidProfileException ex, WebRequest request) {
        log.warn("Invalid profile requested for {}: {}", request.getDescription(false), ex.getMessage());
        return buildProblemDetail(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
    }

    @ExceptionHandler(JobConflictException.class)
    public ProblemDetail handleJobConflictException(JobConflictException ex, WebRequest request) {
        log.warn("Job conflict for {}: {}", request.getDescription(false), ex.getMessage());
        ProblemDetail problemDetail = buildProblemDetail(HttpStatus.CONFLICT, ex.getMessage(), request);
        if (ex.getJobId() != null) {
            problemDetail.setProperty(JOB_ID_PROPERTY, ex.getJobId());
        }
        return problemDetail;
    }

    @ExceptionHandler(SegmentDeliveryException.class)
    public ProblemDetail handleSegmentDeliveryException(SegmentDeliveryException ex, WebRequest request) {
        log.error("CRITICAL: Registered rendition file unreadable for {}: {}",
                request.getDescription(false), ex.getMessage(), ex);
        return buildProblemDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "The requested media could not be read. Please contact support if the problem persists.", request);
    }

    @ExceptionHandler(VideoStorageException.class)
    public ProblemDetail handleVideoStorageException(VideoStorageException ex, WebRequest request) {
        log.error("Video storage operation failed: {}", ex.getMessage(), ex);
        return buildProblemDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Failed to process video storage operation. Please contact support if the problem persists.", request);
    }

    @ExceptionHandler(FfmpegProcessingException.class)
    public ProblemDetail handleFfmpegProcessingException(FfmpegProcessingException ex, WebRequest request) {
        if (ex.getStderrOutput() != null && !ex.getStderrOutput().isBlank()) {
            log.error("FFmpeg processing failed for request: {} - FFmpeg stderr:\n{}",
                    ex.getMessage(), ex.getStderrOutput(), ex);
        } else {
            log.error("FFmpeg processing failed for request: {}", ex.getMessage(), ex);
        }
        return buildProblemDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Video processing failed. Please check the video format or contact support if the problem persists.", request);
    }

    // --- Spring Security Exceptions ---

    @ExceptionHandler(AccessDeniedException.class)
    public ProblemDetail handleAccessDeniedException(AccessDeniedException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Access Denied for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        return buildProblemDetail(HttpStatus.FORBIDDEN,
                "Access Denied. You do not have sufficient permissions to access this resource.", request);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ProblemDetail handleAuthenticationException(AuthenticationException ex, WebRequest request) {
        if (log.isWarnEnabled()) {
            log.warn("Authentication failure for request {}: {}",
                    request.getDescription(false), ex.getMessage());
        }
        return buildProblemDetail(HttpStatus.UNAUTHORIZED,
                "Authentication failed. Please check your credentials or log in.", request);
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
                        (first, second) -> first
                ));

        ProblemDetail problemDetail = buildProblemDetail(HttpStatus.BAD_REQUEST,
                "Input validation failed. Check the 'errors' field for details.", request);
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        return problemDetail;
    }

    // --- General Spring Web Exceptions (Overrides from ResponseEntityExceptionHandler) ---

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
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ProblemDetail problemDetail = ProblemDetail.forStatus(status);
        problemDetail.setTitle(getReasonPhrase(status, "Validation Failed"));
        problemDetail.setDetail("Request body validation failed. Check the 'errors' field for details.");
        problemDetail.setProperty(ERRORS_PROPERTY, errors);
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());

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
        ProblemDetail problemDetail = ProblemDetail.forStatus(status);
        problemDetail.setTitle(getReasonPhrase(status, "Method Not Allowed"));
        problemDetail.setDetail(ex.getMessage());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());

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

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatusException(ResponseStatusException ex, WebRequest request) {
        if (log.isInfoEnabled()) {
            log.info("Handling ResponseStatusException for {}: Status={}, Reason={}",
                    request.getDescription(false), ex.getStatusCode(), ex.getReason());
        }
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        problemDetail.setTitle(getReasonPhrase(ex.getStatusCode()));
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
    }

    // --- Generic Fallback Handler and Override for Internal Exceptions ---

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGenericException(Exception ex, WebRequest request) {
        if (log.isErrorEnabled()) {
            log.error("Unhandled exception caught by @ExceptionHandler(Exception.class) for request {}:",
                    request.getDescription(false), ex);
        }
        return buildProblemDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected internal error occurred. Please try again later or contact support.", request);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        ProblemDetail problemDetailToReturn;

        if (body instanceof ProblemDetail pdBody) {
            problemDetailToReturn = pdBody;
            Map<String, Object> properties = problemDetailToReturn.getProperties();
            if (properties == null || !properties.containsKey(TIMESTAMP_PROPERTY)) {
                problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
            }
            if (problemDetailToReturn.getInstance() == null) {
                problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            }
            if (problemDetailToReturn.getTitle() == null) {
                problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            }
        } else {
            log.warn("Creating basic ProblemDetail in handleExceptionInternal for exception type {}: {}",
                    ex.getClass().getSimpleName(), ex.getMessage());
            problemDetailToReturn = ProblemDetail.forStatus(statusCode);
            problemDetailToReturn.setTitle(getReasonPhrase(statusCode));
            String detail = (ex.getCause() != null) ? ex.getCause().getMessage() : ex.getMessage();
            problemDetailToReturn.setDetail(detail);
            problemDetailToReturn.setInstance(URI.create(request.getDescription(false)));
            problemDetailToReturn.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        }

        return new ResponseEntity<>(problemDetailToReturn, headers, statusCode);
    }

    // --- Helper Methods ---

    private ProblemDetail buildProblemDetail(HttpStatus status, String detail, WebRequest request) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(status.getReasonPhrase());
        problemDetail.setInstance(URI.create(request.getDescription(false)));
        problemDetail.setProperty(TIMESTAMP_PROPERTY, Instant.now());
        return problemDetail;
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
