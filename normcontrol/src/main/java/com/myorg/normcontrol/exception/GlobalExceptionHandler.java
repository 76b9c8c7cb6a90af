package com.myorg.normcontrol.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Maps pipeline errors to JSON error responses. A failing compliance verdict is not an error
 * and never reaches this class.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final String MALFORMED_REQUEST = "malformed_request";
    static final String UPLOAD_TOO_LARGE = "upload_too_large";
    static final String IO_ERROR = "io_error";
    static final String UNEXPECTED = "unexpected_error";

    // --- Helpers ---
    private String safeMessage(String raw) {
        return (raw == null || raw.isBlank()) ? "No additional details" : raw;
    }

    private String safeUri(HttpServletRequest request) {
        return request == null ? "unknown" : Objects.toString(request.getRequestURI(), "unknown");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String kind, String message,
                                                String collaborator, String path) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(ZonedDateTime.now(ZoneId.of("UTC")))
                .status(status.value())
                .error(status.getReasonPhrase())
                .errorKind(kind)
                .message(message)
                .collaborator(collaborator)
                .path(path)
                .build();
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }

    private ResponseEntity<ErrorResponse> logAndBuild(Exception ex, HttpStatus status, String kind,
                                                      String message, String collaborator,
                                                      HttpServletRequest request) {
        String uri = safeUri(request);
        String msg = safeMessage(message);

        if (status.is4xxClientError()) {
            log.warn("Client error [{}] for {}: {} - {}", status.value(), uri, msg, ex == null ? "" : ex.toString());
        } else {
            log.error("Server error [{}] for {}: {}", status.value(), uri, msg, ex);
        }
        return build(status, kind, msg, collaborator, uri);
    }

    // --- Handlers ---
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.BAD_REQUEST, ex.getErrorKind(), ex.getMessage(), null, request);
    }

    @ExceptionHandler(ReportNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ReportNotFoundException ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.NOT_FOUND, ex.getErrorKind(), ex.getMessage(), null, request);
    }

    @ExceptionHandler(CollaboratorUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleCollaborator(CollaboratorUnavailableException ex,
                                                            HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorKind(), ex.getMessage(),
                ex.getCollaborator(), request);
    }

    @ExceptionHandler(NormControlException.class)
    public ResponseEntity<ErrorResponse> handlePipeline(NormControlException ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorKind(), ex.getMessage(), null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex,
                                                          HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.BAD_REQUEST, MALFORMED_REQUEST, "Request body is not valid JSON", null, request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex,
                                                           HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.BAD_REQUEST, MALFORMED_REQUEST,
                "Missing required part: " + safeMessage(ex.getRequestPartName()), null, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxSize(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.PAYLOAD_TOO_LARGE, UPLOAD_TOO_LARGE, "Uploaded file is too large", null, request);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIOException(IOException ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.INTERNAL_SERVER_ERROR, IO_ERROR, "I/O error: " + safeMessage(ex.getMessage()), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        return logAndBuild(ex, HttpStatus.INTERNAL_SERVER_ERROR, UNEXPECTED,
                "Unexpected error occurred: " + safeMessage(ex.getMessage()), null, request);
    }
}
