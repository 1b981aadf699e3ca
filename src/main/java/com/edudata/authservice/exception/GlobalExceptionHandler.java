package com.edudata.authservice.exception;

import com.edudata.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseWriter writer;

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        log.debug("ApiException: status={}, reason={}, detail={}",
                ex.getStatus(), ex.getReason(), ex.getMessage());
        if (ex instanceof RequestExceptions.RateLimited rl) {
            resp.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(rl.getRetryAfterMinutes() * 60));
        }
        writer.write(req, resp, ex.getStatus(), ex.getType(), ex.getTitle(), ex.getReason(),
                safeDetail(ex.getMessage()), ex.getProperties());
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var details = ex.getBindingResult().getFieldErrors().stream()
                .limit(5) // keep payload small
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"))
                .collect(Collectors.joining("; "));
        writeValidation(req, resp, details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        writeValidation(req, resp, details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler({ HttpMessageNotReadableException.class, MissingRequestHeaderException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writeValidation(req, resp, "Malformed or missing request body.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writeValidation(req, resp, ex.getName() + ": invalid value");
    }

    // ---------- HTTP mapping errors (JSON, not HTML) ----------

    @ExceptionHandler(NoResourceFoundException.class)
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull NoResourceFoundException ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND,
                "https://edudata.dev/problems/not-found",
                "Not Found",
                "NotFound",
                "No handler for " + req.getRequestURI());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED,
                "https://edudata.dev/problems/method-not-allowed",
                "Method Not Allowed",
                "MethodNotAllowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                "https://edudata.dev/problems/unsupported-media-type",
                "Unsupported Media Type",
                "UnsupportedMediaType",
                "Content type is not supported.");
    }

    // ---------- Storage ----------

    @ExceptionHandler(ChallengePersistenceException.class)
    public void handlePersistence(@NonNull HttpServletRequest req,
                                  @NonNull HttpServletResponse resp,
                                  @NonNull ChallengePersistenceException ex) throws IOException {
        log.error("Challenge store failure on {}", req.getRequestURI(), ex);
        writeInternal(req, resp);
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        // Log full for ops; respond generic to the client
        log.error("Unhandled exception", ex);
        writeInternal(req, resp);
    }

    // ---------- helpers ----------

    private void writeValidation(HttpServletRequest req, HttpServletResponse resp, String detail) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                "https://edudata.dev/problems/validation-error",
                "Validation Error",
                "ValidationError",
                detail);
    }

    private void writeInternal(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR,
                "https://edudata.dev/problems/internal-error",
                "Internal Server Error",
                "InternalError",
                "An unexpected error occurred. Please try again later.");
    }

    private String safeDetail(String s) {
        return (s == null || s.isBlank()) ? "Request could not be processed." : s;
    }
}
