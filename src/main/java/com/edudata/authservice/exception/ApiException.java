package com.edudata.authservice.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception carrying HTTP semantics for RFC 7807 responses.
 * Thrown at the web boundary only; GlobalExceptionHandler maps them.
 */
@Getter
public abstract class ApiException extends RuntimeException {

    private final HttpStatus status;
    private final String type;   // e.g., https://edudata.dev/problems/rate-limited
    private final String title;  // short summary for ProblemDetail title
    private final String reason; // machine-readable code, e.g. "AlreadyUsed"
    private final Map<String, Object> properties = new LinkedHashMap<>();

    protected ApiException(HttpStatus status, String type, String title, String reason, String detail) {
        super(detail);
        this.status = status;
        this.type = type;
        this.title = title;
        this.reason = reason;
    }

    protected void addProperty(String name, Object value) {
        properties.put(name, value);
    }

    /** Extra ProblemDetail members beyond the standard ones. */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }
}
