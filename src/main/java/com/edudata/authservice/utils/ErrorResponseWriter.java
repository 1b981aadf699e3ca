package com.edudata.authservice.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

@Component
public class ErrorResponseWriter {

    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ErrorResponseWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,              // e.g. "https://edudata.dev/problems/unauthorized"
                      @NonNull String title,
                      @NonNull String reason,
                      @NonNull String detail) throws IOException {
        write(req, resp, status, type, title, reason, detail, Map.of());
    }

    public void write(@NonNull HttpServletRequest req,
                      @NonNull HttpServletResponse resp,
                      @NonNull HttpStatus status,
                      String type,
                      @NonNull String title,
                      @NonNull String reason,
                      @NonNull String detail,
                      @NonNull Map<String, Object> extra) throws IOException {

        if (resp.isCommitted()) return;

        ProblemDetail pd = ProblemDetail.forStatus(status);
        if (type != null && !type.isBlank()) {
            pd.setType(URI.create(type));
        }
        pd.setTitle(title);
        pd.setDetail(detail);
        pd.setInstance(URI.create(req.getRequestURI()));

        // clients of the original API read "message"
        pd.setProperty("message", detail);
        pd.setProperty("reason", reason);
        extra.forEach(pd::setProperty);

        pd.setProperty("timestamp", OffsetDateTime.now(clock).toString());
        pd.setProperty("path", req.getRequestURI());
        String requestId = resolveRequestId(req, resp);
        if (requestId != null) {
            pd.setProperty("requestId", requestId);
        }

        resp.setStatus(status.value());
        resp.setHeader("Cache-Control", "no-store");
        resp.setHeader("Pragma", "no-cache");
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/problem+json");

        objectMapper.writeValue(resp.getOutputStream(), pd);
    }

    private String resolveRequestId(HttpServletRequest req, HttpServletResponse resp) {
        String id = resp.getHeader(REQUEST_ID_HEADER);
        if (id == null || id.isBlank()) {
            id = req.getHeader(REQUEST_ID_HEADER);
        }
        return (id == null || id.isBlank()) ? null : id;
    }
}
