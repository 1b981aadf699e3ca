package com.edudata.authservice.SecurityConfig;

import com.edudata.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 403 Forbidden for authenticated requests whose role does not match.
 */
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ErrorResponseWriter writer;

    public JwtAccessDeniedHandler(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void handle(@NonNull HttpServletRequest request,
                       @NonNull HttpServletResponse response,
                       @NonNull AccessDeniedException accessDeniedException) throws IOException {
        writer.write(
                request,
                response,
                HttpStatus.FORBIDDEN,
                "https://edudata.dev/problems/forbidden",
                "Forbidden",
                "Forbidden",
                "You do not have permission to access this resource."
        );
    }
}
