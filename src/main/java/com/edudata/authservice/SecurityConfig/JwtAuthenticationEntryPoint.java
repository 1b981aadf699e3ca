package com.edudata.authservice.SecurityConfig;

import com.edudata.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.lang.NonNull;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends 401 Unauthorized for unauthenticated requests.
 * Adds RFC 6750 WWW-Authenticate hint when the client attempted Bearer auth.
 */
@Slf4j
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ErrorResponseWriter writer;

    public JwtAuthenticationEntryPoint(ErrorResponseWriter writer) {
        this.writer = writer;
    }

    @Override
    public void commence(@NonNull HttpServletRequest request,
                         @NonNull HttpServletResponse response,
                         @NonNull AuthenticationException authException) throws IOException {
        String ah = request.getHeader("Authorization");
        if (ah != null && ah.startsWith("Bearer ")) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        } else {
            response.setHeader("WWW-Authenticate", "Bearer");
        }

        writer.write(
                request,
                response,
                HttpStatus.UNAUTHORIZED,
                "https://edudata.dev/problems/unauthorized",
                "Unauthorized",
                "Unauthorized",
                "Authentication is required to access this resource."
        );
    }
}
