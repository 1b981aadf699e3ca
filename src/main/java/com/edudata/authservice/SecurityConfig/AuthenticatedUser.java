package com.edudata.authservice.SecurityConfig;

import com.edudata.authservice.entity.UserRole;

import java.security.Principal;
import java.util.UUID;

/** Principal placed in the SecurityContext by {@link JwtAuthFilterConfig}. */
public record AuthenticatedUser(UUID userId, UserRole role) implements Principal {

    @Override
    public String getName() {
        return userId.toString();
    }
}
