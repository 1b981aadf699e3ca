package com.edudata.authservice.service;

import com.edudata.authservice.entity.UserRole;
import com.edudata.authservice.model.SessionClaims;

import java.util.Optional;
import java.util.UUID;

public interface SessionTokenIssuer {

    String issue(UUID userId, UserRole role);

    /** Signature and expiry check only; no store lookup. Empty for any invalid token. */
    Optional<SessionClaims> verify(String token);

    long getTokenValiditySeconds();
}
