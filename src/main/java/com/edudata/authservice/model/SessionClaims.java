package com.edudata.authservice.model;

import com.edudata.authservice.entity.UserRole;

import java.time.Instant;
import java.util.UUID;

/** Verified content of a session token. */
public record SessionClaims(UUID userId, UserRole role, Instant issuedAt, Instant expiresAt) {
}
