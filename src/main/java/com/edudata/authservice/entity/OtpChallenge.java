package com.edudata.authservice.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * One issued one-time code.
 * <ul>
 *   <li>Only the HMAC of the code is stored ({@code codeHash}); the plaintext never is.</li>
 *   <li>{@code expiresAt = createdAt + OTC ttl}.</li>
 *   <li>Immutable apart from {@code used}, which is flipped once by a conditional update
 *       in {@link com.edudata.authservice.repository.OtpChallengeRepository#markUsed}.</li>
 * </ul>
 */
@Entity
@Table(
        name = "otp_challenges",
        indexes = {
                @Index(name = "ux_otp_token", columnList = "token", unique = true),
                @Index(name = "ix_otp_contact_created", columnList = "contact, created_at"),
                @Index(name = "ix_otp_expires", columnList = "expires_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
@ToString(exclude = {"token", "codeHash"})
public class OtpChallenge {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Opaque capability handed to the client (64 hex chars). */
    @Column(name = "token", nullable = false, unique = true, length = 64, updatable = false)
    private String token;

    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "user_id", nullable = false, length = 36, updatable = false)
    private UUID userId;

    @Column(name = "contact", nullable = false, length = 320, updatable = false)
    private String contact;

    @Column(name = "code_hash", nullable = false, length = 64, updatable = false)
    private String codeHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
