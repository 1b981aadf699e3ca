package com.edudata.authservice.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Either {@code {otpRequired, sessionToken, message}} while the second factor is pending,
 * or {@code {user, token, expiresIn, issuedAt}} once authenticated.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    private Boolean otpRequired;
    private String sessionToken;
    private String message;

    private UserSummary user;
    private String token;
    private Long expiresIn;
    private Instant issuedAt;
}
