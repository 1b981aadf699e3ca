package com.edudata.authservice.service;

import com.edudata.authservice.dto.LoginRequest;
import com.edudata.authservice.dto.SignupRequest;
import com.edudata.authservice.entity.User;
import com.edudata.authservice.model.AuthOutcome;

import java.util.Optional;
import java.util.UUID;

public interface AuthService {

    AuthOutcome signup(SignupRequest request);

    /** Password check, then either a session token or a one-time-code challenge. */
    AuthOutcome login(LoginRequest request);

    /** Exchanges a challenge session token and its code for a session token. */
    AuthOutcome verifyOtp(String sessionToken, String code);

    /** Issues a new challenge for the user and contact behind {@code sessionToken}. */
    AuthOutcome resendOtp(String sessionToken);

    Optional<User> currentUser(UUID userId);

    /** Profile lookup for staff; callers are gated by role before reaching this. */
    Optional<User> findUser(UUID userId);
}
