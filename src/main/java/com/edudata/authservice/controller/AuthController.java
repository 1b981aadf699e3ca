package com.edudata.authservice.controller;

import com.edudata.authservice.SecurityConfig.AuthenticatedUser;
import com.edudata.authservice.dto.LoginRequest;
import com.edudata.authservice.dto.LoginResponse;
import com.edudata.authservice.dto.ResendOtpRequest;
import com.edudata.authservice.dto.ResendOtpResponse;
import com.edudata.authservice.dto.SignupRequest;
import com.edudata.authservice.dto.SignupResponse;
import com.edudata.authservice.dto.UserSummary;
import com.edudata.authservice.dto.VerifyOTPRequest;
import com.edudata.authservice.exception.AuthExceptions;
import com.edudata.authservice.exception.RequestExceptions;
import com.edudata.authservice.exception.UserExceptions;
import com.edudata.authservice.model.AuthOutcome;
import com.edudata.authservice.service.AuthService;
import com.edudata.authservice.service.SessionTokenIssuer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.UUID;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    static final String OTP_SENT = "OTP sent to registered contact (phone/email).";
    static final String OTP_RESENT = "OTP resent";
    static final String SIGNED_UP = "User created. Please login to receive OTP.";

    private final AuthService authService;
    private final SessionTokenIssuer sessionTokenIssuer;
    private final Clock clock;

    @Operation(summary = "Register an account")
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request) {
        AuthOutcome outcome = authService.signup(request);

        SignupResponse body;
        if (outcome instanceof AuthOutcome.SignedUp) {
            body = SignupResponse.builder()
                    .ok(true)
                    .message(SIGNED_UP)
                    .build();
        } else if (outcome instanceof AuthOutcome.TokenIssued issued) {
            body = SignupResponse.builder()
                    .user(UserSummary.from(issued.user()))
                    .token(issued.token())
                    .build();
        } else {
            throw failureOf(outcome);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @Operation(summary = "Check password; sends a one-time code when the second factor is on")
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        AuthOutcome outcome = authService.login(request);

        if (outcome instanceof AuthOutcome.ChallengeIssued challenge) {
            return ResponseEntity.ok(LoginResponse.builder()
                    .otpRequired(true)
                    .sessionToken(challenge.sessionToken())
                    .message(OTP_SENT)
                    .build());
        }
        return ResponseEntity.ok(authenticated(outcome));
    }

    @Operation(summary = "Exchange a session token and one-time code for a bearer token")
    @PostMapping("/verify-otp")
    public ResponseEntity<LoginResponse> verifyOtp(@Valid @RequestBody VerifyOTPRequest request) {
        AuthOutcome outcome = authService.verifyOtp(request.getSessionToken(), request.getCode());
        return ResponseEntity.ok(authenticated(outcome));
    }

    @Operation(summary = "Issue a fresh one-time code for an open session")
    @PostMapping({"/resend-otp", "/resend-otp-email"})
    public ResponseEntity<ResendOtpResponse> resendOtp(@Valid @RequestBody ResendOtpRequest request) {
        AuthOutcome outcome = authService.resendOtp(request.getSessionToken());

        if (outcome instanceof AuthOutcome.ChallengeIssued challenge) {
            return ResponseEntity.ok(new ResendOtpResponse(challenge.sessionToken(), OTP_RESENT));
        }
        throw failureOf(outcome);
    }

    @Operation(summary = "Current user profile", security = @SecurityRequirement(name = "bearerAuth"))
    @GetMapping("/me")
    public ResponseEntity<UserSummary> me(@AuthenticationPrincipal AuthenticatedUser principal) {
        if (principal == null) {
            throw new AuthExceptions.Unauthorized("Not authenticated");
        }
        return authService.currentUser(principal.userId())
                .map(UserSummary::profileOf)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }

    @Operation(summary = "Profile of another user (TEACHER or ADMIN)", security = @SecurityRequirement(name = "bearerAuth"))
    @GetMapping("/users/{userId}")
    public ResponseEntity<UserSummary> user(@PathVariable UUID userId) {
        return authService.findUser(userId)
                .map(UserSummary::profileOf)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new UserExceptions.UserNotFound("User not found"));
    }

    private LoginResponse authenticated(AuthOutcome outcome) {
        if (outcome instanceof AuthOutcome.TokenIssued issued) {
            return LoginResponse.builder()
                    .user(UserSummary.from(issued.user()))
                    .token(issued.token())
                    .expiresIn(sessionTokenIssuer.getTokenValiditySeconds())
                    .issuedAt(clock.instant())
                    .build();
        }
        throw failureOf(outcome);
    }

    private static RuntimeException failureOf(AuthOutcome outcome) {
        if (outcome instanceof AuthOutcome.Throttled throttled) {
            return new RequestExceptions.RateLimited(throttled.retryAfterMinutes());
        }
        if (outcome instanceof AuthOutcome.Rejected rejected) {
            return AuthExceptions.of(rejected.reason());
        }
        return new IllegalStateException("Unexpected auth outcome " + outcome.getClass().getSimpleName());
    }
}
