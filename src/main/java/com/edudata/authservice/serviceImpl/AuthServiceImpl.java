package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.dto.LoginRequest;
import com.edudata.authservice.dto.SignupRequest;
import com.edudata.authservice.entity.OtpChallenge;
import com.edudata.authservice.entity.User;
import com.edudata.authservice.entity.UserRole;
import com.edudata.authservice.model.AuthFailure;
import com.edudata.authservice.model.AuthOutcome;
import com.edudata.authservice.model.DeliveryResult;
import com.edudata.authservice.model.GeneratedOtc;
import com.edudata.authservice.model.MarkUsedResult;
import com.edudata.authservice.model.RateLimitDecision;
import com.edudata.authservice.service.AuthService;
import com.edudata.authservice.service.ChallengeStore;
import com.edudata.authservice.service.IdentityStore;
import com.edudata.authservice.service.NotificationDispatcher;
import com.edudata.authservice.service.OtcGenerator;
import com.edudata.authservice.service.PasswordVerifier;
import com.edudata.authservice.service.RateLimiter;
import com.edudata.authservice.service.SessionTokenIssuer;
import com.edudata.authservice.utils.ContactMasking;
import com.edudata.authservice.utils.OtcHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Password, then one-time code, then session token.
 * <p>
 * Every step returns an {@link AuthOutcome}; the controller decides on status codes.
 * No state is kept in this class between requests: challenges, counters and single-use
 * flags all live in the {@link ChallengeStore}.
 */
@Slf4j
@Service
public class AuthServiceImpl implements AuthService {

    private final IdentityStore identityStore;
    private final PasswordVerifier passwordVerifier;
    private final RateLimiter rateLimiter;
    private final OtcGenerator otcGenerator;
    private final OtcHasher otcHasher;
    private final ChallengeStore challengeStore;
    private final NotificationDispatcher notificationDispatcher;
    private final SessionTokenIssuer sessionTokenIssuer;
    private final AuthProperties properties;
    private final Clock clock;

    /** Compared against when the identifier is unknown, so both rejections cost one BCrypt check. */
    private final String dummyPasswordHash;

    public AuthServiceImpl(IdentityStore identityStore,
                           PasswordVerifier passwordVerifier,
                           RateLimiter rateLimiter,
                           OtcGenerator otcGenerator,
                           OtcHasher otcHasher,
                           ChallengeStore challengeStore,
                           NotificationDispatcher notificationDispatcher,
                           SessionTokenIssuer sessionTokenIssuer,
                           AuthProperties properties,
                           Clock clock) {
        this.identityStore = identityStore;
        this.passwordVerifier = passwordVerifier;
        this.rateLimiter = rateLimiter;
        this.otcGenerator = otcGenerator;
        this.otcHasher = otcHasher;
        this.challengeStore = challengeStore;
        this.notificationDispatcher = notificationDispatcher;
        this.sessionTokenIssuer = sessionTokenIssuer;
        this.properties = properties;
        this.clock = clock;
        this.dummyPasswordHash = passwordVerifier.hash(UUID.randomUUID().toString());
    }

    // ==== Signup ====

    @Override
    public AuthOutcome signup(SignupRequest request) {
        if (request == null
                || !StringUtils.hasText(request.getIdentifier())
                || !StringUtils.hasText(request.getPassword())
                || !StringUtils.hasText(request.getDisplayName())) {
            return AuthOutcome.rejected(AuthFailure.VALIDATION);
        }

        UserRole role = request.getRole() != null ? request.getRole() : UserRole.STUDENT;
        if (role == UserRole.ADMIN) {
            log.debug("Signup rejected: ADMIN role cannot be self-assigned");
            return AuthOutcome.rejected(AuthFailure.VALIDATION);
        }

        if (identityStore.existsByIdentifier(request.getIdentifier())) {
            log.debug("Signup rejected: duplicate identifier");
            return AuthOutcome.rejected(AuthFailure.DUPLICATE_IDENTIFIER);
        }

        User user = User.builder()
                .identifier(request.getIdentifier())
                .displayName(request.getDisplayName().trim())
                .passwordHash(passwordVerifier.hash(request.getPassword()))
                .role(role)
                .contact(StringUtils.hasText(request.getContact()) ? request.getContact().trim() : null)
                .build();

        User saved;
        try {
            saved = identityStore.save(user);
        } catch (DataIntegrityViolationException e) {
            // lost a race against a concurrent signup with the same identifier
            log.debug("Signup rejected on unique constraint: {}", e.getMostSpecificCause().getMessage());
            return AuthOutcome.rejected(AuthFailure.DUPLICATE_IDENTIFIER);
        }
        log.info("User registered id={} role={}", saved.getId(), saved.getRole());

        if (!properties.isSecondFactorEnabled()) {
            return issueToken(saved);
        }
        return new AuthOutcome.SignedUp(saved);
    }

    // ==== Login ====

    @Override
    public AuthOutcome login(LoginRequest request) {
        if (request == null
                || !StringUtils.hasText(request.getIdentifier())
                || !StringUtils.hasText(request.getPassword())) {
            return AuthOutcome.rejected(AuthFailure.VALIDATION);
        }

        Optional<User> found = identityStore.findUserByIdentifier(request.getIdentifier());
        if (found.isEmpty()) {
            passwordVerifier.verify(request.getPassword(), dummyPasswordHash);
            log.debug("Login rejected: invalid credentials");
            return AuthOutcome.rejected(AuthFailure.INVALID_CREDENTIALS);
        }

        User user = found.get();
        if (!passwordVerifier.verify(request.getPassword(), user.getPasswordHash())) {
            log.debug("Login rejected: invalid credentials");
            return AuthOutcome.rejected(AuthFailure.INVALID_CREDENTIALS);
        }

        if (!properties.isSecondFactorEnabled()) {
            return issueToken(user);
        }
        return issueChallenge(user.getId(), user.otcContact());
    }

    // ==== Verify ====

    @Override
    public AuthOutcome verifyOtp(String sessionToken, String code) {
        if (!StringUtils.hasText(sessionToken) || !StringUtils.hasText(code)) {
            return AuthOutcome.rejected(AuthFailure.VALIDATION);
        }
        String token = sessionToken.trim();

        Optional<OtpChallenge> found = challengeStore.fetchByToken(token);
        if (found.isEmpty()) {
            log.debug("Verify rejected: unknown session");
            return AuthOutcome.rejected(AuthFailure.INVALID_SESSION);
        }
        OtpChallenge challenge = found.get();

        if (challenge.isUsed()) {
            log.debug("Verify rejected: challenge already used");
            return AuthOutcome.rejected(AuthFailure.ALREADY_USED);
        }
        if (challenge.isExpired(clock.instant())) {
            log.debug("Verify rejected: challenge expired");
            return AuthOutcome.rejected(AuthFailure.EXPIRED);
        }
        if (!otcHasher.matches(token, code.trim(), challenge.getCodeHash())) {
            log.debug("Verify rejected: wrong code");
            return AuthOutcome.rejected(AuthFailure.INVALID_CODE);
        }

        MarkUsedResult marked = challengeStore.markUsed(token);
        if (marked == MarkUsedResult.ALREADY_USED) {
            log.debug("Verify rejected: lost single-use race");
            return AuthOutcome.rejected(AuthFailure.ALREADY_USED);
        }
        if (marked == MarkUsedResult.NOT_FOUND) {
            return AuthOutcome.rejected(AuthFailure.INVALID_SESSION);
        }

        Optional<User> user = identityStore.findUserById(challenge.getUserId());
        if (user.isEmpty()) {
            log.debug("Verify rejected: user {} no longer exists", challenge.getUserId());
            return AuthOutcome.rejected(AuthFailure.INVALID_SESSION);
        }
        return issueToken(user.get());
    }

    // ==== Resend ====

    @Override
    public AuthOutcome resendOtp(String sessionToken) {
        if (!StringUtils.hasText(sessionToken)) {
            return AuthOutcome.rejected(AuthFailure.VALIDATION);
        }

        Optional<OtpChallenge> found = challengeStore.fetchByToken(sessionToken.trim());
        if (found.isEmpty()) {
            log.debug("Resend rejected: unknown session");
            return AuthOutcome.rejected(AuthFailure.INVALID_SESSION);
        }
        OtpChallenge previous = found.get();
        if (previous.isUsed()) {
            log.debug("Resend rejected: challenge already used");
            return AuthOutcome.rejected(AuthFailure.ALREADY_USED);
        }
        if (identityStore.findUserById(previous.getUserId()).isEmpty()) {
            return AuthOutcome.rejected(AuthFailure.INVALID_SESSION);
        }

        // previous challenge stays redeemable until it expires or is used
        return issueChallenge(previous.getUserId(), previous.getContact());
    }

    @Override
    public Optional<User> currentUser(UUID userId) {
        return identityStore.findUserById(userId);
    }

    @Override
    public Optional<User> findUser(UUID userId) {
        return identityStore.findUserById(userId);
    }

    // ==== Helpers ====

    private AuthOutcome issueChallenge(UUID userId, String contact) {
        RateLimitDecision decision = rateLimiter.checkAndGate(contact);
        if (decision instanceof RateLimitDecision.Limited limited) {
            log.warn("OTP rate limit hit for {} (retry after {} min)",
                    ContactMasking.mask(contact), limited.retryAfterMinutes());
            return new AuthOutcome.Throttled(limited.retryAfter(), limited.retryAfterMinutes());
        }

        GeneratedOtc otc = otcGenerator.generate(properties.getOtc().getLength());
        String codeHash = otcHasher.hash(otc.sessionToken(), otc.code());
        challengeStore.create(userId, contact, otc.sessionToken(), codeHash, properties.getOtc().getTtl());

        DeliveryResult delivery = notificationDispatcher.deliver(contact, otc.code());
        log.info("OTP challenge issued user={} contact={} delivery={}/{}",
                userId, ContactMasking.mask(contact), delivery.channel(), delivery.transport());
        return new AuthOutcome.ChallengeIssued(otc.sessionToken(), delivery);
    }

    private AuthOutcome issueToken(User user) {
        String token = sessionTokenIssuer.issue(user.getId(), user.getRole());
        log.info("Session token issued user={} role={}", user.getId(), user.getRole());
        return new AuthOutcome.TokenIssued(user, token);
    }
}
