package com.edudata.authservice.model;

import com.edudata.authservice.entity.User;

import java.time.Duration;

/**
 * Result of one step of the login state machine. Controllers map each variant to a
 * status code; nothing here is signalled by throwing.
 */
public sealed interface AuthOutcome {

    /** Terminal success: the caller is authenticated. */
    record TokenIssued(User user, String token) implements AuthOutcome {}

    /** Password accepted, a code was sent; the client continues with {@code sessionToken}. */
    record ChallengeIssued(String sessionToken, DeliveryResult delivery) implements AuthOutcome {}

    /** Account created; with the second factor on, the client logs in next. */
    record SignedUp(User user) implements AuthOutcome {}

    record Throttled(Duration retryAfter, long retryAfterMinutes) implements AuthOutcome {}

    record Rejected(AuthFailure reason) implements AuthOutcome {}

    static AuthOutcome rejected(AuthFailure reason) {
        return new Rejected(reason);
    }
}
