package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.model.RateLimitDecision;
import com.edudata.authservice.service.ChallengeStore;
import com.edudata.authservice.service.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Sliding window over issued challenges: at most {@code count} per contact in any
 * {@code window}. Login and resend draw from the same budget.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChallengeRateLimiter implements RateLimiter {

    private static final Duration MIN_RETRY_AFTER = Duration.ofMinutes(1);

    private final ChallengeStore challengeStore;
    private final AuthProperties properties;
    private final Clock clock;

    @Override
    public RateLimitDecision checkAndGate(String contact) {
        Duration window = properties.getRateLimit().getWindow();
        int limit = properties.getRateLimit().getCount();

        Instant now = clock.instant();
        Instant since = now.minus(window);

        long recent = challengeStore.countRecent(contact, since);
        if (recent < limit) {
            return RateLimitDecision.allowed();
        }

        Instant oldest = challengeStore.oldestSince(contact, since).orElse(now);
        Duration retryAfter = Duration.between(now, oldest.plus(window));
        if (retryAfter.compareTo(MIN_RETRY_AFTER) < 0) {
            retryAfter = MIN_RETRY_AFTER;
        } else if (retryAfter.compareTo(window) > 0) {
            retryAfter = window;
        }
        log.debug("Rate limit reached: {} challenges in window, retry after {}", recent, retryAfter);
        return RateLimitDecision.limited(retryAfter);
    }
}
