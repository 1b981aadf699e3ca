package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.AuthProperties;
import com.edudata.authservice.exception.ChallengePersistenceException;
import com.edudata.authservice.service.ChallengeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes challenges that expired more than the retention period ago.
 * Retention is validated to cover the rate-limit window, so purged rows can no longer count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth.challenge", name = "reaper-enabled", havingValue = "true", matchIfMissing = true)
public class ChallengeRetentionJob {

    private final ChallengeStore challengeStore;
    private final AuthProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${auth.challenge.reaper-interval:PT15M}",
            initialDelayString = "${auth.challenge.reaper-interval:PT15M}")
    public void purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getChallenge().getRetention());
        try {
            int removed = challengeStore.purgeExpiredBefore(cutoff);
            if (removed > 0) {
                log.info("Purged {} expired OTP challenges (expired before {})", removed, cutoff);
            }
        } catch (ChallengePersistenceException e) {
            // next run retries
            log.error("OTP challenge purge failed: {}", e.getMessage(), e);
        }
    }
}
