package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.model.RateLimitDecision;
import com.edudata.authservice.repository.OtpChallengeRepository;
import com.edudata.authservice.service.ChallengeStore;
import com.edudata.authservice.service.RateLimiter;
import com.edudata.authservice.testsupport.BaseSpringTest;
import com.edudata.authservice.testsupport.MutableClock;
import com.edudata.authservice.testsupport.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Retention equal to the rate-limit window, the tightest setting the configuration accepts.
 */
@SpringBootTest(properties = {
        "auth.challenge.reaper-enabled=true",
        "auth.challenge.retention=10m"
})
@Import(TestClockConfig.class)
class ChallengeRetentionJobTest extends BaseSpringTest {

    private static final Duration TTL = Duration.ofMinutes(5);
    private static final String HASH = "0".repeat(64);

    @Autowired
    private ChallengeRetentionJob retentionJob;

    @Autowired
    private ChallengeStore challengeStore;

    @Autowired
    private RateLimiter rateLimiter;

    @Autowired
    private OtpChallengeRepository challengeRepository;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        challengeRepository.deleteAll();
        clock.set(TestClockConfig.START);
    }

    private void issue(String contact, char tokenChar) {
        challengeStore.create(UUID.randomUUID(), contact, String.valueOf(tokenChar).repeat(64), HASH, TTL);
    }

    @Test
    void purgesOnlyChallengesExpiredBeforeTheRetentionCutoff() {
        issue("old@school.edu", 'a');           // expires START+5m
        clock.advance(Duration.ofMinutes(12));
        issue("recent@school.edu", 'b');        // expires START+17m

        // cutoff = now - 10m = START+5m+1s
        clock.set(TestClockConfig.START.plus(Duration.ofMinutes(15)).plusSeconds(1));
        retentionJob.purgeExpired();

        assertThat(challengeRepository.existsByToken("a".repeat(64))).isFalse();
        assertThat(challengeRepository.existsByToken("b".repeat(64))).isTrue();
        assertThat(challengeRepository.count()).isEqualTo(1);
    }

    @Test
    void expiryAtTheCutoffIsKept() {
        issue("edge@school.edu", 'c');          // expires START+5m

        clock.set(TestClockConfig.START.plus(Duration.ofMinutes(15)));
        retentionJob.purgeExpired();

        assertThat(challengeRepository.existsByToken("c".repeat(64))).isTrue();
    }

    @Test
    void expiredChallengesInsideTheWindowStillCountTowardTheLimit() {
        issue("stud1", 'd');
        issue("stud1", 'e');
        issue("stud1", 'f');

        // all three expired, but created inside the window
        clock.advance(Duration.ofMinutes(9).plusSeconds(59));
        retentionJob.purgeExpired();

        assertThat(challengeRepository.count()).isEqualTo(3);
        assertThat(rateLimiter.checkAndGate("stud1")).isInstanceOf(RateLimitDecision.Limited.class);

        clock.advance(Duration.ofSeconds(2));
        assertThat(rateLimiter.checkAndGate("stud1")).isInstanceOf(RateLimitDecision.Allowed.class);
    }

    @Test
    void nothingToPurgeLeavesRowsAlone() {
        issue("stud1", '1');

        retentionJob.purgeExpired();

        assertThat(challengeStore.purgeExpiredBefore(clock.instant())).isZero();
        assertThat(challengeRepository.count()).isEqualTo(1);
    }
}
