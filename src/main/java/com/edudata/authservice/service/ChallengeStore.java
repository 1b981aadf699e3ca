package com.edudata.authservice.service;

import com.edudata.authservice.entity.OtpChallenge;
import com.edudata.authservice.model.MarkUsedResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ChallengeStore {

    /**
     * Inserts a new unused challenge expiring {@code ttl} from now.
     *
     * @throws com.edudata.authservice.exception.ChallengePersistenceException on storage failure
     */
    OtpChallenge create(UUID userId, String contact, String token, String codeHash, Duration ttl);

    Optional<OtpChallenge> fetchByToken(String token);

    /**
     * Atomically flips {@code used} from false to true. Of any number of concurrent
     * callers for the same token exactly one sees {@link MarkUsedResult#OK}.
     */
    MarkUsedResult markUsed(String token);

    long countRecent(String contact, Instant since);

    /** Creation time of the oldest challenge for {@code contact} at or after {@code since}. */
    Optional<Instant> oldestSince(String contact, Instant since);

    int purgeExpiredBefore(Instant cutoff);
}
