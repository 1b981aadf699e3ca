package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.entity.OtpChallenge;
import com.edudata.authservice.exception.ChallengePersistenceException;
import com.edudata.authservice.model.MarkUsedResult;
import com.edudata.authservice.repository.OtpChallengeRepository;
import com.edudata.authservice.service.ChallengeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Challenge rows in the relational store. Every coordination point (single use,
 * rate-limit counts) is a statement against the table, so any number of service
 * instances can share it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaChallengeStore implements ChallengeStore {

    private final OtpChallengeRepository repository;
    private final Clock clock;

    @Override
    public OtpChallenge create(UUID userId, String contact, String token, String codeHash, Duration ttl) {
        Instant now = clock.instant();
        OtpChallenge challenge = OtpChallenge.builder()
                .token(token)
                .userId(userId)
                .contact(contact)
                .codeHash(codeHash)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .used(false)
                .build();
        return guarded("create", () -> repository.saveAndFlush(challenge));
    }

    @Override
    public Optional<OtpChallenge> fetchByToken(String token) {
        return guarded("fetch", () -> repository.findByToken(token));
    }

    @Override
    public MarkUsedResult markUsed(String token) {
        int updated;
        try {
            updated = repository.markUsed(token);
        } catch (ConcurrencyFailureException e) {
            // another transaction holds or just flipped the row
            log.debug("markUsed lost a concurrent update: {}", e.getMessage());
            return MarkUsedResult.ALREADY_USED;
        } catch (DataAccessException e) {
            // some drivers report a lost row-level race as a generic error
            if (isUsed(token)) {
                log.debug("markUsed failed on an already used challenge: {}", e.getMessage());
                return MarkUsedResult.ALREADY_USED;
            }
            throw new ChallengePersistenceException("Could not mark challenge as used", e);
        }
        if (updated == 1) {
            return MarkUsedResult.OK;
        }
        boolean exists = guarded("exists", () -> repository.existsByToken(token));
        return exists ? MarkUsedResult.ALREADY_USED : MarkUsedResult.NOT_FOUND;
    }

    @Override
    public long countRecent(String contact, Instant since) {
        return guarded("count", () -> repository.countByContactAndCreatedAtGreaterThanEqual(contact, since));
    }

    @Override
    public Optional<Instant> oldestSince(String contact, Instant since) {
        return guarded("oldest", () -> repository
                .findFirstByContactAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(contact, since)
                .map(OtpChallenge::getCreatedAt));
    }

    @Override
    public int purgeExpiredBefore(Instant cutoff) {
        return guarded("purge", () -> repository.deleteExpiredBefore(cutoff));
    }

    private boolean isUsed(String token) {
        return guarded("fetch", () -> repository.findByToken(token).map(OtpChallenge::isUsed).orElse(false));
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new ChallengePersistenceException("Challenge store " + operation + " failed", e);
        }
    }
}
