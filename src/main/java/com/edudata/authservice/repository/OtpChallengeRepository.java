package com.edudata.authservice.repository;

import com.edudata.authservice.entity.OtpChallenge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

public interface OtpChallengeRepository extends JpaRepository<OtpChallenge, Long> {

    Optional<OtpChallenge> findByToken(String token);

    boolean existsByToken(String token);

    long countByContactAndCreatedAtGreaterThanEqual(String contact, Instant since);

    Optional<OtpChallenge> findFirstByContactAndCreatedAtGreaterThanEqualOrderByCreatedAtAsc(String contact, Instant since);

    /**
     * Compare-and-set on the used flag. Returns 1 for the single caller that flipped it, 0 otherwise.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE OtpChallenge c SET c.used = true WHERE c.token = :token AND c.used = false")
    int markUsed(@Param("token") String token);

    @Transactional
    @Modifying
    @Query("DELETE FROM OtpChallenge c WHERE c.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
