package com.edudata.authservice.service;

import com.edudata.authservice.model.RateLimitDecision;

public interface RateLimiter {

    /**
     * Sliding-window check over challenges already issued to {@code contact}.
     * Read-only: the challenge created after an {@code Allowed} decision is what
     * consumes the budget.
     */
    RateLimitDecision checkAndGate(String contact);
}
