package com.edudata.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Problems with the incoming request itself.
 *
 * Conventions:
 *  - type:  https://edudata.dev/problems/<slug>
 *  - title: short, human-readable summary
 *  - detail: safe, non-sensitive explanation suitable for clients
 */
public final class RequestExceptions {

    private RequestExceptions() {}

    /** 400 Bad Request – missing or malformed input. */
    public static final class ValidationFailed extends ApiException {
        public ValidationFailed(String detail) {
            super(HttpStatus.BAD_REQUEST,
                    "https://edudata.dev/problems/validation-error",
                    "Validation Error",
                    "ValidationError",
                    detail);
        }
    }

    /** 429 Too Many Requests – code issuance budget for a contact is exhausted. */
    public static final class RateLimited extends ApiException {

        private final long retryAfterMinutes;

        public RateLimited(long retryAfterMinutes) {
            super(HttpStatus.TOO_MANY_REQUESTS,
                    "https://edudata.dev/problems/rate-limited",
                    "Too Many Requests",
                    "RateLimited",
                    "Too many OTP attempts. Try again after " + retryAfterMinutes
                            + (retryAfterMinutes == 1 ? " minute." : " minutes."));
            this.retryAfterMinutes = retryAfterMinutes;
            addProperty("retryAfterMinutes", retryAfterMinutes);
        }

        public long getRetryAfterMinutes() {
            return retryAfterMinutes;
        }
    }
}
