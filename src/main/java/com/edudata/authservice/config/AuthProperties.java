package com.edudata.authservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Authentication settings bound from {@code auth.*}.
 * <p>
 * application.yml maps the deployment environment variables
 * (OTC_LENGTH, RATE_LIMIT_COUNT, SESSION_TOKEN_SECRET ...) onto these fields,
 * so components receive one explicit object instead of reading the environment.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /** When false, a correct password is exchanged for a session token directly. */
    private boolean secondFactorEnabled = true;

    @Valid
    private final Otc otc = new Otc();

    @Valid
    private final RateLimit rateLimit = new RateLimit();

    @Valid
    private final Session session = new Session();

    @Valid
    private final Password password = new Password();

    @Valid
    private final Notification notification = new Notification();

    @Valid
    private final Challenge challenge = new Challenge();

    @Data
    public static class Otc {
        @Min(4)
        @Max(10)
        private int length = 6;

        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        /** HMAC key for code hashes; falls back to the session signing secret when blank. */
        private String hmacSecret;
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int count = 3;

        @NotNull
        private Duration window = Duration.ofMinutes(10);
    }

    @Data
    public static class Session {
        /** Base64-encoded HMAC secret, at least 256 bits. */
        private String secret;

        @NotNull
        private Duration tokenTtl = Duration.ofDays(7);

        private String issuer;
    }

    @Data
    public static class Password {
        @Min(4)
        @Max(31)
        private int bcryptStrength = 12;
    }

    @Data
    public static class Notification {
        @NotNull
        private Duration dispatchTimeout = Duration.ofSeconds(3);

        private final Twilio twilio = new Twilio();
        private final Mail mail = new Mail();

        @Data
        public static class Twilio {
            private String accountSid;
            private String authToken;
            private String fromNumber;

            public boolean isConfigured() {
                return hasText(accountSid) && hasText(authToken) && hasText(fromNumber);
            }
        }

        @Data
        public static class Mail {
            private boolean enabled = false;
            private String from;
        }
    }

    @Data
    public static class Challenge {
        @NotNull
        private Duration retention = Duration.ofHours(24);

        private boolean reaperEnabled = true;

        /** Delay between purge runs; read by the scheduler through the placeholder. */
        @NotNull
        private Duration reaperInterval = Duration.ofMinutes(15);
    }

    @AssertTrue(message = "auth.challenge.retention must be >= auth.rate-limit.window")
    public boolean isRetentionCoveringRateWindow() {
        if (challenge.getRetention() == null || rateLimit.getWindow() == null) return true;
        return challenge.getRetention().compareTo(rateLimit.getWindow()) >= 0;
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
