package com.edudata.authservice.utils;

import com.edudata.authservice.config.AuthProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Keyed one-way hash of a one-time code, bound to the session token of its challenge:
 * {@code hex(HMAC-SHA256(key, sessionToken + ":" + code))}.
 */
@Component
public class OtcHasher {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public OtcHasher(AuthProperties properties) {
        String secret = properties.getOtc().getHmacSecret();
        if (!StringUtils.hasText(secret)) {
            secret = properties.getSession().getSecret();
        }
        if (!StringUtils.hasText(secret)) {
            throw new IllegalStateException("No key for one-time code hashing: set OTC_HMAC_SECRET or SESSION_TOKEN_SECRET.");
        }
        this.key = new SecretKeySpec(secret.trim().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String hash(String sessionToken, String code) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((sessionToken + ":" + code).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    /** Constant-time comparison of a submitted code against a stored hash. */
    public boolean matches(String sessionToken, String code, String storedHash) {
        if (code == null || storedHash == null) return false;
        byte[] expected = storedHash.getBytes(StandardCharsets.US_ASCII);
        byte[] actual = hash(sessionToken, code).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, actual);
    }
}
