package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.model.GeneratedOtc;
import com.edudata.authservice.service.OtcGenerator;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.HexFormat;

@Service
public class SecureOtcGenerator implements OtcGenerator {

    static final int MIN_LENGTH = 4;
    static final int MAX_LENGTH = 10;
    private static final int SESSION_TOKEN_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    @Override
    public GeneratedOtc generate(int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Code length must be between " + MIN_LENGTH + " and " + MAX_LENGTH);
        }
        long bound = pow10(length);
        // nextLong(bound) is uniform, no modulo bias
        String code = String.format("%0" + length + "d", random.nextLong(bound));

        byte[] tokenBytes = new byte[SESSION_TOKEN_BYTES];
        random.nextBytes(tokenBytes);
        String sessionToken = HexFormat.of().formatHex(tokenBytes);

        return new GeneratedOtc(code, sessionToken);
    }

    private static long pow10(int exponent) {
        long value = 1;
        for (int i = 0; i < exponent; i++) {
            value *= 10;
        }
        return value;
    }
}
