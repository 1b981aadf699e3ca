package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.service.PasswordVerifier;
import lombok.RequiredArgsConstructor;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@RequiredArgsConstructor
public class BCryptPasswordVerifier implements PasswordVerifier {

    private final PasswordEncoder passwordEncoder;

    @Override
    public boolean verify(String plaintext, String storedHash) {
        if (!StringUtils.hasText(plaintext) || !StringUtils.hasText(storedHash)) {
            return false;
        }
        // BCryptPasswordEncoder logs and returns false for a malformed hash
        return passwordEncoder.matches(plaintext, storedHash);
    }

    @Override
    public String hash(String plaintext) {
        if (!StringUtils.hasText(plaintext)) {
            throw new IllegalArgumentException("Password must be provided.");
        }
        return passwordEncoder.encode(plaintext);
    }
}
