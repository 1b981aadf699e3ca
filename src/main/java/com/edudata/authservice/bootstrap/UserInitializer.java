package com.edudata.authservice.bootstrap;

import com.edudata.authservice.entity.User;
import com.edudata.authservice.entity.UserRole;
import com.edudata.authservice.service.IdentityStore;
import com.edudata.authservice.service.PasswordVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds the demo accounts (an administrator and one student) on startup.
 * Idempotent: existing identifiers are left alone.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.init", name = "enabled", havingValue = "true")
public class UserInitializer implements CommandLineRunner {

    private final IdentityStore identityStore;
    private final PasswordVerifier passwordVerifier;

    @Value("${app.init.admin.identifier:admin}")
    private String adminIdentifier;

    @Value("${app.init.admin.password}")
    private String adminPlainPassword;

    @Value("${app.init.admin.contact:}")
    private String adminContact;

    @Value("${app.init.student.identifier:stud1}")
    private String studentIdentifier;

    @Value("${app.init.student.password}")
    private String studentPlainPassword;

    @Value("${app.init.student.contact:}")
    private String studentContact;

    @Override
    public void run(String... args) {
        createUserIfNotExists(adminIdentifier, ensureEncoded(adminPlainPassword),
                UserRole.ADMIN, "Administrator", adminContact);
        createUserIfNotExists(studentIdentifier, ensureEncoded(studentPlainPassword),
                UserRole.STUDENT, "Student One", studentContact);
    }

    private void createUserIfNotExists(String identifier, String passwordHash, UserRole role,
                                       String displayName, String contact) {
        if (identityStore.existsByIdentifier(identifier)) {
            log.info("Seed user '{}' already present.", identifier);
            return;
        }
        User saved = identityStore.save(User.builder()
                .identifier(identifier)
                .passwordHash(passwordHash)
                .role(role)
                .displayName(displayName)
                .contact(contact == null || contact.isBlank() ? null : contact.trim())
                .build());
        log.info("{} '{}' added successfully (id={}).", role, identifier, saved.getId());
    }

    private String ensureEncoded(String rawOrEncoded) {
        if (rawOrEncoded == null) throw new IllegalArgumentException("Password cannot be null");
        if (isBcrypt(rawOrEncoded)) return rawOrEncoded;
        return passwordVerifier.hash(rawOrEncoded);
    }

    private boolean isBcrypt(String value) {
        return value.startsWith("$2a$") || value.startsWith("$2b$") || value.startsWith("$2y$");
    }
}
