package com.edudata.authservice.serviceImpl;

import com.edudata.authservice.config.CacheConfig;
import com.edudata.authservice.entity.User;
import com.edudata.authservice.repository.UserRepository;
import com.edudata.authservice.service.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CachePut;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaIdentityStore implements IdentityStore {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findUserByIdentifier(String identifier) {
        if (identifier == null) return Optional.empty();
        return userRepository.findByIdentifier(normalize(identifier));
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfig.USERS_BY_ID, key = "#id", unless = "#result == null")
    public Optional<User> findUserById(UUID id) {
        if (id == null) return Optional.empty();
        log.debug("Loading user by id: {}", id);
        return userRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean existsByIdentifier(String identifier) {
        return identifier != null && userRepository.existsByIdentifier(normalize(identifier));
    }

    @Override
    @Transactional
    @CachePut(cacheNames = CacheConfig.USERS_BY_ID, key = "#result.id")
    public User save(User user) {
        user.setIdentifier(normalize(user.getIdentifier()));
        return userRepository.saveAndFlush(user);
    }

    static String normalize(String identifier) {
        return identifier.trim().toLowerCase(Locale.ROOT);
    }
}
