package com.edudata.authservice.service;

import com.edudata.authservice.entity.User;

import java.util.Optional;
import java.util.UUID;

public interface IdentityStore {

    Optional<User> findUserByIdentifier(String identifier);

    Optional<User> findUserById(UUID id);

    boolean existsByIdentifier(String identifier);

    User save(User user);
}
