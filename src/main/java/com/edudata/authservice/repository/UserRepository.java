package com.edudata.authservice.repository;

import com.edudata.authservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {

    boolean existsByIdentifier(String identifier);

    Optional<User> findByIdentifier(String identifier);
}
