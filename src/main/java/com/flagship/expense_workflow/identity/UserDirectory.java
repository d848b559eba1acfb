package com.flagship.expense_workflow.identity;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link IdentityLookup} backed by the users table that the identity provider
 * keeps in sync.
 *
 * Plain JDBC: the directory is a read model owned by another system, so it
 * gets no JPA entity here.
 */
@Service
@Slf4j
public class UserDirectory implements IdentityLookup {

    private final JdbcTemplate jdbcTemplate;

    public UserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserRole> roleOf(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        List<String> roles = jdbcTemplate.queryForList(
            "SELECT role FROM users WHERE id = ?",
            String.class,
            userId
        );
        return roles.stream().findFirst().map(UserRole::parse);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> displayNameOf(UUID userId) {
        if (userId == null) {
            return Optional.empty();
        }
        List<String> names = jdbcTemplate.queryForList(
            "SELECT display_name FROM users WHERE id = ?",
            String.class,
            userId
        );
        return names.stream().findFirst();
    }

    /**
     * Registers a user in the directory. Used when provisioning users from the
     * identity provider and by tests.
     *
     * @return the new user's id
     */
    @Transactional
    public UUID registerUser(String displayName, UserRole role) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        UUID userId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO users (id, display_name, role, created_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP)",
            userId,
            displayName,
            role.name()
        );
        log.debug("Registered user {} with role {}", userId, role);
        return userId;
    }
}
