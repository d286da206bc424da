package com.vexen.identity;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * User management operations exposed by the identity subsystem.
 */
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    /** Largest page {@link #list(int, int)} will return. */
    public static final int MAX_PAGE_SIZE = 500;

    private final UserRepository repository;
    private final Clock clock;

    public UserService(UserRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Creates an active user.
     *
     * @throws IllegalArgumentException if the name is blank or the email is malformed
     * @throws IdentityException        with {@code DUPLICATE_EMAIL} if the email is taken
     */
    public User create(CreateUserRequest request) {
        String name = requireName(request.name());
        String email = requireEmail(request.email());
        if (repository.findByEmail(email).isPresent()) {
            throw IdentityException.duplicateEmail(email);
        }
        Instant now = clock.instant();
        User user = new User(UUID.randomUUID(), email, name, true, now, now);
        repository.insert(user);
        log.debug("Created user {}", user.id());
        return user;
    }

    /**
     * @throws IdentityException with {@code USER_NOT_FOUND} if there is no such user
     */
    public User get(UUID id) {
        return repository.findById(id).orElseThrow(() -> IdentityException.notFound(id));
    }

    /**
     * @throws IdentityException with {@code USER_NOT_FOUND} if there is no such user
     */
    public User getByEmail(String email) {
        return repository.findByEmail(email).orElseThrow(() -> IdentityException.notFound(email));
    }

    /**
     * Lists users in creation order.
     *
     * @param limit  page size, 1 to {@value #MAX_PAGE_SIZE}
     * @param offset rows to skip, not negative
     */
    public List<User> list(int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return repository.findAll(limit, offset);
    }

    /**
     * Applies the non-null fields of {@code request}.
     *
     * @throws IdentityException with {@code USER_NOT_FOUND} if there is no such user
     */
    public User update(UUID id, UpdateUserRequest request) {
        User current = get(id);
        String name = request.name() == null ? current.name() : requireName(request.name());
        boolean active = request.active() == null ? current.active() : request.active();
        User updated = new User(current.id(), current.email(), name, active, current.createdAt(), clock.instant());
        if (!repository.update(updated)) {
            throw IdentityException.notFound(id);
        }
        return updated;
    }

    /**
     * Shorthand for marking a user inactive.
     */
    public User deactivate(UUID id) {
        return update(id, new UpdateUserRequest(null, false));
    }

    /**
     * @throws IdentityException with {@code USER_NOT_FOUND} if there is no such user
     */
    public void delete(UUID id) {
        if (!repository.deleteById(id)) {
            throw IdentityException.notFound(id);
        }
        log.debug("Deleted user {}", id);
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        return name.strip();
    }

    private static String requireEmail(String email) {
        String normalized = Emails.normalize(email);
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        int at = normalized.indexOf('@');
        if (at <= 0 || at == normalized.length() - 1 || normalized.indexOf('@', at + 1) >= 0) {
            throw new IllegalArgumentException("email is not a valid address: " + email);
        }
        return normalized;
    }
}
