package com.vexen.identity;

import java.util.List;
import java.util.UUID;

/**
 * Persistence for {@link User} records.
 */
public interface UserRepository extends IdentityLookup {

    void insert(User user);

    /**
     * @return true if a row was updated
     */
    boolean update(User user);

    /**
     * @return true if a row was deleted
     */
    boolean deleteById(UUID id);

    /**
     * Lists users ordered by creation time, then id.
     */
    List<User> findAll(int limit, int offset);
}
