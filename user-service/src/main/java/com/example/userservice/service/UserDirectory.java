package com.example.userservice.service;

import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.User;

import java.util.List;
import java.util.Optional;

/**
 * User lookups.
 */
public interface UserDirectory {

    /**
     * Maximum number of full-name matches examined by {@link #searchVisibleByName}.
     */
    int SEARCH_SCAN_LIMIT = 20;

    /**
     * Maximum number of users returned by {@link #searchVisibleByName}.
     */
    int SEARCH_RESULT_LIMIT = 10;

    /**
     * Resolve a login identifier, either an email or a display name.
     * Email match wins; otherwise the part before '@' is matched as a name,
     * and only an unambiguous name resolves.
     *
     * @return the user, or empty when not found or ambiguous
     */
    Optional<User> resolveLogin(String identifier);

    /**
     * Users whose full name contains the fragment (case-insensitive) and whose role
     * is visible to the requester. Scans the first {@value #SEARCH_SCAN_LIMIT}
     * matches and returns at most {@value #SEARCH_RESULT_LIMIT}.
     */
    List<User> searchVisibleByName(User requester, String namePrefix);

    /**
     * Find by id when given, otherwise by display name.
     *
     * @throws com.example.userservice.exception.ResourceNotFoundException if no such user
     */
    User findByIdOrName(Long userId, String name);

    /**
     * All users holding a role of the given kind.
     */
    List<User> findByRoleKind(RoleKind kind);
}
