package com.example.userservice.exception;

import com.example.userservice.entity.Role;

/**
 * Role reference data violates the hierarchy invariants (e.g. a parent cycle).
 * Treated as data corruption: fatal to the current operation and not retried.
 */
public class RoleHierarchyCorruptedException extends BaseException {

    public RoleHierarchyCorruptedException(String message) {
        super("ROLE_HIERARCHY_CORRUPTED", message);
    }

    public static RoleHierarchyCorruptedException cycleDetected(Role start, Role revisited) {
        return new RoleHierarchyCorruptedException(String.format(
            "Parent chain of role %s revisits role %s", start.getName(), revisited.getName()));
    }

    public static RoleHierarchyCorruptedException missingKind(Role role) {
        return new RoleHierarchyCorruptedException(String.format(
            "Role %s has no kind", role.getName()));
    }
}
