package com.example.userservice.exception;

import com.example.userservice.entity.Role;

/**
 * Raised when an operation is invoked for a role it has no meaning for.
 * This is a caller bug, never a recoverable condition.
 */
public class UnsupportedRoleException extends BaseException {

    public UnsupportedRoleException(String message) {
        super("UNSUPPORTED_ROLE", message);
    }

    public static UnsupportedRoleException unknownRole(Role role) {
        return new UnsupportedRoleException("Unknown role: " + role.getName());
    }
}
