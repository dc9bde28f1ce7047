package com.example.userservice.exception;

/**
 * Exception for conflict errors.
 * Used for uniqueness violations.
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message);
    }

    /**
     * Display name is taken.
     */
    public static ConflictException nameAlreadyExists(String name) {
        return new ConflictException(
            "NAME_ALREADY_EXISTS",
            String.format("Name '%s' has already been taken", name)
        );
    }
}
