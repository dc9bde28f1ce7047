package com.example.userservice.exception;

/**
 * Exception for forbidden access.
 * The actor is known but lacks the relationship required by the action.
 */
public class ForbiddenException extends BaseException {

    public ForbiddenException(String code, String message) {
        super(code, message);
    }

    /**
     * Actor may not act on behalf of the target.
     */
    public static ForbiddenException impersonationNotAllowed(Long actorId, Long targetId) {
        return new ForbiddenException(
            "IMPERSONATION_NOT_ALLOWED",
            String.format("User %s cannot impersonate user %s", actorId, targetId)
        );
    }
}
