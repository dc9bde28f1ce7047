package com.example.userservice.exception;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message);
    }

    /**
     * User not found by id or name.
     */
    public static ResourceNotFoundException userNotFound(Object userIdOrName) {
        return new ResourceNotFoundException(
            "USER_NOT_FOUND",
            String.format("User %s not found", userIdOrName)
        );
    }

    /**
     * Role not found.
     */
    public static ResourceNotFoundException roleNotFound(Long roleId) {
        return new ResourceNotFoundException(
            "ROLE_NOT_FOUND",
            String.format("Role with ID %s not found", roleId)
        );
    }

    /**
     * Institution not found.
     */
    public static ResourceNotFoundException institutionNotFound(Long institutionId) {
        return new ResourceNotFoundException(
            "INSTITUTION_NOT_FOUND",
            String.format("Institution with ID %s not found", institutionId)
        );
    }

    /**
     * Teaching assistant has no course mapping, so no supervising instructor.
     */
    public static ResourceNotFoundException instructorNotFound(Long taId) {
        return new ResourceNotFoundException(
            "INSTRUCTOR_NOT_FOUND",
            String.format("Teaching assistant %s is not mapped to any course", taId)
        );
    }
}
