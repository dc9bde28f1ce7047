package com.example.userservice.dto.request;

import jakarta.validation.constraints.*;

/**
 * Registration request DTO.
 *
 * Validation Rules:
 * - name: lowercase letters only, required
 * - email: valid address, required
 * - password: at least 6 characters, required
 * - fullName: required, max 50 chars
 * - roleId: required; parentId and institutionId optional
 */
public record RegisterUserRequest(
    @NotBlank(message = "Name is required")
    @Pattern(regexp = "^[a-z]+$", message = "must be in lowercase")
    String name,

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    String email,

    @NotBlank(message = "Password is required")
    @Size(min = 6, message = "Password must be at least 6 characters")
    String password,

    @NotBlank(message = "Full name is required")
    @Size(max = 50, message = "Full name must not exceed 50 characters")
    String fullName,

    @NotNull(message = "Role is required")
    Long roleId,

    Long parentId,

    Long institutionId
) {
}
