package com.example.userservice.service;

import com.example.userservice.dto.request.RegisterUserRequest;
import com.example.userservice.dto.response.UserResponse;
import com.example.userservice.entity.User;
import jakarta.validation.Valid;

import java.util.Optional;

/**
 * Service interface for account lifecycle operations.
 */
public interface UserAccountService {

    /**
     * Register a new user.
     * The password is stored as a BCrypt digest; preference flags take their defaults.
     *
     * @param request Registration request
     * @return the persisted user
     * @throws com.example.userservice.exception.ConflictException if the name is taken
     * @throws com.example.userservice.exception.ResourceNotFoundException if role, parent or institution is unknown
     */
    User register(@Valid RegisterUserRequest request);

    /**
     * Resolve the login identifier and check the password.
     *
     * @return the user, or empty when unknown, ambiguous or the password does not match
     */
    Optional<User> authenticate(String identifier, String rawPassword);

    /**
     * Replace the user's password with a random alphanumeric one.
     *
     * @return the generated plaintext password, for delivery by the caller
     * @throws com.example.userservice.exception.ResourceNotFoundException if no such user
     */
    String resetPassword(Long userId);

    /**
     * Delete a user. Sub-accounts are kept and detached from the deleted parent.
     *
     * @throws com.example.userservice.exception.ResourceNotFoundException if no such user
     */
    void deleteUser(Long userId);

    /**
     * Profile view of a user.
     */
    UserResponse toResponse(User user);
}
