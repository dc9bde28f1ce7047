package com.example.userservice.service.impl;

import com.example.userservice.config.UserAccountProperties;
import com.example.userservice.dto.request.RegisterUserRequest;
import com.example.userservice.dto.response.UserResponse;
import com.example.userservice.entity.Role;
import com.example.userservice.entity.User;
import com.example.userservice.exception.ConflictException;
import com.example.userservice.exception.ResourceNotFoundException;
import com.example.userservice.mapper.UserMapper;
import com.example.userservice.repository.InstitutionRepository;
import com.example.userservice.repository.RoleRepository;
import com.example.userservice.repository.UserRepository;
import com.example.userservice.service.UserAccountService;
import com.example.userservice.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.validation.annotation.Validated;

import java.security.SecureRandom;
import java.util.List;
import java.util.Optional;

/**
 * Implementation of UserAccountService.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Validated
@Transactional(readOnly = true)
public class UserAccountServiceImpl implements UserAccountService {

    private static final String ALPHANUMERIC =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final InstitutionRepository institutionRepository;
    private final UserDirectory userDirectory;
    private final PasswordEncoder passwordEncoder;
    private final UserAccountProperties properties;
    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    @Transactional
    public User register(RegisterUserRequest request) {
        log.info("Registering user: name={}, roleId={}", request.name(), request.roleId());

        if (userRepository.existsByName(request.name())) {
            throw ConflictException.nameAlreadyExists(request.name());
        }

        Role role = roleRepository.findById(request.roleId())
                .orElseThrow(() -> ResourceNotFoundException.roleNotFound(request.roleId()));

        User user = new User();
        user.setName(request.name());
        user.setEmail(request.email());
        user.setFullName(request.fullName());
        user.setPasswordDigest(passwordEncoder.encode(request.password()));
        user.setRole(role);

        if (request.parentId() != null) {
            user.setParent(userRepository.findById(request.parentId())
                    .orElseThrow(() -> ResourceNotFoundException.userNotFound(request.parentId())));
        }
        if (request.institutionId() != null) {
            user.setInstitution(institutionRepository.findById(request.institutionId())
                    .orElseThrow(() -> ResourceNotFoundException.institutionNotFound(request.institutionId())));
        }

        // Unique index on name covers concurrent registrations
        try {
            user = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            throw ConflictException.nameAlreadyExists(request.name());
        }

        log.info("User registered: id={}, name={}", user.getId(), user.getName());
        return user;
    }

    @Override
    public Optional<User> authenticate(String identifier, String rawPassword) {
        if (rawPassword == null) {
            return Optional.empty();
        }
        Optional<User> user = userDirectory.resolveLogin(identifier)
                .filter(candidate -> passwordEncoder.matches(rawPassword, candidate.getPasswordDigest()));
        if (user.isEmpty()) {
            log.warn("Authentication failed for identifier '{}'", identifier);
        }
        return user;
    }

    @Override
    @Transactional
    public String resetPassword(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(userId));

        String password = randomAlphanumeric(properties.getResetPasswordLength());
        user.setPasswordDigest(passwordEncoder.encode(password));
        userRepository.save(user);

        log.info("Password reset: userId={}", userId);
        return password;
    }

    @Override
    @Transactional
    public void deleteUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(userId));

        List<User> children = userRepository.findAllByParent(user);
        children.forEach(child -> child.setParent(null));
        userRepository.saveAll(children);

        userRepository.delete(user);
        log.info("User deleted: id={}, detachedChildren={}", userId, children.size());
    }

    @Override
    public UserResponse toResponse(User user) {
        return UserMapper.toUserResponse(user);
    }

    private String randomAlphanumeric(int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHANUMERIC.charAt(secureRandom.nextInt(ALPHANUMERIC.length())));
        }
        return sb.toString();
    }
}
