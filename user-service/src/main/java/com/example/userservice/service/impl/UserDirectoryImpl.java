package com.example.userservice.service.impl;

import com.example.userservice.entity.Role;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.User;
import com.example.userservice.exception.ResourceNotFoundException;
import com.example.userservice.repository.UserRepository;
import com.example.userservice.service.RoleGraph;
import com.example.userservice.service.UserDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Implementation of UserDirectory.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class UserDirectoryImpl implements UserDirectory {

    private final UserRepository userRepository;
    private final RoleGraph roleGraph;

    @Override
    public Optional<User> resolveLogin(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }

        Optional<User> byEmail = userRepository.findFirstByEmailOrderByIdAsc(identifier);
        if (byEmail.isPresent()) {
            return byEmail;
        }

        String shortName = shortName(identifier);
        if (shortName.isEmpty()) {
            return Optional.empty();
        }

        List<User> candidates = userRepository.findAllByName(shortName);
        if (candidates.size() != 1) {
            if (candidates.size() > 1) {
                log.warn("Ambiguous login name '{}': {} matches", shortName, candidates.size());
            }
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }

    @Override
    public List<User> searchVisibleByName(User requester, String namePrefix) {
        String fragment = escapeLike(namePrefix == null ? "" : namePrefix);
        Set<Role> visibleRoles = roleGraph.subordinateRolesAndSelf(requester.getRole());

        List<User> matches = userRepository.findByFullNameContaining(
                fragment, PageRequest.of(0, SEARCH_SCAN_LIMIT));

        List<User> visible = matches.stream()
                .limit(SEARCH_SCAN_LIMIT)
                .filter(user -> visibleRoles.contains(user.getRole()))
                .limit(SEARCH_RESULT_LIMIT)
                .toList();

        log.debug("Name search: requester={}, fragment='{}', scanned={}, returned={}",
                requester.getId(), fragment, matches.size(), visible.size());
        return visible;
    }

    @Override
    public User findByIdOrName(Long userId, String name) {
        if (userId != null) {
            return userRepository.findById(userId)
                    .orElseThrow(() -> ResourceNotFoundException.userNotFound(userId));
        }
        return userRepository.findByName(name)
                .orElseThrow(() -> ResourceNotFoundException.userNotFound(name));
    }

    @Override
    public List<User> findByRoleKind(RoleKind kind) {
        return userRepository.findAllByRoleKind(kind);
    }

    /**
     * Matches '%' and '_' literally in the full-name search.
     */
    private static String escapeLike(String fragment) {
        return fragment
                .replace("!", "!!")
                .replace("%", "!%")
                .replace("_", "!_");
    }

    /**
     * Part of the identifier before the first '@', or the whole identifier.
     */
    private static String shortName(String identifier) {
        int at = identifier.indexOf('@');
        return at >= 0 ? identifier.substring(0, at) : identifier;
    }
}
