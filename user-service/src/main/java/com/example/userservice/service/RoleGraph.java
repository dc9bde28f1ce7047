package com.example.userservice.service;

import com.example.userservice.entity.Role;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.exception.RoleHierarchyCorruptedException;
import com.example.userservice.repository.RoleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Role hierarchy queries.
 *
 * Two independent structures are exposed:
 * - rank, from {@link RoleKind}, bounds what a user may see
 * - parent pointers between role nodes, which model delegation
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class RoleGraph {

    private final RoleRepository roleRepository;

    /**
     * Rank of the role, 1 (student) to 5 (super administrator).
     */
    public int rank(Role role) {
        return kindOf(role).getRank();
    }

    /**
     * All role nodes ranked at or below the given role, the role itself included.
     */
    public Set<Role> subordinateRolesAndSelf(Role role) {
        Set<RoleKind> kinds = kindOf(role).subordinatesAndSelf();
        Set<Role> roles = new LinkedHashSet<>(roleRepository.findAllByKindIn(kinds));
        roles.add(role);
        return roles;
    }

    /**
     * Walk the parent chain of {@code role} looking for {@code candidateParent}.
     *
     * Stops with false on a missing parent, and on a super administrator
     * parent that is not the candidate: delegation never crosses that node.
     *
     * @throws RoleHierarchyCorruptedException if the chain revisits a node
     */
    public boolean isAncestor(Role candidateParent, Role role) {
        Set<Role> visited = new HashSet<>();
        visited.add(role);

        Role current = role;
        while (true) {
            Role parent = current.getParent();
            if (parent == null) {
                return false;
            }
            if (parent.equals(candidateParent)) {
                return true;
            }
            if (kindOf(parent) == RoleKind.SUPER_ADMINISTRATOR) {
                return false;
            }
            if (!visited.add(parent)) {
                log.error("Cycle in role hierarchy: start={}, revisited={}", role, parent);
                throw RoleHierarchyCorruptedException.cycleDetected(role, parent);
            }
            current = parent;
        }
    }

    /**
     * Kind of the role.
     *
     * @throws RoleHierarchyCorruptedException if the role carries no kind
     */
    public RoleKind kindOf(Role role) {
        RoleKind kind = role.getKind();
        if (kind == null) {
            log.error("Role without kind: {}", role);
            throw RoleHierarchyCorruptedException.missingKind(role);
        }
        return kind;
    }
}
