package com.example.userservice.repository;

import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.User;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for User entity.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find user by exact email (login by email).
     * Emails are not unique, the lowest id wins.
     */
    Optional<User> findFirstByEmailOrderByIdAsc(String email);

    /**
     * Find user by display name.
     */
    Optional<User> findByName(String name);

    /**
     * All users carrying a display name.
     * Used by login resolution, which only accepts a single match.
     */
    List<User> findAllByName(String name);

    /**
     * Check if display name is already taken (registration).
     */
    boolean existsByName(String name);

    /**
     * Case-insensitive substring match on full name, ordered by id.
     * The page size bounds how many candidates are scanned.
     * Wildcards in the fragment must be escaped with '!'.
     */
    @Query("SELECT u FROM User u " +
           "WHERE LOWER(u.fullName) LIKE LOWER(CONCAT('%', :fragment, '%')) ESCAPE '!' " +
           "ORDER BY u.id ASC")
    List<User> findByFullNameContaining(@Param("fragment") String fragment, Pageable pageable);

    /**
     * All users whose role has the given kind.
     */
    @Query("SELECT u FROM User u WHERE u.role.kind = :kind ORDER BY u.id ASC")
    List<User> findAllByRoleKind(@Param("kind") RoleKind kind);

    /**
     * Sub-accounts of a user.
     */
    List<User> findAllByParent(User parent);
}
