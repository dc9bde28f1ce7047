package com.example.userservice.repository;

import com.example.userservice.entity.Role;
import com.example.userservice.entity.RoleKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RoleRepository extends JpaRepository<Role, Long> {

    /**
     * All role nodes of the given kinds (visibility bounds).
     */
    List<Role> findAllByKindIn(Collection<RoleKind> kinds);
}
