package com.example.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Role entity (reference data).
 *
 * The parent reference models delegation between role nodes and is
 * independent of the rank carried by {@link RoleKind}.
 * Parent chains must not cycle; roles are seeded outside this service.
 * The chain is loaded eagerly, it is short and walked on every delegation check.
 */
@Entity
@Table(name = "roles")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Role {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, unique = true, length = 50)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 30)
    private RoleKind kind;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "parent_id")
    private Role parent;

    public boolean isStudent() {
        return kind == RoleKind.STUDENT;
    }

    public boolean isTeachingAssistant() {
        return kind == RoleKind.TEACHING_ASSISTANT;
    }

    public boolean isInstructor() {
        return kind == RoleKind.INSTRUCTOR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Role other)) {
            return false;
        }
        return id != null && id.equals(other.getId());
    }

    @Override
    public int hashCode() {
        return Role.class.hashCode();
    }

    @Override
    public String toString() {
        return "Role{id=" + id + ", name='" + name + "', kind=" + kind + "}";
    }
}
