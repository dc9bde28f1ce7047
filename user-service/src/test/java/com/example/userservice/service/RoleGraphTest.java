package com.example.userservice.service;

import com.example.userservice.entity.Role;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.exception.RoleHierarchyCorruptedException;
import com.example.userservice.repository.RoleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collection;
import java.util.List;
import java.util.Set;

import static com.example.userservice.support.Fixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleGraphTest {

    @Mock
    private RoleRepository roleRepository;

    private RoleGraph roleGraph;

    private Role student;
    private Role ta;
    private Role instructor;
    private Role admin;
    private Role superAdmin;

    @BeforeEach
    void setUp() {
        roleGraph = new RoleGraph(roleRepository);

        // Default chain: student -> ta -> instructor -> admin -> super admin
        superAdmin = role(5, RoleKind.SUPER_ADMINISTRATOR);
        admin = role(4, RoleKind.ADMINISTRATOR, superAdmin);
        instructor = role(3, RoleKind.INSTRUCTOR, admin);
        ta = role(2, RoleKind.TEACHING_ASSISTANT, instructor);
        student = role(1, RoleKind.STUDENT, ta);
    }

    @Nested
    @DisplayName("rank()")
    class Rank {

        @Test
        @DisplayName("follows student < TA < instructor < admin < super admin")
        void totalOrder() {
            assertThat(roleGraph.rank(student)).isLessThan(roleGraph.rank(ta));
            assertThat(roleGraph.rank(ta)).isLessThan(roleGraph.rank(instructor));
            assertThat(roleGraph.rank(instructor)).isLessThan(roleGraph.rank(admin));
            assertThat(roleGraph.rank(admin)).isLessThan(roleGraph.rank(superAdmin));
        }

        @Test
        @DisplayName("role without kind is reported as corrupted hierarchy")
        void missingKind() {
            Role broken = Role.builder().id(99L).name("Broken").build();

            assertThatThrownBy(() -> roleGraph.rank(broken))
                    .isInstanceOf(RoleHierarchyCorruptedException.class)
                    .hasMessageContaining("Broken");
        }
    }

    @Nested
    @DisplayName("subordinateRolesAndSelf()")
    class SubordinateRolesAndSelf {

        @Test
        @DisplayName("administrator sees admin, instructor, TA, student but not super admin")
        void administrator() {
            List<Role> all = List.of(student, ta, instructor, admin, superAdmin);
            when(roleRepository.findAllByKindIn(anyCollection())).thenAnswer(invocation -> {
                Collection<RoleKind> kinds = invocation.getArgument(0);
                return all.stream().filter(r -> kinds.contains(r.getKind())).toList();
            });

            Set<Role> visible = roleGraph.subordinateRolesAndSelf(admin);

            assertThat(visible).containsExactlyInAnyOrder(student, ta, instructor, admin);
            assertThat(visible).doesNotContain(superAdmin);
        }

        @Test
        @DisplayName("role itself is included even when the repository omits it")
        void includesSelf() {
            when(roleRepository.findAllByKindIn(anyCollection())).thenReturn(List.of());

            assertThat(roleGraph.subordinateRolesAndSelf(student)).containsExactly(student);
        }
    }

    @Nested
    @DisplayName("isAncestor()")
    class IsAncestor {

        @Test
        @DisplayName("role without parent returns false")
        void noParent() {
            Role orphan = role(10, RoleKind.INSTRUCTOR);

            assertThat(roleGraph.isAncestor(admin, orphan)).isFalse();
        }

        @Test
        @DisplayName("direct parent is an ancestor")
        void directParent() {
            assertThat(roleGraph.isAncestor(ta, student)).isTrue();
        }

        @Test
        @DisplayName("transitive parent is an ancestor")
        void transitiveParent() {
            assertThat(roleGraph.isAncestor(admin, student)).isTrue();
        }

        @Test
        @DisplayName("super administrator parent is still found when it is the candidate")
        void superAdminCandidate() {
            assertThat(roleGraph.isAncestor(superAdmin, admin)).isTrue();
        }

        @Test
        @DisplayName("walk stops at a super administrator node")
        void stopsAtSuperAdministrator() {
            Role outsider = role(20, RoleKind.ADMINISTRATOR);
            Role grandParent = role(21, RoleKind.ADMINISTRATOR, outsider);
            Role boundary = role(22, RoleKind.SUPER_ADMINISTRATOR, grandParent);
            Role child = role(23, RoleKind.INSTRUCTOR, boundary);

            assertThat(roleGraph.isAncestor(outsider, child)).isFalse();
            assertThat(roleGraph.isAncestor(grandParent, child)).isFalse();
        }

        @Test
        @DisplayName("unrelated role is not an ancestor")
        void unrelated() {
            Role otherAdmin = role(30, RoleKind.ADMINISTRATOR);

            assertThat(roleGraph.isAncestor(otherAdmin, student)).isFalse();
        }

        @Test
        @DisplayName("role is not its own ancestor")
        void notSelf() {
            assertThat(roleGraph.isAncestor(student, student)).isFalse();
        }

        @Test
        @DisplayName("cycle in the parent chain is detected")
        void cycle() {
            Role a = role(40, RoleKind.INSTRUCTOR);
            Role b = role(41, RoleKind.INSTRUCTOR, a);
            a.setParent(b);
            Role candidate = role(42, RoleKind.ADMINISTRATOR);

            assertThatThrownBy(() -> roleGraph.isAncestor(candidate, a))
                    .isInstanceOf(RoleHierarchyCorruptedException.class)
                    .extracting("code")
                    .isEqualTo("ROLE_HIERARCHY_CORRUPTED");
        }
    }
}
