package com.example.userservice.support;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.Role;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.User;

/**
 * Transient entities for unit tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Role role(long id, RoleKind kind) {
        return role(id, kind, null);
    }

    public static Role role(long id, RoleKind kind, Role parent) {
        return Role.builder()
                .id(id)
                .name(kind.getDisplayName())
                .kind(kind)
                .parent(parent)
                .build();
    }

    public static User user(long id, String name, Role role) {
        User user = new User();
        user.setId(id);
        user.setName(name);
        user.setFullName(Character.toUpperCase(name.charAt(0)) + name.substring(1) + " Tester");
        user.setEmail(name + "@example.com");
        user.setPasswordDigest("{digest}");
        user.setRole(role);
        return user;
    }

    public static Course course(long id, User instructor) {
        return Course.builder()
                .id(id)
                .name("Course " + id)
                .instructor(instructor)
                .build();
    }
}
