package com.example.userservice.entity;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Role tiers of the course-management system.
 * Ordered by rank: STUDENT < TEACHING_ASSISTANT < INSTRUCTOR < ADMINISTRATOR < SUPER_ADMINISTRATOR.
 *
 * Authorization code dispatches on this tag instead of on user subtypes.
 */
public enum RoleKind {

    /**
     * Student - participates in assignments
     */
    STUDENT(1, "Student"),

    /**
     * Teaching Assistant - assists an instructor on one or more courses
     */
    TEACHING_ASSISTANT(2, "Teaching Assistant"),

    /**
     * Instructor - instructor of record for courses
     */
    INSTRUCTOR(3, "Instructor"),

    /**
     * Administrator - manages instructors within an institution
     */
    ADMINISTRATOR(4, "Administrator"),

    /**
     * Super Administrator - full system access
     */
    SUPER_ADMINISTRATOR(5, "Super Administrator");

    private final int rank;
    private final String displayName;

    RoleKind(int rank, String displayName) {
        this.rank = rank;
        this.displayName = displayName;
    }

    public int getRank() {
        return rank;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Kinds whose rank is at or below this kind's rank.
     */
    public Set<RoleKind> subordinatesAndSelf() {
        Set<RoleKind> kinds = EnumSet.noneOf(RoleKind.class);
        for (RoleKind kind : values()) {
            if (kind.rank <= rank) {
                kinds.add(kind);
            }
        }
        return kinds;
    }

    public static Optional<RoleKind> fromDisplayName(String displayName) {
        return Arrays.stream(values())
                .filter(kind -> kind.displayName.equalsIgnoreCase(displayName))
                .findFirst();
    }

    public static Optional<RoleKind> fromRank(int rank) {
        return Arrays.stream(values())
                .filter(kind -> kind.rank == rank)
                .findFirst();
    }
}
