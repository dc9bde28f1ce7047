package com.example.userservice.service;

import com.example.userservice.entity.User;

/**
 * Authorization predicates between an actor (the user attempting an action)
 * and a target (the user acted upon).
 */
public interface AuthorizationEngine {

    /**
     * Check if the actor may act on behalf of the target.
     * Rules, first match wins:
     * 1. super administrator: allowed
     * 2. instructor for the target: allowed
     * 3. any other instructor: denied
     * 4. teaching assistant for the target: allowed
     * 5. any other teaching assistant: denied
     * 6. actor's role is an ancestor of the target's role: allowed
     * 7. denied
     */
    boolean canImpersonate(User actor, User target);

    /**
     * Same as {@link #canImpersonate} but throws when denied.
     *
     * @throws com.example.userservice.exception.ForbiddenException if impersonation is not allowed
     */
    void requireImpersonation(User actor, User target);

    /**
     * Check if the actor is an instructor related to the target:
     * a student participating in one of the actor's courses,
     * or a teaching assistant sharing a course with the actor.
     */
    boolean isInstructorFor(User actor, User target);

    /**
     * Check if the actor is a teaching assistant on a course where the target student
     * participates in an assignment.
     */
    boolean isTeachingAssistantFor(User actor, User target);

    /**
     * Instructor id attached to the user.
     * Instructors and administrators map to themselves; a teaching assistant
     * maps to the instructor of their earliest course mapping.
     *
     * @throws com.example.userservice.exception.UnsupportedRoleException for students and unknown roles
     * @throws com.example.userservice.exception.ResourceNotFoundException for a TA without course mapping
     */
    Long instructorId(User user);
}
