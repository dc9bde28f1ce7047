package com.example.userservice.service.impl;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.TaMapping;
import com.example.userservice.entity.User;
import com.example.userservice.exception.ForbiddenException;
import com.example.userservice.exception.ResourceNotFoundException;
import com.example.userservice.exception.UnsupportedRoleException;
import com.example.userservice.repository.TaMappingRepository;
import com.example.userservice.service.AuthorizationEngine;
import com.example.userservice.service.CourseMembershipIndex;
import com.example.userservice.service.RoleGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Set;

/**
 * Implementation of AuthorizationEngine.
 * Pure reads; every decision is recomputed from persisted state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class AuthorizationEngineImpl implements AuthorizationEngine {

    private final RoleGraph roleGraph;
    private final CourseMembershipIndex courseMembershipIndex;
    private final TaMappingRepository taMappingRepository;

    @Override
    public boolean canImpersonate(User actor, User target) {
        RoleKind actorKind = roleGraph.kindOf(actor.getRole());
        roleGraph.kindOf(target.getRole());

        if (actorKind == RoleKind.SUPER_ADMINISTRATOR) {
            log.debug("Impersonation allowed: actor {} is super administrator", actor.getId());
            return true;
        }
        if (isInstructorFor(actor, target)) {
            log.debug("Impersonation allowed: actor {} instructs target {}", actor.getId(), target.getId());
            return true;
        }
        // An unrelated instructor never falls through to the parent chain
        if (actorKind == RoleKind.INSTRUCTOR) {
            return false;
        }
        if (isTeachingAssistantFor(actor, target)) {
            log.debug("Impersonation allowed: actor {} assists target {}", actor.getId(), target.getId());
            return true;
        }
        if (actorKind == RoleKind.TEACHING_ASSISTANT) {
            return false;
        }
        boolean ancestor = roleGraph.isAncestor(actor.getRole(), target.getRole());
        log.debug("Impersonation via role chain: actor={}, target={}, allowed={}",
                actor.getId(), target.getId(), ancestor);
        return ancestor;
    }

    @Override
    public void requireImpersonation(User actor, User target) {
        if (!canImpersonate(actor, target)) {
            log.warn("Impersonation denied: actor={}, target={}", actor.getId(), target.getId());
            throw ForbiddenException.impersonationNotAllowed(actor.getId(), target.getId());
        }
    }

    @Override
    public boolean isInstructorFor(User actor, User target) {
        if (!actor.isInstructor()) {
            return false;
        }
        if (target.isStudent()) {
            Set<Course> courses = courseMembershipIndex.coursesInstructedBy(actor);
            return courseMembershipIndex.participatesInAny(target, courses);
        }
        if (target.isTeachingAssistant()) {
            return courseMembershipIndex.sharedCourseExists(
                    courseMembershipIndex.coursesInstructedBy(actor),
                    courseMembershipIndex.coursesAssistedBy(target));
        }
        return false;
    }

    @Override
    public boolean isTeachingAssistantFor(User actor, User target) {
        if (!actor.isTeachingAssistant() || !target.isStudent()) {
            return false;
        }
        Set<Course> courses = courseMembershipIndex.coursesAssistedBy(actor);
        return courseMembershipIndex.participatesInAny(target, courses);
    }

    @Override
    public Long instructorId(User user) {
        switch (roleGraph.kindOf(user.getRole())) {
            case INSTRUCTOR:
            case ADMINISTRATOR:
            case SUPER_ADMINISTRATOR:
                return user.getId();
            case TEACHING_ASSISTANT:
                return supervisingInstructorId(user);
            default:
                throw UnsupportedRoleException.unknownRole(user.getRole());
        }
    }

    private Long supervisingInstructorId(User ta) {
        TaMapping mapping = taMappingRepository.findFirstByTaOrderByIdAsc(ta)
                .orElseThrow(() -> ResourceNotFoundException.instructorNotFound(ta.getId()));
        User instructor = mapping.getCourse().getInstructor();
        if (instructor == null) {
            throw ResourceNotFoundException.instructorNotFound(ta.getId());
        }
        return instructor.getId();
    }
}
