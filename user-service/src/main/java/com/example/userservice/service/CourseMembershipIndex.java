package com.example.userservice.service;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.User;
import com.example.userservice.repository.CourseRepository;
import com.example.userservice.repository.ParticipantRepository;
import com.example.userservice.repository.TaMappingRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves course relationships of users.
 * A user without the matching role record simply has no courses.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CourseMembershipIndex {

    private final CourseRepository courseRepository;
    private final TaMappingRepository taMappingRepository;
    private final ParticipantRepository participantRepository;

    /**
     * Courses where the user is instructor of record.
     */
    public Set<Course> coursesInstructedBy(User user) {
        return new LinkedHashSet<>(courseRepository.findAllByInstructor(user));
    }

    /**
     * Courses the user is mapped to as teaching assistant.
     */
    public Set<Course> coursesAssistedBy(User taUser) {
        return new LinkedHashSet<>(taMappingRepository.findCoursesByTa(taUser));
    }

    /**
     * True if the student participates in any assignment of the course.
     */
    public boolean participatesIn(User student, Course course) {
        return participantRepository.existsByUserAndCourse(student, course);
    }

    /**
     * True if the student participates in an assignment of any of the courses.
     */
    public boolean participatesInAny(User student, Collection<Course> courses) {
        if (courses.isEmpty()) {
            return false;
        }
        return participantRepository.existsByUserAndCourseIn(student, courses);
    }

    public boolean sharedCourseExists(Set<Course> coursesA, Set<Course> coursesB) {
        Set<Course> smaller = coursesA.size() <= coursesB.size() ? coursesA : coursesB;
        Set<Course> larger = smaller == coursesA ? coursesB : coursesA;
        return smaller.stream().anyMatch(larger::contains);
    }
}
