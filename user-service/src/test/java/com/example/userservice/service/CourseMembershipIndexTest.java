package com.example.userservice.service;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.RoleKind;
import com.example.userservice.entity.User;
import com.example.userservice.repository.CourseRepository;
import com.example.userservice.repository.ParticipantRepository;
import com.example.userservice.repository.TaMappingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static com.example.userservice.support.Fixtures.course;
import static com.example.userservice.support.Fixtures.role;
import static com.example.userservice.support.Fixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CourseMembershipIndexTest {

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private TaMappingRepository taMappingRepository;

    @Mock
    private ParticipantRepository participantRepository;

    private CourseMembershipIndex index;

    private User instructor;
    private User ta;
    private User student;

    @BeforeEach
    void setUp() {
        index = new CourseMembershipIndex(courseRepository, taMappingRepository, participantRepository);
        instructor = user(1, "ivy", role(3, RoleKind.INSTRUCTOR));
        ta = user(2, "tom", role(2, RoleKind.TEACHING_ASSISTANT));
        student = user(3, "sam", role(1, RoleKind.STUDENT));
    }

    @Test
    @DisplayName("courses instructed come from the instructor of record")
    void coursesInstructedBy() {
        Course c1 = course(10, instructor);
        Course c2 = course(11, instructor);
        when(courseRepository.findAllByInstructor(instructor)).thenReturn(List.of(c1, c2));

        assertThat(index.coursesInstructedBy(instructor)).containsExactly(c1, c2);
    }

    @Test
    @DisplayName("user without matching records has no courses")
    void noRecordsYieldsEmptySet() {
        when(courseRepository.findAllByInstructor(student)).thenReturn(List.of());
        when(taMappingRepository.findCoursesByTa(student)).thenReturn(List.of());

        assertThat(index.coursesInstructedBy(student)).isEmpty();
        assertThat(index.coursesAssistedBy(student)).isEmpty();
    }

    @Test
    @DisplayName("courses assisted come from TA mappings")
    void coursesAssistedBy() {
        Course c = course(10, instructor);
        when(taMappingRepository.findCoursesByTa(ta)).thenReturn(List.of(c));

        assertThat(index.coursesAssistedBy(ta)).containsExactly(c);
    }

    @Test
    @DisplayName("participation in a single course is delegated to the participant records")
    void participatesIn() {
        Course c = course(10, instructor);
        when(participantRepository.existsByUserAndCourse(student, c)).thenReturn(true);

        assertThat(index.participatesIn(student, c)).isTrue();
    }

    @Test
    @DisplayName("participation in no courses is false without querying")
    void participatesInAnyEmpty() {
        assertThat(index.participatesInAny(student, Set.of())).isFalse();
        verifyNoInteractions(participantRepository);
    }

    @Test
    @DisplayName("shared course exists only when the sets intersect")
    void sharedCourseExists() {
        Course c1 = course(10, instructor);
        Course c2 = course(11, instructor);
        Course c3 = course(12, instructor);

        assertThat(index.sharedCourseExists(Set.of(c1, c2), Set.of(c2, c3))).isTrue();
        assertThat(index.sharedCourseExists(Set.of(c1), Set.of(c3))).isFalse();
        assertThat(index.sharedCourseExists(Set.of(), Set.of(c1))).isFalse();
    }
}
