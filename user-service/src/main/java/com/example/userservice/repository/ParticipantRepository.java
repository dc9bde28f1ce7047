package com.example.userservice.repository;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.Participant;
import com.example.userservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface ParticipantRepository extends JpaRepository<Participant, Long> {

    /**
     * Check if user participates in any assignment of the course.
     */
    @Query("SELECT CASE WHEN COUNT(p) > 0 THEN true ELSE false END " +
           "FROM Participant p " +
           "WHERE p.user = :user AND p.assignment.course = :course")
    boolean existsByUserAndCourse(@Param("user") User user,
                                  @Param("course") Course course);

    /**
     * Check if user participates in any assignment of any of the courses.
     */
    @Query("SELECT CASE WHEN COUNT(p) > 0 THEN true ELSE false END " +
           "FROM Participant p " +
           "WHERE p.user = :user AND p.assignment.course IN :courses")
    boolean existsByUserAndCourseIn(@Param("user") User user,
                                    @Param("courses") Collection<Course> courses);
}
