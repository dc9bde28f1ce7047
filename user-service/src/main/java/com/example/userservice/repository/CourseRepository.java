package com.example.userservice.repository;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CourseRepository extends JpaRepository<Course, Long> {

    /**
     * Courses where the user is instructor of record.
     */
    List<Course> findAllByInstructor(User instructor);
}
