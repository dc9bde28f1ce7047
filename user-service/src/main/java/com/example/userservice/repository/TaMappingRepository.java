package com.example.userservice.repository;

import com.example.userservice.entity.Course;
import com.example.userservice.entity.TaMapping;
import com.example.userservice.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TaMappingRepository extends JpaRepository<TaMapping, Long> {

    /**
     * Courses the TA is mapped to.
     */
    @Query("SELECT DISTINCT m.course FROM TaMapping m WHERE m.ta = :ta")
    List<Course> findCoursesByTa(@Param("ta") User ta);

    /**
     * Earliest mapping of a TA; its course's instructor supervises the TA.
     */
    Optional<TaMapping> findFirstByTaOrderByIdAsc(User ta);
}
