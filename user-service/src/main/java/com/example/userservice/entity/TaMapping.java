package com.example.userservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Assigns a teaching assistant to a course.
 * The instructor of the earliest mapping is the TA's supervising instructor.
 */
@Entity
@Table(name = "ta_mappings")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ta_id", nullable = false)
    private User ta;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false)
    private Course course;
}
