package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.modules.course.Course;
import com.gbu.courseplatform.modules.user.User;
import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One student in one course. The progress percentage is not a column; it is
 * derived from {@link LessonProgress} rows by {@link ProgressCalculator}.
 */
@Entity
@Table(name = "enrollments", uniqueConstraints = @UniqueConstraint(name = "uk_enrollments_student_course", columnNames = {
        "student_id", "course_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Enrollment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "student_id", nullable = false, updatable = false)
    private User student;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "course_id", nullable = false, updatable = false)
    private Course course;

    @Column(name = "enrolled_at", nullable = false, updatable = false)
    private Instant enrolledAt;

    /** Set once, the first time every lesson of the course is completed. */
    @Column(nullable = false)
    @Builder.Default
    private Boolean completed = false;

    @Column(name = "completed_at")
    private Instant completedAt;

    /** Microsecond precision, as stored, so the returned value matches later reads. */
    @PrePersist
    void prePersist() {
        if (enrolledAt == null) {
            enrolledAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
        }
    }
}
