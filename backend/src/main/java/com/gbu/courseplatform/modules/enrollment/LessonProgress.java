package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.modules.course.Lesson;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "lesson_progress", uniqueConstraints = @UniqueConstraint(name = "uk_lesson_progress_enrollment_lesson", columnNames = {
        "enrollment_id", "lesson_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LessonProgress {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enrollment_id", nullable = false, updatable = false)
    private Enrollment enrollment;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "lesson_id", nullable = false, updatable = false)
    private Lesson lesson;

    @Column(nullable = false)
    @Builder.Default
    private Boolean completed = false;

    @Column(name = "completed_at")
    private Instant completedAt;

    /** One-way transition; the first completion time is kept. */
    public boolean markCompleted(Instant now) {
        if (Boolean.TRUE.equals(completed)) {
            return false;
        }
        completed = true;
        if (completedAt == null) {
            completedAt = now;
        }
        return true;
    }
}
