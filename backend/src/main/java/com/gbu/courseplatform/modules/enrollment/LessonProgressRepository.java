package com.gbu.courseplatform.modules.enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LessonProgressRepository extends JpaRepository<LessonProgress, Long> {

    @Query("SELECT p FROM LessonProgress p WHERE p.enrollment.id = :enrollmentId AND p.lesson.id = :lessonId")
    Optional<LessonProgress> findByEnrollmentIdAndLessonId(@Param("enrollmentId") Long enrollmentId,
            @Param("lessonId") Long lessonId);

    /** Completed rows whose lesson still belongs to the enrollment's course. */
    @Query("SELECT COUNT(p) FROM LessonProgress p WHERE p.enrollment.id = :enrollmentId " +
            "AND p.completed = true AND p.lesson.course.id = p.enrollment.course.id")
    long countCompleted(@Param("enrollmentId") Long enrollmentId);

    @Query("SELECT p FROM LessonProgress p JOIN FETCH p.lesson l WHERE p.enrollment.id = :enrollmentId " +
            "ORDER BY l.orderIndex ASC")
    List<LessonProgress> findByEnrollmentIdOrderByLessonOrder(@Param("enrollmentId") Long enrollmentId);

    long countByEnrollmentId(Long enrollmentId);
}
