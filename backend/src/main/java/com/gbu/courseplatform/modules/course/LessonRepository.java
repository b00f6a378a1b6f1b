package com.gbu.courseplatform.modules.course;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LessonRepository extends JpaRepository<Lesson, Long> {

    List<Lesson> findByCourseIdOrderByOrderIndexAsc(Long courseId);

    long countByCourseId(Long courseId);

    @Query("SELECT l FROM Lesson l WHERE l.id = :lessonId AND l.course.id = :courseId")
    Optional<Lesson> findByIdAndCourseId(@Param("lessonId") Long lessonId, @Param("courseId") Long courseId);
}
