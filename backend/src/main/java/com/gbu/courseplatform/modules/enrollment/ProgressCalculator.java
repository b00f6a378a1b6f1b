package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.modules.course.CourseLookupService;
import com.gbu.courseplatform.modules.course.Lesson;
import com.gbu.courseplatform.modules.course.LessonRepository;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives an enrollment's completion percentage from its lesson progress rows.
 *
 * <p>Nothing is cached: the lesson count of a course can change independently
 * of the completion count, so every caller recomputes.
 */
@Component
@RequiredArgsConstructor
public class ProgressCalculator {

    private final LessonRepository lessonRepository;
    private final LessonProgressRepository lessonProgressRepository;
    private final CourseLookupService courseLookupService;

    /**
     * Whole-number percentage, truncated, so that 100 means every lesson is
     * done. A course without lessons reports 0.
     */
    public static int percentage(long completed, long total) {
        if (total <= 0 || completed <= 0) {
            return 0;
        }
        long value = (100L * completed) / total;
        return (int) Math.min(100L, value);
    }

    public int computeProgress(Enrollment enrollment) {
        long total = lessonRepository.countByCourseId(enrollment.getCourse().getId());
        long completed = lessonProgressRepository.countCompleted(enrollment.getId());
        return percentage(completed, total);
    }

    public ProgressSnapshot snapshot(Enrollment enrollment) {
        List<Lesson> lessons = courseLookupService.listLessons(enrollment.getCourse().getId());
        Set<Long> done = lessonProgressRepository.findByEnrollmentIdOrderByLessonOrder(enrollment.getId())
                .stream()
                .filter(p -> Boolean.TRUE.equals(p.getCompleted()))
                .map(p -> p.getLesson().getId())
                .collect(Collectors.toSet());

        List<Long> completedLessonIds = lessons.stream()
                .map(Lesson::getId)
                .filter(done::contains)
                .collect(Collectors.toList());

        return ProgressSnapshot.builder()
                .percentage(percentage(completedLessonIds.size(), lessons.size()))
                .completedLessons(completedLessonIds.size())
                .totalLessons(lessons.size())
                .completedLessonIds(completedLessonIds)
                .build();
    }

    @Data
    @Builder
    public static class ProgressSnapshot {
        private int percentage;
        private int completedLessons;
        private int totalLessons;
        private List<Long> completedLessonIds;
    }
}
