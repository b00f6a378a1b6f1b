package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.exception.InvalidLessonException;
import com.gbu.courseplatform.exception.ResourceNotFoundException;
import com.gbu.courseplatform.modules.course.Lesson;
import com.gbu.courseplatform.modules.course.LessonRepository;
import com.gbu.courseplatform.modules.enrollment.dto.CompleteLessonResponse;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentProgressDto;
import com.gbu.courseplatform.modules.enrollment.dto.LessonProgressDto;
import com.gbu.courseplatform.security.AccessGuard;
import com.gbu.courseplatform.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class LessonProgressService {

    static final String MARKED_COMPLETE = "Lesson marked as complete";
    static final String ALREADY_COMPLETED = "Lesson already completed";

    private final EnrollmentRepository enrollmentRepository;
    private final LessonRepository lessonRepository;
    private final LessonProgressRepository lessonProgressRepository;
    private final ProgressCalculator progressCalculator;
    private final AccessGuard accessGuard;

    /**
     * Marks a lesson complete for the enrollment's owner. Repeating the call is
     * a no-op that reports the stored row and the current percentage.
     */
    @Transactional
    public CompleteLessonResponse completeLesson(AuthenticatedUser principal, Long enrollmentId, Long lessonId) {
        // Completions of one enrollment run one at a time from here on
        Enrollment enrollment = enrollmentRepository.findByIdForUpdate(enrollmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Enrollment", enrollmentId.toString()));
        accessGuard.requireActOnEnrollment(principal, enrollment);

        Lesson lesson = lessonRepository.findByIdAndCourseId(lessonId, enrollment.getCourse().getId())
                .orElseThrow(() -> new InvalidLessonException(lessonId));

        Optional<LessonProgress> existing = lessonProgressRepository
                .findByEnrollmentIdAndLessonId(enrollmentId, lessonId);

        if (existing.isPresent() && Boolean.TRUE.equals(existing.get().getCompleted())) {
            log.debug("Lesson {} already completed for enrollment {}", lessonId, enrollmentId);
            return CompleteLessonResponse.builder()
                    .message(ALREADY_COMPLETED)
                    .progress(LessonProgressDto.from(existing.get()))
                    .enrollmentProgressPercentage(progressCalculator.computeProgress(enrollment))
                    .courseCompleted(Boolean.TRUE.equals(enrollment.getCompleted()))
                    .build();
        }

        LessonProgress progress = existing.orElseGet(() -> LessonProgress.builder()
                .enrollment(enrollment)
                .lesson(lesson)
                .build());
        progress.markCompleted(now());

        try {
            progress = lessonProgressRepository.saveAndFlush(progress);
        } catch (DataIntegrityViolationException e) {
            // Another writer got past the lock (e.g. a second node without it); a retry will read its row
            throw new ConcurrencyFailureException("Concurrent completion of lesson " + lessonId
                    + " for enrollment " + enrollmentId, e);
        }

        int percentage = progressCalculator.computeProgress(enrollment);
        markCourseCompletedIfDone(enrollment, percentage);

        log.info("Enrollment {} completed lesson {} ({}%)", enrollmentId, lessonId, percentage);
        return CompleteLessonResponse.builder()
                .message(MARKED_COMPLETE)
                .progress(LessonProgressDto.from(progress))
                .enrollmentProgressPercentage(percentage)
                .courseCompleted(Boolean.TRUE.equals(enrollment.getCompleted()))
                .build();
    }

    @Transactional(readOnly = true)
    public EnrollmentProgressDto getProgress(AuthenticatedUser principal, Long enrollmentId) {
        Enrollment enrollment = findEnrollment(enrollmentId);
        accessGuard.requireActOnEnrollment(principal, enrollment);
        return buildProgress(enrollment);
    }

    /** Caller must have checked access to the enrollment. */
    @Transactional(readOnly = true)
    public EnrollmentProgressDto buildProgress(Enrollment enrollment) {
        ProgressCalculator.ProgressSnapshot snapshot = progressCalculator.snapshot(enrollment);
        List<LessonProgressDto> records = lessonProgressRepository
                .findByEnrollmentIdOrderByLessonOrder(enrollment.getId())
                .stream()
                .map(LessonProgressDto::from)
                .collect(Collectors.toList());

        return EnrollmentProgressDto.builder()
                .enrollmentId(enrollment.getId())
                .percentage(snapshot.getPercentage())
                .completedLessons(snapshot.getCompletedLessons())
                .totalLessons(snapshot.getTotalLessons())
                .completedLessonIds(snapshot.getCompletedLessonIds())
                .records(records)
                .build();
    }

    private void markCourseCompletedIfDone(Enrollment enrollment, int percentage) {
        if (percentage == 100 && !Boolean.TRUE.equals(enrollment.getCompleted())) {
            enrollment.setCompleted(true);
            enrollment.setCompletedAt(now());
            enrollmentRepository.save(enrollment);
            log.info("Enrollment {} completed course {}", enrollment.getId(), enrollment.getCourse().getId());
        }
    }

    // timestamp(6) columns keep microseconds; responses must match what a re-read returns
    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    private Enrollment findEnrollment(Long enrollmentId) {
        return enrollmentRepository.findById(enrollmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Enrollment", enrollmentId.toString()));
    }
}
