package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.exception.AlreadyEnrolledException;
import com.gbu.courseplatform.exception.BusinessException;
import com.gbu.courseplatform.exception.ResourceNotFoundException;
import com.gbu.courseplatform.modules.course.Course;
import com.gbu.courseplatform.modules.course.CourseLookupService;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentDetailDto;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentDto;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentProgressDto;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentStatusDto;
import com.gbu.courseplatform.modules.user.User;
import com.gbu.courseplatform.modules.user.UserRepository;
import com.gbu.courseplatform.security.AccessGuard;
import com.gbu.courseplatform.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final UserRepository userRepository;
    private final CourseLookupService courseLookupService;
    private final ProgressCalculator progressCalculator;
    private final LessonProgressService lessonProgressService;
    private final AccessGuard accessGuard;

    // ── Student: enroll in a course ──────────────────────────────────────────

    @Transactional
    public EnrollmentDto enroll(AuthenticatedUser principal, String courseRef) {
        Course course = courseLookupService.getCourse(courseRef);
        accessGuard.requireEnroll(principal, course);

        if (!Boolean.TRUE.equals(course.getIsPublished())) {
            throw new BusinessException("This course is not published yet");
        }

        // Locking the student row makes the existence check and the insert
        // atomic for this student; the unique constraint stays as a backstop.
        User student = userRepository.findByIdForUpdate(principal.getId())
                .orElseThrow(() -> new ResourceNotFoundException("User", principal.getId().toString()));

        if (enrollmentRepository.existsByCourseIdAndStudentId(course.getId(), student.getId())) {
            throw new AlreadyEnrolledException();
        }

        Enrollment enrollment = Enrollment.builder()
                .student(student)
                .course(course)
                .build();

        try {
            enrollment = enrollmentRepository.saveAndFlush(enrollment);
        } catch (DataIntegrityViolationException e) {
            throw new AlreadyEnrolledException();
        }

        log.info("Student {} enrolled in course {} (enrollment {})", student.getId(), course.getId(),
                enrollment.getId());
        return toDto(enrollment, progressCalculator.computeProgress(enrollment));
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public EnrollmentStatusDto getStatus(AuthenticatedUser principal, String courseRef) {
        Course course = courseLookupService.getCourse(courseRef);
        Optional<Enrollment> enrollment = enrollmentRepository.findByCourseIdAndStudentId(course.getId(),
                principal.getId());

        return enrollment
                .map(e -> EnrollmentStatusDto.builder()
                        .enrolled(true)
                        .enrollmentId(e.getId())
                        .progressPercentage(progressCalculator.computeProgress(e))
                        .build())
                .orElseGet(() -> EnrollmentStatusDto.builder().enrolled(false).build());
    }

    /**
     * Students get their own enrollments; teachers get the enrollments of the
     * courses they teach. Newest first, ties by id.
     */
    @Transactional(readOnly = true)
    public List<EnrollmentDto> listEnrollments(AuthenticatedUser principal) {
        if (principal.isTeacher()) {
            return toDtos(enrollmentRepository.findForTeacher(principal.getId()));
        }
        return listForStudent(principal.getId());
    }

    @Transactional(readOnly = true)
    public List<EnrollmentDto> listForStudent(Long studentId) {
        return toDtos(enrollmentRepository.findForStudent(studentId));
    }

    @Transactional(readOnly = true)
    public List<EnrollmentDto> listForCourse(AuthenticatedUser principal, String courseRef) {
        Course course = courseLookupService.getCourse(courseRef);
        accessGuard.requireManageCourse(principal, course);
        return toDtos(enrollmentRepository.findForCourse(course.getId()));
    }

    @Transactional(readOnly = true)
    public EnrollmentDetailDto getEnrollment(AuthenticatedUser principal, Long enrollmentId) {
        Enrollment enrollment = enrollmentRepository.findById(enrollmentId)
                .orElseThrow(() -> new ResourceNotFoundException("Enrollment", enrollmentId.toString()));
        accessGuard.requireActOnEnrollment(principal, enrollment);

        EnrollmentProgressDto progress = lessonProgressService.buildProgress(enrollment);
        return EnrollmentDetailDto.builder()
                .enrollment(toDto(enrollment, progress.getPercentage()))
                .progress(progress)
                .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private List<EnrollmentDto> toDtos(List<Enrollment> enrollments) {
        return enrollments.stream()
                .map(e -> toDto(e, progressCalculator.computeProgress(e)))
                .collect(Collectors.toList());
    }

    private EnrollmentDto toDto(Enrollment e, int percentage) {
        return EnrollmentDto.builder()
                .id(e.getId())
                .courseId(e.getCourse().getId())
                .courseSlug(e.getCourse().getSlug())
                .courseTitle(e.getCourse().getTitle())
                .studentId(e.getStudent().getId())
                .studentName(e.getStudent().getName())
                .enrolledAt(e.getEnrolledAt())
                .completed(e.getCompleted())
                .completedAt(e.getCompletedAt())
                .progressPercentage(percentage)
                .build();
    }
}
