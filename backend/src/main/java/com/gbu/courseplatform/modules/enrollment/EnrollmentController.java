package com.gbu.courseplatform.modules.enrollment;

import com.gbu.courseplatform.modules.enrollment.dto.*;
import com.gbu.courseplatform.security.AuthenticatedUser;
import com.gbu.courseplatform.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
@Tag(name = "Enrollments", description = "Enrollment listing and lesson progress")
public class EnrollmentController {

    private final EnrollmentService enrollmentService;
    private final LessonProgressService lessonProgressService;
    private final PersistenceRetry persistenceRetry;
    private final SecurityUtils securityUtils;

    @GetMapping
    @Operation(summary = "List my enrollments (student) or enrollments in my courses (teacher)")
    public ResponseEntity<List<EnrollmentDto>> listEnrollments() {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(() -> enrollmentService.listEnrollments(principal)));
    }

    @GetMapping("/{enrollmentId}")
    @Operation(summary = "Get an enrollment with its lesson progress (owner only)")
    public ResponseEntity<EnrollmentDetailDto> getEnrollment(@PathVariable Long enrollmentId) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(
                () -> enrollmentService.getEnrollment(principal, enrollmentId)));
    }

    @GetMapping("/{enrollmentId}/progress")
    @Operation(summary = "Get progress percentage and completed lessons (owner only)")
    public ResponseEntity<EnrollmentProgressDto> getProgress(@PathVariable Long enrollmentId) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(
                () -> lessonProgressService.getProgress(principal, enrollmentId)));
    }

    /**
     * Mark a lesson complete. Body: { "lessonId": 42 }. Idempotent.
     */
    @PostMapping("/{enrollmentId}/complete-lesson")
    @Operation(summary = "Mark a lesson of the enrolled course as complete (owner only)")
    public ResponseEntity<CompleteLessonResponse> completeLesson(
            @PathVariable Long enrollmentId,
            @Valid @RequestBody CompleteLessonRequest body) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(
                () -> lessonProgressService.completeLesson(principal, enrollmentId, body.getLessonId())));
    }
}
