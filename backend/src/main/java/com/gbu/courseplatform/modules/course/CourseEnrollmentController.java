package com.gbu.courseplatform.modules.course;

import com.gbu.courseplatform.modules.enrollment.EnrollmentService;
import com.gbu.courseplatform.modules.enrollment.PersistenceRetry;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentDto;
import com.gbu.courseplatform.modules.enrollment.dto.EnrollmentStatusDto;
import com.gbu.courseplatform.security.AuthenticatedUser;
import com.gbu.courseplatform.security.SecurityUtils;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Enrollment endpoints addressed through a course. {@code courseRef} is the
 * course slug or its numeric id.
 */
@RestController
@RequestMapping("/api/courses/{courseRef}")
@RequiredArgsConstructor
@Tag(name = "Course enrollment", description = "Enroll in a course and check enrollment status")
public class CourseEnrollmentController {

    private final EnrollmentService enrollmentService;
    private final PersistenceRetry persistenceRetry;
    private final SecurityUtils securityUtils;

    @PostMapping("/enroll")
    @Operation(summary = "Enroll in a published course (Student only)")
    public ResponseEntity<EnrollmentDto> enroll(@PathVariable String courseRef) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(persistenceRetry.execute(() -> enrollmentService.enroll(principal, courseRef)));
    }

    @GetMapping("/enrollment-status")
    @Operation(summary = "Check whether I am enrolled in this course")
    public ResponseEntity<EnrollmentStatusDto> enrollmentStatus(@PathVariable String courseRef) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(() -> enrollmentService.getStatus(principal, courseRef)));
    }

    @GetMapping("/enrollments")
    @Operation(summary = "List the students enrolled in my course with their progress (Course teacher only)")
    public ResponseEntity<List<EnrollmentDto>> courseEnrollments(@PathVariable String courseRef) {
        AuthenticatedUser principal = securityUtils.getCurrentUser();
        return ResponseEntity.ok(persistenceRetry.execute(
                () -> enrollmentService.listForCourse(principal, courseRef)));
    }
}
