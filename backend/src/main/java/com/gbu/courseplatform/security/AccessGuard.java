package com.gbu.courseplatform.security;

import com.gbu.courseplatform.exception.UnauthorizedAccessException;
import com.gbu.courseplatform.modules.course.Course;
import com.gbu.courseplatform.modules.enrollment.Enrollment;
import org.springframework.stereotype.Component;

/**
 * Role and ownership rules for courses and enrollments.
 *
 * <p>The {@code can*} methods are side-effect free. The {@code require*}
 * variants throw {@link UnauthorizedAccessException}; callers must have
 * loaded the resource first, so a missing resource surfaces as 404 and never
 * as 403.
 */
@Component
public class AccessGuard {

    static final String MANAGE_COURSE_DENIED = "You can only modify your own courses.";
    static final String ENROLL_DENIED = "Only students can perform this action.";
    static final String ENROLLMENT_DENIED = "You must be enrolled in this course.";

    public boolean canManageCourse(AuthenticatedUser principal, Course course) {
        return principal != null
                && principal.isTeacher()
                && course.getTeacher() != null
                && principal.getId().equals(course.getTeacher().getId());
    }

    public boolean canEnroll(AuthenticatedUser principal, Course course) {
        return principal != null && principal.isStudent();
    }

    public boolean canActOnEnrollment(AuthenticatedUser principal, Enrollment enrollment) {
        return principal != null
                && enrollment.getStudent() != null
                && principal.getId().equals(enrollment.getStudent().getId());
    }

    public void requireManageCourse(AuthenticatedUser principal, Course course) {
        if (!canManageCourse(principal, course)) {
            throw new UnauthorizedAccessException(MANAGE_COURSE_DENIED);
        }
    }

    public void requireEnroll(AuthenticatedUser principal, Course course) {
        if (!canEnroll(principal, course)) {
            throw new UnauthorizedAccessException(ENROLL_DENIED);
        }
    }

    public void requireActOnEnrollment(AuthenticatedUser principal, Enrollment enrollment) {
        if (!canActOnEnrollment(principal, enrollment)) {
            throw new UnauthorizedAccessException(ENROLLMENT_DENIED);
        }
    }
}
