package com.gbu.courseplatform.modules.enrollment.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class EnrollmentDto {
    private Long id;
    private Long courseId;
    private String courseSlug;
    private String courseTitle;
    private Long studentId;
    private String studentName;
    private Instant enrolledAt;
    private Boolean completed;
    private Instant completedAt;
    private int progressPercentage;
}
