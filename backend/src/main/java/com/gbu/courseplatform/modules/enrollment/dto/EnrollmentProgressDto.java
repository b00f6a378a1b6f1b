package com.gbu.courseplatform.modules.enrollment.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class EnrollmentProgressDto {
    private Long enrollmentId;
    private int percentage;
    private int completedLessons;
    private int totalLessons;
    private List<Long> completedLessonIds;
    private List<LessonProgressDto> records;
}
