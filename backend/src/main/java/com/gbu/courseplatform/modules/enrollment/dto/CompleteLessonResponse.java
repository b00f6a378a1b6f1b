package com.gbu.courseplatform.modules.enrollment.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class CompleteLessonResponse {
    private String message;
    private LessonProgressDto progress;
    private int enrollmentProgressPercentage;
    private boolean courseCompleted;
}
