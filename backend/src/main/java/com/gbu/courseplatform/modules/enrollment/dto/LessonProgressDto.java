package com.gbu.courseplatform.modules.enrollment.dto;

import com.gbu.courseplatform.modules.enrollment.LessonProgress;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class LessonProgressDto {
    private Long id;
    private Long enrollmentId;
    private Long lessonId;
    private String lessonTitle;
    private Integer lessonOrder;
    private Boolean completed;
    private Instant completedAt;

    public static LessonProgressDto from(LessonProgress p) {
        return LessonProgressDto.builder()
                .id(p.getId())
                .enrollmentId(p.getEnrollment().getId())
                .lessonId(p.getLesson().getId())
                .lessonTitle(p.getLesson().getTitle())
                .lessonOrder(p.getLesson().getOrderIndex())
                .completed(p.getCompleted())
                .completedAt(p.getCompletedAt())
                .build();
    }
}
