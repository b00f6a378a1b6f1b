package com.gbu.courseplatform.modules.enrollment.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompleteLessonRequest {

    @NotNull(message = "lessonId is required")
    private Long lessonId;
}
