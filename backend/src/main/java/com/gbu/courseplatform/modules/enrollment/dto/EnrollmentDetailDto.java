package com.gbu.courseplatform.modules.enrollment.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class EnrollmentDetailDto {
    private EnrollmentDto enrollment;
    private EnrollmentProgressDto progress;
}
