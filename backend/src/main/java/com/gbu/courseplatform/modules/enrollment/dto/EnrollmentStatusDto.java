package com.gbu.courseplatform.modules.enrollment.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/** Whether the caller should see "Enroll" or "Continue" for a course. */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnrollmentStatusDto {
    private boolean enrolled;
    private Long enrollmentId;
    private Integer progressPercentage;
}
