package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeReviewRequestDto {
    private String resumeText;
    private String jobDescription;
    private String companyName;
}
