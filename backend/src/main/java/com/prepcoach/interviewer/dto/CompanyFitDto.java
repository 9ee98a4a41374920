package com.prepcoach.interviewer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompanyFitDto {
    private String matchLevel;
    private String companyExpects;
    private String resumeShows;
    private List<String> companyGaps;
    private List<String> tailoringTips;
}
