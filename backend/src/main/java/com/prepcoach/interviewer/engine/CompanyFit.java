package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * How a resume lines up with what a specific company looks for.
 */
@Value
@Builder
public class CompanyFit {
    String matchLevel;
    String companyExpects;
    String resumeShows;

    @Builder.Default
    List<String> companyGaps = List.of();

    @Builder.Default
    List<String> tailoringTips = List.of();
}
