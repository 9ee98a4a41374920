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
public class SessionStatsDto {
    private SessionSummaryDto session;
    private List<QaLogDto> questions;
    private ProfileAnalysisDto profile;
    private Double averageScore;
}
