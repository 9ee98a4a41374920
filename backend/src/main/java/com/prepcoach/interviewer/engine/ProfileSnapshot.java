package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * What preparation learned about the candidate against the job description.
 */
@Value
@Builder
public class ProfileSnapshot {

    public static final String UNKNOWN_LEVEL = "unknown";

    @Builder.Default
    Set<String> matchedSkills = Set.of();

    @Builder.Default
    Set<String> missingSkills = Set.of();

    @Builder.Default
    List<String> strengths = List.of();

    @Builder.Default
    List<String> weaknesses = List.of();

    @Builder.Default
    String experienceLevel = UNKNOWN_LEVEL;

    @Builder.Default
    List<String> redFlags = List.of();

    public static ProfileSnapshot empty() {
        return ProfileSnapshot.builder().build();
    }
}
