package com.prepcoach.interviewer.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum InterviewStage {
    INTRO("intro"),
    TECHNICAL("technical"),
    BEHAVIORAL("behavioral"),
    CLOSING("closing"),
    COMPLETE("complete");

    private final String label;

    public boolean isAfter(InterviewStage other) {
        return ordinal() > other.ordinal();
    }

    public static InterviewStage fromLabel(String label) {
        for (InterviewStage stage : values()) {
            if (stage.label.equals(label)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown interview stage: " + label);
    }
}
