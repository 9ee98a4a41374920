package com.prepcoach.interviewer.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * What the caller sees after submitting an answer.
 */
@Getter
@RequiredArgsConstructor
public enum DecisionState {
    CONTINUING("continuing"),
    PUSHBACK("pushback"),
    TERMINATED("terminated"),
    REPORTING("reporting");

    private final String label;
}
