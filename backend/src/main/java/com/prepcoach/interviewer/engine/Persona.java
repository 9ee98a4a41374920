package com.prepcoach.interviewer.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Advisory interviewer tone handed to the question generator.
 */
@Getter
@RequiredArgsConstructor
public enum Persona {
    SUPPORTIVE("supportive"),
    NEUTRAL("neutral"),
    CHALLENGING("challenging");

    private final String tag;
}
