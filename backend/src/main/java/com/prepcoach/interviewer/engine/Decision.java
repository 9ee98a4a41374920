package com.prepcoach.interviewer.engine;

public enum Decision {
    PUSHBACK,
    ADVANCE,
    EARLY_TERMINATE,
    REPORT
}
