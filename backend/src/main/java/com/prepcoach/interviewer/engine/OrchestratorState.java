package com.prepcoach.interviewer.engine;

import java.util.EnumSet;
import java.util.Set;

public enum OrchestratorState {
    INIT,
    PREPARING,
    AWAITING_ANSWER,
    SCORING,
    DECIDING,
    PUSHBACK_LOOP,
    ADVANCING,
    TERMINATING,
    REPORTING,
    DONE;

    public Set<OrchestratorState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(PREPARING);
            case PREPARING -> EnumSet.of(AWAITING_ANSWER);
            case AWAITING_ANSWER -> EnumSet.of(SCORING);
            case SCORING -> EnumSet.of(DECIDING);
            case DECIDING -> EnumSet.of(PUSHBACK_LOOP, ADVANCING, TERMINATING, REPORTING);
            case PUSHBACK_LOOP, ADVANCING -> EnumSet.of(AWAITING_ANSWER);
            case TERMINATING -> EnumSet.of(REPORTING);
            case REPORTING -> EnumSet.of(DONE);
            case DONE -> EnumSet.noneOf(OrchestratorState.class);
        };
    }

    public boolean canMoveTo(OrchestratorState next) {
        return successors().contains(next);
    }
}
