package com.prepcoach.interviewer.exception;

import com.prepcoach.interviewer.engine.OrchestratorState;

public class IllegalSessionStateException extends InterviewException {

    public IllegalSessionStateException(String action, OrchestratorState current) {
        super("Cannot " + action + " while session is " + current);
    }

    public IllegalSessionStateException(String message) {
        super(message);
    }
}
