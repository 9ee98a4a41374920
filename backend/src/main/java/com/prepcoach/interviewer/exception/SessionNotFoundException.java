package com.prepcoach.interviewer.exception;

public class SessionNotFoundException extends InterviewException {

    public SessionNotFoundException(long sessionId) {
        super("Session not found: " + sessionId);
    }
}
