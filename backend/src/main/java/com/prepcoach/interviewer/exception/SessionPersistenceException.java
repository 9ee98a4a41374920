package com.prepcoach.interviewer.exception;

/**
 * A storage write failed. Never rolls back the in-memory session.
 */
public class SessionPersistenceException extends InterviewException {

    public SessionPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
