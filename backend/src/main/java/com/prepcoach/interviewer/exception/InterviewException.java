package com.prepcoach.interviewer.exception;

/**
 * Base type for every failure raised while running an interview session.
 */
public class InterviewException extends RuntimeException {

    public InterviewException(String message) {
        super(message);
    }

    public InterviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
