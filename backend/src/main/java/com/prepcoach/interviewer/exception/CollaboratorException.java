package com.prepcoach.interviewer.exception;

/**
 * A generation, scoring, research or report call failed or returned data
 * that does not match the expected shape.
 */
public class CollaboratorException extends InterviewException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
