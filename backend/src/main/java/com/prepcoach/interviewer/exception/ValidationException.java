package com.prepcoach.interviewer.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when required setup inputs are missing. No session is created.
 */
@Getter
public class ValidationException extends InterviewException {

    private final List<String> missingFields;

    public ValidationException(List<String> missingFields) {
        super("Missing required setup input: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }
}
