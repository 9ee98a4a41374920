package com.prepcoach.interviewer.exception;

public class SkippedAnswerException extends InterviewException {

    public SkippedAnswerException(int questionNumber) {
        super("No answer submitted for question " + questionNumber);
    }
}
