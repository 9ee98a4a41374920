package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SessionStart {
    long sessionId;
    String question;
    int questionNumber;
    InterviewStage stage;
    Persona persona;
    List<String> warnings;
}
