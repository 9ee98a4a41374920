package com.prepcoach.interviewer.engine;

import lombok.Value;

@Value
public class StagePlan {
    InterviewStage stage;
    Persona persona;
}
