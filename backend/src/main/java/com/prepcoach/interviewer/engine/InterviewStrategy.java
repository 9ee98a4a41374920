package com.prepcoach.interviewer.engine;

import lombok.Value;

@Value
public class InterviewStrategy {
    String plan;
    Persona persona;
}
