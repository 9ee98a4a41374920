package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Input for {@link QuestionGenerator}. On pushback {@code intensify} is set and the
 * previous question/answer belong to the same topic.
 */
@Value
@Builder
public class QuestionRequest {
    InterviewStage stage;
    Persona persona;
    int topicNumber;
    boolean intensify;
    String companyName;
    String companyIntel;
    String strategy;
    ProfileSnapshot profile;
    Turn previousTurn;
    List<Turn> transcript;
}
