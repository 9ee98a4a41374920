package com.prepcoach.interviewer.engine;

import lombok.Getter;

/**
 * Live state of the topic currently being asked, including its pushback budget use.
 */
@Getter
public class TopicState {

    private final int topicNumber;
    private String openingQuestion;
    private int pushbackCount;

    TopicState(int topicNumber) {
        this.topicNumber = topicNumber;
    }

    void openWith(String question) {
        if (openingQuestion == null) {
            openingQuestion = question;
        }
    }

    void recordPushback() {
        pushbackCount++;
    }
}
