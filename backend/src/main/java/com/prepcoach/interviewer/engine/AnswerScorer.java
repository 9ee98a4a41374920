package com.prepcoach.interviewer.engine;

import com.prepcoach.interviewer.exception.CollaboratorException;

public interface AnswerScorer {

    /**
     * @param nonVerbalSignal optional delivery observation, may be null
     * @throws CollaboratorException when the call fails or the judgment is malformed
     */
    ScoreJudgment score(String question, String answer, String nonVerbalSignal);
}
