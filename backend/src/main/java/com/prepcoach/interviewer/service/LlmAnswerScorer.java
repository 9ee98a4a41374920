package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.AnswerScorer;
import com.prepcoach.interviewer.engine.ScoreJudgment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmAnswerScorer implements AnswerScorer {

    private final LlmClient llmClient;
    private final JudgmentParser judgmentParser;

    @Override
    public ScoreJudgment score(String question, String answer, String nonVerbalSignal) {
        log.debug("Scoring {} char answer", answer.length());
        ScoreJudgment judgment = judgmentParser.parseJudgment(llmClient.generate(buildPrompt(question, answer, nonVerbalSignal), 0.3));
        log.debug("Scored {}/10, sentiment {}", judgment.getScore(), judgment.getSentiment());
        return judgment;
    }

    private String buildPrompt(String question, String answer, String nonVerbalSignal) {
        String delivery = nonVerbalSignal == null || nonVerbalSignal.trim().isEmpty()
                ? ""
                : "\nNON-VERBAL OBSERVATION: " + nonVerbalSignal.trim() + "\n";
        return """
                You are a silent interview coach evaluating a candidate's answer.

                QUESTION: %s
                ANSWER: %s
                %s
                Evaluate using the STAR method (Situation, Task, Action, Result):
                1. Did they answer the specific question asked?
                2. Was the answer structured?
                3. Did they show confidence or hesitation?
                4. Was it too brief or too rambling?

                Be strict: a weak or off-topic answer scores 1-3, an excellent one 9-10.

                Return ONLY a JSON object, no markdown:
                {"score": 7, "strengths": "...", "weaknesses": "...", "tip": "...", "sentiment": "confident"}
                """.formatted(question, answer, delivery);
    }
}
