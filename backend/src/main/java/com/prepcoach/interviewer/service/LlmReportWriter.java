package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.ReportRequest;
import com.prepcoach.interviewer.engine.ReportText;
import com.prepcoach.interviewer.engine.ReportWriter;
import com.prepcoach.interviewer.engine.Turn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Asks the model for a verdict paragraph and a practice roadmap, separated by a marker line.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LlmReportWriter implements ReportWriter {

    static final String ROADMAP_MARKER = "ROADMAP:";

    private final LlmClient llmClient;

    @Override
    public ReportText write(ReportRequest request) {
        log.info("Writing report for {} ({} answers)", request.getCandidateName(), request.getTurns().size());
        String response = llmClient.generate(buildPrompt(request), 0.3);
        return split(response);
    }

    static ReportText split(String response) {
        int marker = response.indexOf(ROADMAP_MARKER);
        if (marker < 0) {
            return new ReportText(response.trim(), "");
        }
        String verdict = response.substring(0, marker).replaceFirst("^\\s*VERDICT:", "").trim();
        String roadmap = response.substring(marker + ROADMAP_MARKER.length()).trim();
        return new ReportText(verdict, roadmap);
    }

    private String buildPrompt(ReportRequest request) {
        StringBuilder answers = new StringBuilder();
        for (Turn turn : request.getTurns()) {
            answers.append(String.format(Locale.ROOT, "Q%d [%s] score %.1f/10%s%n  strengths: %s%n  weaknesses: %s%n  tip: %s%n",
                    turn.getQuestionNumber(), turn.getStage().getLabel(), turn.getScore(),
                    turn.isDegraded() ? " (evaluation degraded, discount it)" : "",
                    turn.getStrengths(), turn.getWeaknesses(), turn.getTip()));
        }
        String termination = request.getEarlyTerminationReason() == null
                ? ""
                : "The interview was ended early: " + request.getEarlyTerminationReason() + "\n";
        return """
                Write an interview performance report for %s (interviewing at %s).

                OVERALL SCORE: %s/10
                %sCANDIDATE STRENGTHS: %s
                AREAS TO IMPROVE: %s
                TOPICS FAILED AFTER PUSHBACK: %s

                ANSWER-BY-ANSWER FEEDBACK:
                %s
                Respond in exactly two sections:
                VERDICT: one honest paragraph on overall performance and hiring readiness.
                ROADMAP: the top areas to improve and specific action items for the next interview.
                """.formatted(request.getCandidateName(), request.getCompanyName(),
                String.format(Locale.ROOT, "%.1f", request.getOverallScore()), termination,
                request.getProfile().getStrengths(), request.getProfile().getWeaknesses(),
                request.getFailedTopics(), answers);
    }
}
