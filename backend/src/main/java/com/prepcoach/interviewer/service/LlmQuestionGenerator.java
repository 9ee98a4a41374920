package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.InterviewStage;
import com.prepcoach.interviewer.engine.Persona;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.QuestionGenerator;
import com.prepcoach.interviewer.engine.QuestionRequest;
import com.prepcoach.interviewer.engine.Turn;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmQuestionGenerator implements QuestionGenerator {

    private static final int TRANSCRIPT_TURNS = 4;

    private final LlmClient llmClient;

    @Override
    public String generate(QuestionRequest request) {
        log.debug("Generating {} question for topic {} (intensify={})",
                request.getStage().getLabel(), request.getTopicNumber(), request.isIntensify());
        String response = llmClient.generate(buildPrompt(request), 0.7);
        return cleanQuestion(response);
    }

    String buildPrompt(QuestionRequest request) {
        ProfileSnapshot profile = request.getProfile() != null ? request.getProfile() : ProfileSnapshot.empty();
        StringBuilder prompt = new StringBuilder()
                .append("You are conducting a job interview for ").append(request.getCompanyName()).append(".\n\n")
                .append("COMPANY CONTEXT:\n").append(nullToEmpty(request.getCompanyIntel())).append("\n\n")
                .append("CANDIDATE PROFILE:\n")
                .append("- Strengths: ").append(profile.getStrengths()).append('\n')
                .append("- Areas to dig into: ").append(profile.getWeaknesses()).append('\n')
                .append("- Missing skills: ").append(profile.getMissingSkills()).append("\n\n")
                .append("INTERVIEW STRATEGY:\n").append(nullToEmpty(request.getStrategy())).append("\n\n")
                .append("CURRENT STAGE: ").append(request.getStage().getLabel().toUpperCase()).append('\n')
                .append("YOUR PERSONA: ").append(personaTone(request.getPersona())).append('\n')
                .append(stageInstruction(request.getStage(), profile)).append("\n\n");

        appendTranscript(prompt, request.getTranscript());

        Turn previous = request.getPreviousTurn();
        if (request.isIntensify() && previous != null) {
            prompt.append("You asked: \"").append(previous.getQuestion()).append("\"\n")
                    .append("The candidate answered: \"").append(previous.getAnswer()).append("\"\n")
                    .append("That answer scored ").append(previous.getScore()).append("/10 because: ")
                    .append(previous.getWeaknesses()).append("\n\n")
                    .append("Do NOT move to a new topic. Rephrase the same question and demand specifics: ")
                    .append("concrete implementation details, their personal contribution, numbers and outcomes.\n\n");
        } else if (previous != null) {
            prompt.append("The last answer scored ").append(previous.getScore()).append("/10. ")
                    .append("Move on to a new question for the current stage.\n\n");
        }

        prompt.append("Return ONLY the question, no preamble.");
        return prompt.toString();
    }

    private void appendTranscript(StringBuilder prompt, List<Turn> transcript) {
        if (transcript == null || transcript.isEmpty()) {
            return;
        }
        prompt.append("RECENT TRANSCRIPT:\n");
        for (Turn turn : transcript.subList(Math.max(0, transcript.size() - TRANSCRIPT_TURNS), transcript.size())) {
            prompt.append("Q").append(turn.getQuestionNumber()).append(": ").append(turn.getQuestion()).append('\n')
                    .append("A: ").append(turn.getAnswer()).append('\n');
        }
        prompt.append('\n');
    }

    private String stageInstruction(InterviewStage stage, ProfileSnapshot profile) {
        return switch (stage) {
            case INTRO -> "Open by asking the candidate to walk you through their experience with a key skill "
                    + "from the job description. Avoid a generic 'tell me about yourself'.";
            case TECHNICAL -> "Ask a hard, role-specific technical question, ideally about: "
                    + (profile.getWeaknesses().isEmpty() ? "their weakest area" : profile.getWeaknesses().get(0)) + ".";
            case BEHAVIORAL -> "Ask a challenging behavioral question (failure, conflict, missed deadline) "
                    + "and expect names, dates, numbers and outcomes.";
            case CLOSING -> "Ask how they plan to close a gap, ideally one of: " + profile.getMissingSkills() + ".";
            case COMPLETE -> "Ask whether there is anything else they want you to know.";
        };
    }

    private String personaTone(Persona persona) {
        if (persona == null) {
            return "Professional, fact-checking, probing for depth.";
        }
        return switch (persona) {
            case SUPPORTIVE -> "Professional but direct. Guide with leading questions if they struggle, never give answers away.";
            case NEUTRAL -> "Professional, fact-checking, probing for depth. No fluff.";
            case CHALLENGING -> "A tough senior engineer. Blunt about weak answers, demands technical precision.";
        };
    }

    static String cleanQuestion(String response) {
        String clean = response.trim();
        String[] prefixes = {"Question:", "Q:", "Interview Question:"};
        for (String prefix : prefixes) {
            if (clean.startsWith(prefix)) {
                clean = clean.substring(prefix.length()).trim();
            }
        }
        if (clean.length() >= 2 && clean.startsWith("\"") && clean.endsWith("\"")) {
            clean = clean.substring(1, clean.length() - 1).trim();
        }
        return clean;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
