package com.prepcoach.interviewer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepcoach.interviewer.engine.CompanyFit;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.ResumeReview;
import com.prepcoach.interviewer.engine.ScoreJudgment;
import com.prepcoach.interviewer.exception.CollaboratorException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parse-then-validate boundary for JSON produced by the language model.
 * Anything that does not match the expected shape is rejected with
 * {@link CollaboratorException}; nothing is guessed.
 */
@Component
@RequiredArgsConstructor
public class JudgmentParser {

    private static final Set<String> GRADES = Set.of("A", "B", "C", "D", "F");

    private final ObjectMapper objectMapper;

    /**
     * Expects {@code {"score": 0-10, "strengths": "", "weaknesses": "", "tip": "", "sentiment": ""}}.
     * Only {@code score} is mandatory.
     */
    public ScoreJudgment parseJudgment(String raw) {
        JsonNode root = readObject(raw);

        JsonNode score = root.get("score");
        if (score == null || !score.isNumber()) {
            throw new CollaboratorException("Judgment has no numeric score");
        }
        double value = score.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > 10.0) {
            throw new CollaboratorException("Judgment score out of range: " + value);
        }

        return ScoreJudgment.builder()
                .score(value)
                .strengths(text(root, "strengths", ""))
                .weaknesses(text(root, "weaknesses", ""))
                .tip(text(root, "tip", ""))
                .sentiment(text(root, "sentiment", "neutral"))
                .build();
    }

    public ProfileSnapshot parseProfile(String raw) {
        JsonNode root = readObject(raw);
        return ProfileSnapshot.builder()
                .matchedSkills(new LinkedHashSet<>(textArray(root, "matched_skills")))
                .missingSkills(new LinkedHashSet<>(textArray(root, "missing_skills")))
                .strengths(textArray(root, "strengths"))
                .weaknesses(textArray(root, "weaknesses"))
                .experienceLevel(text(root, "experience_level", ProfileSnapshot.UNKNOWN_LEVEL))
                .redFlags(textArray(root, "red_flags"))
                .build();
    }

    /**
     * Expects {@code overall_grade} A-F and {@code ats_score} 0-100; every other field is optional.
     */
    public ResumeReview parseResumeReview(String raw) {
        JsonNode root = readObject(raw);

        String grade = text(root, "overall_grade", "").trim().toUpperCase(Locale.ROOT);
        if (!GRADES.contains(grade)) {
            throw new CollaboratorException("Resume grade must be one of A-F, got '" + grade + "'");
        }

        return ResumeReview.builder()
                .overallGrade(grade)
                .atsScore((int) Math.round(number(root, "ats_score", 100)))
                .redFlags(textArray(root, "red_flags"))
                .fatalFlaws(textArray(root, "fatal_flaws"))
                .strengths(textArray(root, "strengths"))
                .sectionScores(sectionScores(root))
                .improvementTips(textArray(root, "improvement_tips"))
                .companyFit(companyFit(root))
                .detailedFeedback(text(root, "detailed_feedback", ""))
                .build();
    }

    private static Map<String, Integer> sectionScores(JsonNode root) {
        JsonNode node = root.get("section_scores");
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new CollaboratorException("Field 'section_scores' must be an object");
        }
        Map<String, Integer> scores = new LinkedHashMap<>();
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String section = names.next();
            scores.put(section, (int) Math.round(number(node, section, 10)));
        }
        return scores;
    }

    private static CompanyFit companyFit(JsonNode root) {
        JsonNode node = root.get("company_fit");
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new CollaboratorException("Field 'company_fit' must be an object");
        }
        String matchLevel = text(node, "match_level", "");
        if (matchLevel.isBlank()) {
            return null;
        }
        return CompanyFit.builder()
                .matchLevel(matchLevel)
                .companyExpects(text(node, "company_expects", ""))
                .resumeShows(text(node, "resume_shows", ""))
                .companyGaps(textArray(node, "company_gaps"))
                .tailoringTips(textArray(node, "tailoring_tips"))
                .build();
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new CollaboratorException("Empty model output");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(raw.trim()));
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Model output is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CollaboratorException("Model output is not a JSON object");
        }
        return root;
    }

    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text.replace("```", "").trim();
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private static double number(JsonNode root, String field, double max) {
        JsonNode node = root.get(field);
        if (node == null || !node.isNumber()) {
            throw new CollaboratorException("Field '" + field + "' must be a number");
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || value < 0.0 || value > max) {
            throw new CollaboratorException("Field '" + field + "' out of range: " + value);
        }
        return value;
    }

    private static String text(JsonNode root, String field, String defaultValue) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isTextual()) {
            throw new CollaboratorException("Field '" + field + "' must be text");
        }
        return node.asText();
    }

    private static List<String> textArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new CollaboratorException("Field '" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw new CollaboratorException("Field '" + field + "' must contain only text");
            }
            values.add(item.asText());
        }
        return values;
    }
}
