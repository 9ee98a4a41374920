package com.prepcoach.interviewer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.ResumeReview;
import com.prepcoach.interviewer.engine.ScoreJudgment;
import com.prepcoach.interviewer.exception.CollaboratorException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class JudgmentParserTest {

    private final JudgmentParser parser = new JudgmentParser(new ObjectMapper());

    @Test
    void parsesCompleteJudgment() {
        ScoreJudgment judgment = parser.parseJudgment("""
                {"score": 7.5, "strengths": "clear structure", "weaknesses": "no metrics",
                 "tip": "quantify impact", "sentiment": "confident"}
                """);

        assertThat(judgment.getScore()).isEqualTo(7.5);
        assertThat(judgment.getStrengths()).isEqualTo("clear structure");
        assertThat(judgment.getTip()).isEqualTo("quantify impact");
        assertThat(judgment.getSentiment()).isEqualTo("confident");
        assertThat(judgment.isDegraded()).isFalse();
    }

    @Test
    void acceptsFencedJsonAndDefaultsOptionalFields() {
        ScoreJudgment judgment = parser.parseJudgment("```json\n{\"score\": 3}\n```");

        assertThat(judgment.getScore()).isEqualTo(3.0);
        assertThat(judgment.getWeaknesses()).isEmpty();
        assertThat(judgment.getSentiment()).isEqualTo("neutral");
    }

    @Test
    void rejectsScoreOutOfRange() {
        assertThatThrownBy(() -> parser.parseJudgment("{\"score\": 11}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("out of range");
    }

    @Test
    void rejectsNonNumericScore() {
        assertThatThrownBy(() -> parser.parseJudgment("{\"score\": \"8\"}"))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void rejectsProse() {
        assertThatThrownBy(() -> parser.parseJudgment("I would give this answer a 7."))
                .isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> parser.parseJudgment("[7]"))
                .isInstanceOf(CollaboratorException.class);
        assertThatThrownBy(() -> parser.parseJudgment(""))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void rejectsNonTextFeedback() {
        assertThatThrownBy(() -> parser.parseJudgment("{\"score\": 6, \"tip\": [\"a\"]}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("tip");
    }

    @Test
    void parsesProfileWithDeduplicatedSkills() {
        ProfileSnapshot profile = parser.parseProfile("""
                {"matched_skills": ["Java", "SQL", "Java"], "missing_skills": ["Kubernetes"],
                 "strengths": ["APIs"], "weaknesses": ["cloud"], "experience_level": "senior"}
                """);

        assertThat(profile.getMatchedSkills()).containsExactly("Java", "SQL");
        assertThat(profile.getMissingSkills()).containsExactly("Kubernetes");
        assertThat(profile.getExperienceLevel()).isEqualTo("senior");
        assertThat(profile.getRedFlags()).isEmpty();
    }

    @Test
    void rejectsProfileWithNonArraySkills() {
        assertThatThrownBy(() -> parser.parseProfile("{\"matched_skills\": \"Java\"}"))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void parsesResumeReviewWithCompanyFit() {
        ResumeReview review = parser.parseResumeReview("""
                {"overall_grade": " b ", "ats_score": 71.6,
                 "red_flags": ["8 month gap in 2022"], "fatal_flaws": [], "strengths": ["quantified results"],
                 "section_scores": {"summary": 4, "work_experience": 7.4},
                 "company_fit": {"match_level": "Fair", "company_expects": "distributed systems",
                                 "resume_shows": "monolith work", "company_gaps": ["Kafka"],
                                 "tailoring_tips": ["lead with the payments migration"]},
                 "improvement_tips": ["cut the objective statement"], "detailed_feedback": "Solid but generic."}
                """);

        assertThat(review.getOverallGrade()).isEqualTo("B");
        assertThat(review.getAtsScore()).isEqualTo(72);
        assertThat(review.getSectionScores()).containsExactly(entry("summary", 4), entry("work_experience", 7));
        assertThat(review.getCompanyFit().getMatchLevel()).isEqualTo("Fair");
        assertThat(review.getCompanyFit().getCompanyGaps()).containsExactly("Kafka");
        assertThat(review.getDetailedFeedback()).isEqualTo("Solid but generic.");
        assertThat(review.isDegraded()).isFalse();
    }

    @Test
    void resumeReviewWithoutFitLeavesItNull() {
        ResumeReview review = parser.parseResumeReview(
                "{\"overall_grade\": \"D\", \"ats_score\": 30, \"company_fit\": {\"match_level\": \"\"}}");

        assertThat(review.getCompanyFit()).isNull();
        assertThat(review.getSectionScores()).isEmpty();
        assertThat(review.getRedFlags()).isEmpty();
    }

    @Test
    void rejectsUnknownResumeGrade() {
        assertThatThrownBy(() -> parser.parseResumeReview("{\"overall_grade\": \"A+\", \"ats_score\": 90}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("A-F");
        assertThatThrownBy(() -> parser.parseResumeReview("{\"ats_score\": 90}"))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void rejectsAtsScoreOutOfRange() {
        assertThatThrownBy(() -> parser.parseResumeReview("{\"overall_grade\": \"C\", \"ats_score\": 140}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("ats_score");
        assertThatThrownBy(() -> parser.parseResumeReview("{\"overall_grade\": \"C\", \"ats_score\": \"65\"}"))
                .isInstanceOf(CollaboratorException.class);
    }

    @Test
    void rejectsMalformedSectionScores() {
        assertThatThrownBy(() -> parser.parseResumeReview(
                "{\"overall_grade\": \"C\", \"ats_score\": 60, \"section_scores\": {\"skills\": 12}}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("skills");
        assertThatThrownBy(() -> parser.parseResumeReview(
                "{\"overall_grade\": \"C\", \"ats_score\": 60, \"section_scores\": [5, 6]}"))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("section_scores");
    }
}
