package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.InterviewReport;
import com.prepcoach.interviewer.engine.InterviewStage;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.SessionSummary;
import com.prepcoach.interviewer.engine.Turn;
import com.prepcoach.interviewer.exception.IllegalSessionStateException;
import com.prepcoach.interviewer.exception.SessionNotFoundException;
import com.prepcoach.interviewer.exception.SessionPersistenceException;
import com.prepcoach.interviewer.model.InterviewSession;
import com.prepcoach.interviewer.model.ProfileAnalysis;
import com.prepcoach.interviewer.model.QaLog;
import com.prepcoach.interviewer.repository.InterviewSessionRepository;
import com.prepcoach.interviewer.repository.ProfileAnalysisRepository;
import com.prepcoach.interviewer.repository.QaLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({InterviewPersistenceService.class, SessionHistoryService.class})
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class InterviewPersistenceServiceTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 1, 5, 10, 0);

    @Autowired
    private InterviewPersistenceService persistence;

    @Autowired
    private SessionHistoryService historyService;

    @Autowired
    private InterviewSessionRepository sessionRepository;

    @Autowired
    private QaLogRepository qaLogRepository;

    @Autowired
    private ProfileAnalysisRepository profileRepository;

    @BeforeEach
    void cleanTables() {
        qaLogRepository.deleteAll();
        profileRepository.deleteAll();
        sessionRepository.deleteAll();
    }

    private static SessionSummary.SessionSummaryBuilder summary(long id) {
        return SessionSummary.builder()
                .id(id)
                .candidateName("Ada")
                .company("Acme")
                .role("Backend Engineer")
                .startTime(START)
                .resumeLength(120);
    }

    private static Turn turn(int questionNumber, double score) {
        return Turn.builder()
                .questionNumber(questionNumber)
                .topicNumber(1)
                .stage(InterviewStage.TECHNICAL)
                .question("Question " + questionNumber)
                .answer("Answer " + questionNumber)
                .answerLength(8)
                .score(score)
                .strengths("s")
                .weaknesses("w")
                .tip("t")
                .sentiment("confident")
                .timestamp(START.plusMinutes(questionNumber))
                .build();
    }

    @Test
    void createsSessionWithAssignedId() {
        persistence.createSession(summary(101).build());

        InterviewSession row = sessionRepository.findById(101L).orElseThrow();
        assertThat(row.getCandidateName()).isEqualTo("Ada");
        assertThat(row.getTotalQuestions()).isZero();
        assertThat(row.getOverallScore()).isNull();
        assertThat(sessionRepository.findMaxId()).contains(101L);
    }

    @Test
    void appendedTurnsAreStoredInOrderAndBumpQuestionTotal() {
        persistence.createSession(summary(102).build());

        persistence.appendTurn(102, turn(1, 6.0));
        persistence.appendTurn(102, turn(2, 2.0));

        List<QaLog> rows = qaLogRepository.findBySessionIdOrderByQuestionNumberAsc(102L);
        assertThat(rows).extracting(QaLog::getQuestionNumber).containsExactly(1, 2);
        assertThat(rows.get(1).getCriticScore()).isEqualTo(2.0);
        assertThat(rows.get(0).getStage()).isEqualTo("technical");
        assertThat(sessionRepository.findById(102L).orElseThrow().getTotalQuestions()).isEqualTo(2);
    }

    @Test
    void profileListsAreStoredAsJsonArrays() {
        persistence.createSession(summary(103).build());

        persistence.saveProfile(103, ProfileSnapshot.builder()
                .matchedSkills(Set.of("Java"))
                .weaknesses(List.of("Kubernetes", "Go"))
                .experienceLevel("mid")
                .build());

        ProfileAnalysis row = profileRepository.findById(103L).orElseThrow();
        assertThat(row.getMatchedSkills()).isEqualTo("[\"Java\"]");
        assertThat(row.getWeaknesses()).isEqualTo("[\"Kubernetes\",\"Go\"]");
        assertThat(row.getRedFlags()).isEqualTo("[]");
        assertThat(row.getExperienceLevel()).isEqualTo("mid");
    }

    @Test
    void saveSessionUpdatesExistingRow() {
        persistence.createSession(summary(104).build());

        persistence.saveSession(summary(104)
                .endTime(START.plusMinutes(30))
                .overallScore(3.0)
                .finalVerdict("Not ready")
                .totalQuestions(3)
                .earlyTermination("Performance below bar (avg 3.0/10)")
                .build());

        InterviewSession row = sessionRepository.findById(104L).orElseThrow();
        assertThat(row.getOverallScore()).isEqualTo(3.0);
        assertThat(row.getEarlyTermination()).isEqualTo("Performance below bar (avg 3.0/10)");
        assertThat(sessionRepository.count()).isEqualTo(1);
    }

    @Test
    void saveSessionInsertsWhenCreationHadFailed() {
        persistence.saveSession(summary(105).overallScore(7.0).totalQuestions(8).build());

        assertThat(sessionRepository.findById(105L)).isPresent();
    }

    @Test
    void turnForUnknownSessionFailsWithPersistenceException() {
        assertThatThrownBy(() -> persistence.appendTurn(999, turn(1, 5.0)))
                .isInstanceOf(SessionPersistenceException.class);
    }

    @Test
    void finishedSessionReportIsRebuiltFromStoredRows() {
        persistence.createSession(summary(106).build());
        persistence.saveProfile(106, ProfileSnapshot.builder()
                .matchedSkills(Set.of("Java"))
                .experienceLevel("senior")
                .build());
        persistence.appendTurn(106, turn(1, 7.0));
        persistence.appendTurn(106, Turn.builder()
                .questionNumber(2)
                .topicNumber(1)
                .stage(InterviewStage.TECHNICAL)
                .question("Question 2")
                .answer("Answer 2")
                .answerLength(8)
                .score(5.0)
                .sentiment("degraded")
                .degraded(true)
                .timestamp(START.plusMinutes(2))
                .build());
        persistence.saveSession(summary(106)
                .endTime(START.plusMinutes(20))
                .overallScore(5.0)
                .finalVerdict("Borderline")
                .totalQuestions(2)
                .build());

        InterviewReport report = historyService.loadReport(106);

        assertThat(report.getVerdict()).isEqualTo("Borderline");
        assertThat(report.getOverallScore()).isEqualTo(5.0);
        assertThat(report.getTotalQuestions()).isEqualTo(2);
        assertThat(report.getDegradedEvaluations()).isEqualTo(1);
        assertThat(report.getTurns()).extracting(Turn::getStage).containsOnly(InterviewStage.TECHNICAL);
        assertThat(report.getProfile().getMatchedSkills()).containsExactly("Java");
        assertThat(report.getRoadmap()).isNull();
    }

    @Test
    void unfinishedOrMissingSessionHasNoStoredReport() {
        persistence.createSession(summary(107).build());

        assertThatThrownBy(() -> historyService.loadReport(107))
                .isInstanceOf(IllegalSessionStateException.class);
        assertThatThrownBy(() -> historyService.loadReport(998))
                .isInstanceOf(SessionNotFoundException.class);
    }
}
