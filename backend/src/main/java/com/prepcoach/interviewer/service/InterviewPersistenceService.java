package com.prepcoach.interviewer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepcoach.interviewer.engine.InterviewPersistence;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.SessionSummary;
import com.prepcoach.interviewer.engine.Turn;
import com.prepcoach.interviewer.exception.SessionPersistenceException;
import com.prepcoach.interviewer.model.InterviewSession;
import com.prepcoach.interviewer.model.ProfileAnalysis;
import com.prepcoach.interviewer.model.QaLog;
import com.prepcoach.interviewer.repository.InterviewSessionRepository;
import com.prepcoach.interviewer.repository.ProfileAnalysisRepository;
import com.prepcoach.interviewer.repository.QaLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;

/**
 * JPA-backed {@link InterviewPersistence}. Each call is one transaction touching a single
 * session's rows, so writes from concurrent sessions never interleave within a transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterviewPersistenceService implements InterviewPersistence {

    private final InterviewSessionRepository sessionRepository;
    private final QaLogRepository qaLogRepository;
    private final ProfileAnalysisRepository profileRepository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void createSession(SessionSummary summary) {
        inTransaction("create session " + summary.getId(), () -> {
            sessionRepository.saveAndFlush(apply(new InterviewSession(), summary));
            log.info("Created session row {}", summary.getId());
        });
    }

    @Override
    public void appendTurn(long sessionId, Turn turn) {
        inTransaction("append question " + turn.getQuestionNumber() + " of session " + sessionId, () -> {
            QaLog row = new QaLog();
            row.setSessionId(sessionId);
            row.setQuestionNumber(turn.getQuestionNumber());
            row.setStage(turn.getStage().getLabel());
            row.setQuestion(turn.getQuestion());
            row.setAnswer(turn.getAnswer());
            row.setAnswerLength(turn.getAnswerLength());
            row.setCriticScore(turn.getScore());
            row.setCriticStrengths(turn.getStrengths());
            row.setCriticWeaknesses(turn.getWeaknesses());
            row.setCriticTip(turn.getTip());
            row.setSentiment(turn.getSentiment());
            row.setTimestamp(turn.getTimestamp());
            qaLogRepository.saveAndFlush(row);

            sessionRepository.findById(sessionId).ifPresent(session -> {
                if (session.getTotalQuestions() == null || session.getTotalQuestions() < turn.getQuestionNumber()) {
                    session.setTotalQuestions(turn.getQuestionNumber());
                    sessionRepository.saveAndFlush(session);
                }
            });
        });
    }

    @Override
    public void saveProfile(long sessionId, ProfileSnapshot profile) {
        inTransaction("save profile of session " + sessionId, () -> {
            ProfileAnalysis row = profileRepository.findById(sessionId).orElseGet(ProfileAnalysis::new);
            row.setSessionId(sessionId);
            row.setMatchedSkills(toJson(profile.getMatchedSkills()));
            row.setMissingSkills(toJson(profile.getMissingSkills()));
            row.setStrengths(toJson(profile.getStrengths()));
            row.setWeaknesses(toJson(profile.getWeaknesses()));
            row.setExperienceLevel(profile.getExperienceLevel());
            row.setRedFlags(toJson(profile.getRedFlags()));
            profileRepository.saveAndFlush(row);
        });
    }

    @Override
    public void saveSession(SessionSummary summary) {
        inTransaction("save session " + summary.getId(), () -> {
            InterviewSession row = sessionRepository.findById(summary.getId()).orElseGet(InterviewSession::new);
            sessionRepository.saveAndFlush(apply(row, summary));
            log.info("Saved session {} (overall {}, {} questions)",
                    summary.getId(), summary.getOverallScore(), summary.getTotalQuestions());
        });
    }

    private InterviewSession apply(InterviewSession row, SessionSummary summary) {
        row.setId(summary.getId());
        row.setCandidateName(summary.getCandidateName());
        row.setCompany(summary.getCompany());
        row.setRole(summary.getRole());
        row.setStartTime(summary.getStartTime());
        row.setEndTime(summary.getEndTime());
        row.setOverallScore(summary.getOverallScore());
        row.setFinalVerdict(summary.getFinalVerdict());
        row.setResumeLength(summary.getResumeLength());
        row.setTotalQuestions(summary.getTotalQuestions());
        row.setEarlyTermination(summary.getEarlyTermination());
        return row;
    }

    private String toJson(Collection<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new SessionPersistenceException("Could not serialize " + values, e);
        }
    }

    private void inTransaction(String action, Runnable work) {
        try {
            transactionTemplate.executeWithoutResult(status -> work.run());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to {}: {}", action, e.getMessage());
            throw new SessionPersistenceException("Failed to " + action, e);
        }
    }
}
