package com.prepcoach.interviewer.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepcoach.interviewer.dto.ProfileAnalysisDto;
import com.prepcoach.interviewer.dto.QaLogDto;
import com.prepcoach.interviewer.dto.SessionStatsDto;
import com.prepcoach.interviewer.dto.SessionSummaryDto;
import com.prepcoach.interviewer.engine.InterviewReport;
import com.prepcoach.interviewer.engine.InterviewStage;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.ScoreJudgment;
import com.prepcoach.interviewer.engine.Turn;
import com.prepcoach.interviewer.exception.IllegalSessionStateException;
import com.prepcoach.interviewer.exception.SessionNotFoundException;
import com.prepcoach.interviewer.model.InterviewSession;
import com.prepcoach.interviewer.model.ProfileAnalysis;
import com.prepcoach.interviewer.model.QaLog;
import com.prepcoach.interviewer.repository.InterviewSessionRepository;
import com.prepcoach.interviewer.repository.ProfileAnalysisRepository;
import com.prepcoach.interviewer.repository.QaLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read side over the persisted interview tables.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SessionHistoryService {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final InterviewSessionRepository sessionRepository;
    private final QaLogRepository qaLogRepository;
    private final ProfileAnalysisRepository profileRepository;
    private final ObjectMapper objectMapper;

    public List<SessionSummaryDto> recentSessions(int limit) {
        int size = Math.max(1, limit);
        return sessionRepository.findAllByOrderByStartTimeDesc(PageRequest.of(0, size)).stream()
                .map(this::toSummaryDto)
                .collect(Collectors.toList());
    }

    public SessionStatsDto sessionStats(long sessionId) {
        InterviewSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        List<QaLogDto> questions = qaLogRepository.findBySessionIdOrderByQuestionNumberAsc(sessionId).stream()
                .map(this::toQaLogDto)
                .collect(Collectors.toList());
        ProfileAnalysisDto profile = profileRepository.findById(sessionId)
                .map(this::toProfileDto)
                .orElse(null);

        double average = questions.stream()
                .filter(q -> q.getCriticScore() != null)
                .mapToDouble(QaLogDto::getCriticScore)
                .average()
                .orElse(0.0);

        return SessionStatsDto.builder()
                .session(toSummaryDto(session))
                .questions(questions)
                .profile(profile)
                .averageScore(Math.round(average * 100.0) / 100.0)
                .build();
    }

    public boolean exists(long sessionId) {
        return sessionRepository.existsById(sessionId);
    }

    /**
     * Rebuilds the report of a finished session from its stored rows. Topic grouping,
     * failed topics and the roadmap are not stored, so they come back empty.
     */
    public InterviewReport loadReport(long sessionId) {
        InterviewSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        if (session.getEndTime() == null) {
            throw new IllegalSessionStateException("Session " + sessionId + " is not live and was never finished");
        }
        List<Turn> turns = qaLogRepository.findBySessionIdOrderByQuestionNumberAsc(sessionId).stream()
                .map(this::toTurn)
                .collect(Collectors.toList());
        ProfileSnapshot profile = profileRepository.findById(sessionId)
                .map(this::toProfile)
                .orElseGet(ProfileSnapshot::empty);

        return InterviewReport.builder()
                .sessionId(sessionId)
                .candidateName(session.getCandidateName())
                .companyName(session.getCompany())
                .role(session.getRole())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .overallScore(session.getOverallScore() != null ? session.getOverallScore() : 0.0)
                .verdict(session.getFinalVerdict())
                .earlyTerminationReason(session.getEarlyTermination())
                .totalQuestions(turns.size())
                .degradedEvaluations((int) turns.stream().filter(Turn::isDegraded).count())
                .failedTopics(List.of())
                .profile(profile)
                .turns(turns)
                .build();
    }

    private Turn toTurn(QaLog row) {
        return Turn.builder()
                .questionNumber(row.getQuestionNumber())
                .stage(InterviewStage.fromLabel(row.getStage()))
                .question(row.getQuestion())
                .answer(row.getAnswer())
                .answerLength(row.getAnswerLength() != null ? row.getAnswerLength() : 0)
                .score(row.getCriticScore() != null ? row.getCriticScore() : 0.0)
                .strengths(row.getCriticStrengths())
                .weaknesses(row.getCriticWeaknesses())
                .tip(row.getCriticTip())
                .sentiment(row.getSentiment())
                .degraded(ScoreJudgment.DEGRADED_SENTIMENT.equals(row.getSentiment()))
                .skipped(ScoreJudgment.SKIPPED_SENTIMENT.equals(row.getSentiment()))
                .timestamp(row.getTimestamp())
                .build();
    }

    private ProfileSnapshot toProfile(ProfileAnalysis row) {
        return ProfileSnapshot.builder()
                .matchedSkills(new LinkedHashSet<>(fromJson(row.getMatchedSkills())))
                .missingSkills(new LinkedHashSet<>(fromJson(row.getMissingSkills())))
                .strengths(fromJson(row.getStrengths()))
                .weaknesses(fromJson(row.getWeaknesses()))
                .experienceLevel(row.getExperienceLevel() != null ? row.getExperienceLevel() : ProfileSnapshot.UNKNOWN_LEVEL)
                .redFlags(fromJson(row.getRedFlags()))
                .build();
    }

    private SessionSummaryDto toSummaryDto(InterviewSession session) {
        return SessionSummaryDto.builder()
                .id(session.getId())
                .candidateName(session.getCandidateName())
                .company(session.getCompany())
                .role(session.getRole())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .overallScore(session.getOverallScore())
                .finalVerdict(session.getFinalVerdict())
                .resumeLength(session.getResumeLength())
                .totalQuestions(session.getTotalQuestions())
                .earlyTermination(session.getEarlyTermination())
                .build();
    }

    private QaLogDto toQaLogDto(QaLog row) {
        return QaLogDto.builder()
                .questionNumber(row.getQuestionNumber())
                .stage(row.getStage())
                .question(row.getQuestion())
                .answer(row.getAnswer())
                .answerLength(row.getAnswerLength())
                .criticScore(row.getCriticScore())
                .criticStrengths(row.getCriticStrengths())
                .criticWeaknesses(row.getCriticWeaknesses())
                .criticTip(row.getCriticTip())
                .sentiment(row.getSentiment())
                .timestamp(row.getTimestamp())
                .build();
    }

    private ProfileAnalysisDto toProfileDto(ProfileAnalysis row) {
        return ProfileAnalysisDto.builder()
                .matchedSkills(fromJson(row.getMatchedSkills()))
                .missingSkills(fromJson(row.getMissingSkills()))
                .strengths(fromJson(row.getStrengths()))
                .weaknesses(fromJson(row.getWeaknesses()))
                .experienceLevel(row.getExperienceLevel())
                .redFlags(fromJson(row.getRedFlags()))
                .build();
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable JSON column value '{}': {}", json, e.getMessage());
            return List.of();
        }
    }
}
