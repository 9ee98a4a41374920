package com.prepcoach.interviewer.controller;

import com.prepcoach.interviewer.dto.AnswerFeedbackDto;
import com.prepcoach.interviewer.dto.AnswerOutcomeDto;
import com.prepcoach.interviewer.dto.AnswerSubmissionDto;
import com.prepcoach.interviewer.dto.CreateSessionRequestDto;
import com.prepcoach.interviewer.dto.InterviewReportDto;
import com.prepcoach.interviewer.dto.ProfileAnalysisDto;
import com.prepcoach.interviewer.dto.SessionStartResponseDto;
import com.prepcoach.interviewer.engine.InterviewReport;
import com.prepcoach.interviewer.engine.InterviewSetup;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import com.prepcoach.interviewer.engine.SessionStart;
import com.prepcoach.interviewer.engine.Turn;
import com.prepcoach.interviewer.engine.TurnOutcome;
import com.prepcoach.interviewer.exception.IllegalSessionStateException;
import com.prepcoach.interviewer.exception.SessionNotFoundException;
import com.prepcoach.interviewer.exception.ValidationException;
import com.prepcoach.interviewer.service.InterviewSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.ArrayList;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/interview")
@RequiredArgsConstructor
@Slf4j
public class InterviewController {

    private final InterviewSessionService sessionService;

    // ─── Sessions ───────────────────────────────────────────────────────

    @PostMapping("/sessions")
    public SessionStartResponseDto createSession(@RequestBody CreateSessionRequestDto dto) {
        InterviewSetup setup = InterviewSetup.builder()
                .candidateName(dto.getCandidateName())
                .resumeText(dto.getResumeText())
                .jobDescription(dto.getJobDescription())
                .companyName(dto.getCompanyName())
                .role(dto.getRole())
                .build();
        try {
            SessionStart start = sessionService.createSession(setup);
            return SessionStartResponseDto.builder()
                    .sessionId(start.getSessionId())
                    .question(start.getQuestion())
                    .questionNumber(start.getQuestionNumber())
                    .stage(start.getStage().getLabel())
                    .persona(start.getPersona().getTag())
                    .warnings(start.getWarnings())
                    .build();
        } catch (ValidationException e) {
            log.info("Rejected session setup: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }
    }

    // ─── Answers ────────────────────────────────────────────────────────

    @PostMapping("/sessions/{sessionId}/answers")
    public AnswerOutcomeDto submitAnswer(@PathVariable Long sessionId,
                                         @RequestBody AnswerSubmissionDto answer) {
        try {
            TurnOutcome outcome = sessionService.submitAnswer(
                    sessionId, answer.getAnswerText(), answer.getNonVerbalSignal());
            return AnswerOutcomeDto.builder()
                    .sessionId(outcome.getSessionId())
                    .decisionState(outcome.getDecisionState().getLabel())
                    .nextQuestion(outcome.getNextQuestion())
                    .questionNumber(outcome.getNextQuestion() != null ? outcome.getNextQuestionNumber() : null)
                    .stage(outcome.getStage().getLabel())
                    .persona(outcome.getPersona().getTag())
                    .feedback(toFeedbackDto(outcome.getFeedback()))
                    .terminationReason(outcome.getTerminationReason())
                    .warnings(outcome.getWarnings())
                    .build();
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalSessionStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    // ─── Report ─────────────────────────────────────────────────────────

    @GetMapping("/sessions/{sessionId}/report")
    public InterviewReportDto getReport(@PathVariable Long sessionId) {
        try {
            return toReportDto(sessionService.getReport(sessionId));
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (IllegalSessionStateException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private AnswerFeedbackDto toFeedbackDto(Turn turn) {
        return AnswerFeedbackDto.builder()
                .questionNumber(turn.getQuestionNumber())
                .stage(turn.getStage().getLabel())
                .score(turn.getScore())
                .strengths(turn.getStrengths())
                .weaknesses(turn.getWeaknesses())
                .tip(turn.getTip())
                .sentiment(turn.getSentiment())
                .degraded(turn.isDegraded())
                .skipped(turn.isSkipped())
                .pushbackAttempt(turn.getPushbackAttempt())
                .build();
    }

    private InterviewReportDto toReportDto(InterviewReport report) {
        ProfileSnapshot profile = report.getProfile();
        return InterviewReportDto.builder()
                .sessionId(report.getSessionId())
                .candidateName(report.getCandidateName())
                .company(report.getCompanyName())
                .role(report.getRole())
                .startTime(report.getStartTime())
                .endTime(report.getEndTime())
                .overallScore(report.getOverallScore())
                .verdict(report.getVerdict())
                .roadmap(report.getRoadmap())
                .earlyTermination(report.getEarlyTerminationReason())
                .totalQuestions(report.getTotalQuestions())
                .degradedEvaluations(report.getDegradedEvaluations())
                .failedTopics(report.getFailedTopics())
                .profile(ProfileAnalysisDto.builder()
                        .matchedSkills(new ArrayList<>(profile.getMatchedSkills()))
                        .missingSkills(new ArrayList<>(profile.getMissingSkills()))
                        .strengths(profile.getStrengths())
                        .weaknesses(profile.getWeaknesses())
                        .experienceLevel(profile.getExperienceLevel())
                        .redFlags(profile.getRedFlags())
                        .build())
                .answers(report.getTurns().stream().map(this::toFeedbackDto).collect(Collectors.toList()))
                .build();
    }
}
