package com.prepcoach.interviewer.engine;

import com.prepcoach.interviewer.exception.CollaboratorException;
import com.prepcoach.interviewer.exception.IllegalSessionStateException;
import com.prepcoach.interviewer.exception.SessionPersistenceException;
import com.prepcoach.interviewer.exception.SkippedAnswerException;
import com.prepcoach.interviewer.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Drives one interview session through its turn loop.
 *
 * <p>The only suspension point is {@link OrchestratorState#AWAITING_ANSWER}: {@link #start}
 * and {@link #submitAnswer} both return there, or run on through reporting to
 * {@link OrchestratorState#DONE}. Collaborator failures are replaced by
 * {@link CollaboratorFallbacks}; persistence failures come back as warnings.
 */
@Slf4j
public class InterviewOrchestrator {

    private final InterviewCollaborators collaborators;
    private final InterviewPersistence persistence;
    private final ScoringPolicy scoringPolicy;
    private final StagePlanner stagePlanner;
    private final LongSupplier sessionIds;
    private final Clock clock;

    private OrchestratorState state = OrchestratorState.INIT;
    private SessionState session;

    public InterviewOrchestrator(InterviewCollaborators collaborators,
                                 InterviewPersistence persistence,
                                 ScoringPolicy scoringPolicy,
                                 StagePlanner stagePlanner,
                                 LongSupplier sessionIds,
                                 Clock clock) {
        this.collaborators = collaborators;
        this.persistence = persistence;
        this.scoringPolicy = scoringPolicy;
        this.stagePlanner = stagePlanner;
        this.sessionIds = sessionIds;
        this.clock = clock;
    }

    public synchronized OrchestratorState getState() {
        return state;
    }

    public synchronized SessionState getSession() {
        return session;
    }

    // ─── INIT → PREPARING → AWAITING_ANSWER ─────────────────────────────

    public synchronized SessionStart start(InterviewSetup setup) {
        requireState(OrchestratorState.INIT, "start the interview");

        List<String> missing = setup.missingFields();
        if (!missing.isEmpty()) {
            throw new ValidationException(missing);
        }

        moveTo(OrchestratorState.PREPARING);
        List<String> warnings = new ArrayList<>();
        session = new SessionState(sessionIds.getAsLong(), setup, LocalDateTime.now(clock));
        log.info("Session {} created for {} at {} ({} chars of resume)",
                session.getSessionId(), setup.getCandidateName(), setup.getCompanyName(),
                setup.getResumeText().length());

        SessionSummary summary = session.toSummary();
        persist(warnings, "create session", () -> persistence.createSession(summary));

        ProfileSnapshot profile = consult("Profile analyzer",
                () -> collaborators.getProfileAnalyzer().analyze(setup.getResumeText(), setup.getJobDescription()),
                ProfileSnapshot::empty);
        if (persist(warnings, "save profile analysis", () -> persistence.saveProfile(session.getSessionId(), profile))) {
            session.markProfilePersisted();
        }

        String companyIntel = consult("Company researcher",
                () -> collaborators.getCompanyResearcher().research(setup.getCompanyName()),
                () -> CollaboratorFallbacks.companyIntel(setup.getCompanyName()));
        InterviewStrategy strategy = consult("Strategist",
                () -> collaborators.getStrategist().plan(profile, companyIntel),
                CollaboratorFallbacks::strategy);
        session.prepare(profile, companyIntel, strategy);
        log.info("Session {} prepared: {} matched skills, level {}, persona {}",
                session.getSessionId(), profile.getMatchedSkills().size(),
                profile.getExperienceLevel(), strategy.getPersona().getTag());

        session.beginTopic(stagePlanner.firstStage());
        int questionNumber = askQuestion(false);
        moveTo(OrchestratorState.AWAITING_ANSWER);

        return SessionStart.builder()
                .sessionId(session.getSessionId())
                .question(session.getCurrentQuestion())
                .questionNumber(questionNumber)
                .stage(session.getStage())
                .persona(session.getPersona())
                .warnings(warnings)
                .build();
    }

    // ─── AWAITING_ANSWER → SCORING → DECIDING → … ───────────────────────

    public synchronized TurnOutcome submitAnswer(String answer, String nonVerbalSignal) {
        requireState(OrchestratorState.AWAITING_ANSWER, "submit an answer");
        List<String> warnings = new ArrayList<>();

        moveTo(OrchestratorState.SCORING);
        boolean skipped = false;
        ScoreJudgment judgment;
        try {
            requireAnswer(answer);
            judgment = consult("Answer scorer",
                    () -> collaborators.getAnswerScorer().score(session.getCurrentQuestion(), answer, nonVerbalSignal),
                    ScoreJudgment::degraded);
        } catch (SkippedAnswerException e) {
            log.info("Session {}: {}, scoring 0", session.getSessionId(), e.getMessage());
            judgment = ScoreJudgment.skipped();
            skipped = true;
        }

        Turn turn = session.appendTurn(answer, judgment, skipped, LocalDateTime.now(clock));
        if (persist(warnings, "append question " + turn.getQuestionNumber(),
                () -> persistence.appendTurn(session.getSessionId(), turn))) {
            session.markTurnPersisted(turn.getQuestionNumber());
        }

        moveTo(OrchestratorState.DECIDING);
        PolicyDecision decision = scoringPolicy.decide(
                turn.getScore(),
                session.getCurrentTopic().getPushbackCount(),
                session.scores(),
                session.getQuestionCount(),
                session.getStage());
        log.info("Session {} question {} scored {}/10{} -> {}",
                session.getSessionId(), turn.getQuestionNumber(), turn.getScore(),
                turn.isDegraded() ? " (degraded)" : "", decision.getDecision());

        return switch (decision.getDecision()) {
            case PUSHBACK -> pushBack(turn, warnings);
            case ADVANCE -> advance(turn, decision, warnings);
            case EARLY_TERMINATE -> terminate(turn, decision, warnings);
            case REPORT -> {
                finish(warnings);
                yield outcome(DecisionState.REPORTING, turn, warnings);
            }
        };
    }

    private TurnOutcome pushBack(Turn turn, List<String> warnings) {
        moveTo(OrchestratorState.PUSHBACK_LOOP);
        TopicState topic = session.getCurrentTopic();
        topic.recordPushback();
        log.info("Session {} pushback {} on topic {}", session.getSessionId(),
                topic.getPushbackCount(), topic.getTopicNumber());
        askQuestion(true);
        moveTo(OrchestratorState.AWAITING_ANSWER);
        return outcome(DecisionState.PUSHBACK, turn, warnings);
    }

    private TurnOutcome advance(Turn turn, PolicyDecision decision, List<String> warnings) {
        moveTo(OrchestratorState.ADVANCING);
        if (decision.isTopicFailed()) {
            log.info("Session {} topic {} failed after {} pushbacks", session.getSessionId(),
                    session.getCurrentTopic().getTopicNumber(), session.getCurrentTopic().getPushbackCount());
            session.failCurrentTopic();
        }
        StagePlan plan = stagePlanner.plan(session.getStage(), session.getPersona(),
                session.getQuestionCount(), Decision.ADVANCE, session.scores());
        session.applyPlan(plan);
        session.beginTopic(plan.getStage());
        askQuestion(false);
        moveTo(OrchestratorState.AWAITING_ANSWER);
        return outcome(DecisionState.CONTINUING, turn, warnings);
    }

    private TurnOutcome terminate(Turn turn, PolicyDecision decision, List<String> warnings) {
        moveTo(OrchestratorState.TERMINATING);
        log.info("Session {} terminated early: {}", session.getSessionId(), decision.getReason());
        session.terminateEarly(decision.getReason());
        finish(warnings);
        return outcome(DecisionState.TERMINATED, turn, warnings);
    }

    // ─── REPORTING → DONE ───────────────────────────────────────────────

    private void finish(List<String> warnings) {
        moveTo(OrchestratorState.REPORTING);
        double overallScore = session.averageScore();

        ReportRequest request = ReportRequest.builder()
                .candidateName(session.getSetup().getCandidateName())
                .companyName(session.getSetup().getCompanyName())
                .turns(session.getTurns())
                .profile(session.getProfile())
                .overallScore(overallScore)
                .earlyTerminationReason(session.getEarlyTerminationReason())
                .failedTopics(session.getFailedTopics())
                .build();
        ReportText report = consult("Report writer",
                () -> collaborators.getReportWriter().write(request),
                () -> CollaboratorFallbacks.report(overallScore, session.getEarlyTerminationReason()));
        session.complete(LocalDateTime.now(clock), overallScore, report);

        SessionSummary summary = session.toSummary();
        persist(warnings, "save finished session", () -> persistence.saveSession(summary));
        if (!session.isProfilePersisted()
                && persist(warnings, "save profile analysis", () -> persistence.saveProfile(session.getSessionId(), session.getProfile()))) {
            session.markProfilePersisted();
        }
        for (Turn turn : session.getTurns()) {
            if (!session.isTurnPersisted(turn.getQuestionNumber())
                    && persist(warnings, "append question " + turn.getQuestionNumber(),
                    () -> persistence.appendTurn(session.getSessionId(), turn))) {
                session.markTurnPersisted(turn.getQuestionNumber());
            }
        }

        moveTo(OrchestratorState.DONE);
        log.info("Session {} done: {} questions, overall {}/10, {} degraded evaluations",
                session.getSessionId(), session.getTurns().size(), String.format(Locale.ROOT, "%.2f", overallScore),
                session.degradedEvaluations());
    }

    public synchronized InterviewReport report() {
        requireState(OrchestratorState.DONE, "fetch the report");
        return InterviewReport.builder()
                .sessionId(session.getSessionId())
                .candidateName(session.getSetup().getCandidateName())
                .companyName(session.getSetup().getCompanyName())
                .role(session.getSetup().roleOrDefault())
                .startTime(session.getStartTime())
                .endTime(session.getEndTime())
                .overallScore(session.getOverallScore())
                .verdict(session.getFinalVerdict())
                .roadmap(session.getRoadmap())
                .earlyTerminationReason(session.getEarlyTerminationReason())
                .totalQuestions(session.getTurns().size())
                .degradedEvaluations(session.degradedEvaluations())
                .failedTopics(session.getFailedTopics())
                .profile(session.getProfile())
                .turns(session.getTurns())
                .build();
    }

    // ─── Helpers ────────────────────────────────────────────────────────

    private int askQuestion(boolean intensify) {
        QuestionRequest request = QuestionRequest.builder()
                .stage(session.getStage())
                .persona(session.getPersona())
                .topicNumber(session.getCurrentTopic().getTopicNumber())
                .intensify(intensify)
                .companyName(session.getSetup().getCompanyName())
                .companyIntel(session.getCompanyIntel())
                .strategy(session.getStrategy())
                .profile(session.getProfile())
                .previousTurn(session.lastTurn().orElse(null))
                .transcript(session.getTurns())
                .build();
        String question = consult("Question generator",
                () -> collaborators.getQuestionGenerator().generate(request),
                () -> null);
        if (question == null || question.trim().isEmpty()) {
            log.warn("Session {}: no usable question for stage {}, using fallback",
                    session.getSessionId(), session.getStage().getLabel());
            question = CollaboratorFallbacks.question(session.getStage(), intensify);
        }
        return session.askQuestion(question.trim());
    }

    private void requireAnswer(String answer) {
        if (answer == null || answer.trim().isEmpty()) {
            throw new SkippedAnswerException(session.getQuestionCount());
        }
    }

    private <T> T consult(String collaborator, Supplier<T> call, Supplier<T> fallback) {
        try {
            T result = call.get();
            if (result != null) {
                return result;
            }
            log.warn("{} returned nothing for session {}, using fallback", collaborator, session.getSessionId());
        } catch (CollaboratorException e) {
            log.warn("{} failed for session {}: {}. Using fallback", collaborator, session.getSessionId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("{} crashed for session {}, using fallback", collaborator, session.getSessionId(), e);
        }
        return fallback.get();
    }

    private boolean persist(List<String> warnings, String action, Runnable write) {
        try {
            write.run();
            return true;
        } catch (SessionPersistenceException e) {
            log.warn("Session {}: could not {}: {}", session.getSessionId(), action, e.getMessage());
            return warn(warnings, "Could not " + action + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {}: unexpected failure while trying to {}", session.getSessionId(), action, e);
            return warn(warnings, "Could not " + action + ": " + e);
        }
    }

    private boolean warn(List<String> warnings, String warning) {
        warnings.add(warning);
        session.addWarning(warning);
        return false;
    }

    private TurnOutcome outcome(DecisionState decisionState, Turn turn, List<String> warnings) {
        boolean awaiting = state == OrchestratorState.AWAITING_ANSWER;
        return TurnOutcome.builder()
                .sessionId(session.getSessionId())
                .decisionState(decisionState)
                .feedback(turn)
                .nextQuestion(awaiting ? session.getCurrentQuestion() : null)
                .nextQuestionNumber(awaiting ? session.getQuestionCount() : 0)
                .stage(session.getStage())
                .persona(session.getPersona())
                .terminationReason(session.getEarlyTerminationReason())
                .warnings(warnings)
                .build();
    }

    private void requireState(OrchestratorState expected, String action) {
        if (state != expected) {
            throw new IllegalSessionStateException(action, state);
        }
    }

    private void moveTo(OrchestratorState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        log.debug("Session {}: {} -> {}", session != null ? session.getSessionId() : "-", state, next);
        state = next;
    }
}
