package com.prepcoach.interviewer.engine;

import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Everything known about one interview. Owned by a single {@link InterviewOrchestrator};
 * mutators are package-private so only the engine changes it.
 */
@Getter
public class SessionState {

    private final long sessionId;
    private final InterviewSetup setup;
    private final LocalDateTime startTime;

    private ProfileSnapshot profile = ProfileSnapshot.empty();
    private String companyIntel = "";
    private String strategy = "";

    private InterviewStage stage = InterviewStage.INTRO;
    private Persona persona = Persona.NEUTRAL;
    private TopicState currentTopic;
    private String currentQuestion;
    private int questionCount;

    private final List<Turn> turns = new ArrayList<>();
    private final List<String> failedTopics = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    private String earlyTerminationReason;
    private LocalDateTime endTime;
    private Double overallScore;
    private String finalVerdict;
    private String roadmap;

    @Getter(AccessLevel.NONE)
    private final Set<Integer> persistedTurns = new HashSet<>();
    private boolean profilePersisted;

    SessionState(long sessionId, InterviewSetup setup, LocalDateTime startTime) {
        this.sessionId = sessionId;
        this.setup = setup;
        this.startTime = startTime;
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    public List<String> getFailedTopics() {
        return Collections.unmodifiableList(failedTopics);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Scores of every turn, oldest first.
     */
    public List<Double> scores() {
        return turns.stream().map(Turn::getScore).collect(Collectors.toList());
    }

    public Optional<Turn> lastTurn() {
        return turns.isEmpty() ? Optional.empty() : Optional.of(turns.get(turns.size() - 1));
    }

    public double averageScore() {
        return turns.stream().mapToDouble(Turn::getScore).average().orElse(0.0);
    }

    public int degradedEvaluations() {
        return (int) turns.stream().filter(Turn::isDegraded).count();
    }

    public SessionSummary toSummary() {
        return SessionSummary.builder()
                .id(sessionId)
                .candidateName(setup.getCandidateName().trim())
                .company(setup.getCompanyName().trim())
                .role(setup.roleOrDefault())
                .startTime(startTime)
                .endTime(endTime)
                .overallScore(overallScore)
                .finalVerdict(finalVerdict)
                .resumeLength(setup.getResumeText().length())
                .totalQuestions(turns.size())
                .earlyTermination(earlyTerminationReason)
                .build();
    }

    void prepare(ProfileSnapshot profile, String companyIntel, InterviewStrategy strategy) {
        this.profile = profile;
        this.companyIntel = companyIntel;
        this.strategy = strategy.getPlan();
        this.persona = strategy.getPersona();
    }

    void beginTopic(InterviewStage stage) {
        this.stage = stage;
        int next = currentTopic == null ? 1 : currentTopic.getTopicNumber() + 1;
        this.currentTopic = new TopicState(next);
    }

    void applyPlan(StagePlan plan) {
        this.stage = plan.getStage();
        this.persona = plan.getPersona();
    }

    /**
     * Records a newly asked question and hands out its number.
     */
    int askQuestion(String question) {
        currentQuestion = question;
        currentTopic.openWith(question);
        return ++questionCount;
    }

    Turn appendTurn(String answer, ScoreJudgment judgment, boolean skipped, LocalDateTime timestamp) {
        String text = answer == null ? "" : answer;
        Turn turn = Turn.builder()
                .questionNumber(questionCount)
                .topicNumber(currentTopic.getTopicNumber())
                .pushbackAttempt(currentTopic.getPushbackCount())
                .stage(stage)
                .question(currentQuestion)
                .answer(text)
                .answerLength(text.length())
                .score(judgment.getScore())
                .strengths(judgment.getStrengths())
                .weaknesses(judgment.getWeaknesses())
                .tip(judgment.getTip())
                .sentiment(judgment.getSentiment())
                .degraded(judgment.isDegraded())
                .skipped(skipped)
                .timestamp(timestamp)
                .build();
        turns.add(turn);
        return turn;
    }

    void failCurrentTopic() {
        failedTopics.add(currentTopic.getOpeningQuestion());
    }

    void terminateEarly(String reason) {
        this.earlyTerminationReason = reason;
    }

    void complete(LocalDateTime endTime, double overallScore, ReportText report) {
        this.endTime = endTime;
        this.overallScore = overallScore;
        this.finalVerdict = report.getVerdict();
        this.roadmap = report.getRoadmap();
        this.stage = InterviewStage.COMPLETE;
        this.currentQuestion = null;
    }

    void markTurnPersisted(int questionNumber) {
        persistedTurns.add(questionNumber);
    }

    boolean isTurnPersisted(int questionNumber) {
        return persistedTurns.contains(questionNumber);
    }

    void markProfilePersisted() {
        profilePersisted = true;
    }

    void addWarning(String warning) {
        warnings.add(warning);
    }
}
