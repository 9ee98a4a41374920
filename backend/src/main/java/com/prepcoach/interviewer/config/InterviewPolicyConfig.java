package com.prepcoach.interviewer.config;

import com.prepcoach.interviewer.engine.AnswerScorer;
import com.prepcoach.interviewer.engine.CompanyResearcher;
import com.prepcoach.interviewer.engine.InterviewCollaborators;
import com.prepcoach.interviewer.engine.InterviewStrategist;
import com.prepcoach.interviewer.engine.PolicySettings;
import com.prepcoach.interviewer.engine.ProfileAnalyzer;
import com.prepcoach.interviewer.engine.QuestionGenerator;
import com.prepcoach.interviewer.engine.ReportWriter;
import com.prepcoach.interviewer.engine.ScoringPolicy;
import com.prepcoach.interviewer.engine.StagePlanner;
import com.prepcoach.interviewer.engine.StageSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the interview engine from {@code interview.*} properties.
 */
@Configuration
@Slf4j
public class InterviewPolicyConfig {

    @Bean
    public PolicySettings policySettings(
            @Value("${interview.policy.pushback-score-threshold:2.0}") double pushbackScoreThreshold,
            @Value("${interview.policy.max-pushbacks:2}") int maxPushbacks,
            @Value("${interview.policy.window-size:3}") int windowSize,
            @Value("${interview.policy.early-termination-average:3.5}") double earlyTerminationAverage,
            @Value("${interview.policy.max-questions:8}") int maxQuestions) {
        PolicySettings settings = PolicySettings.builder()
                .pushbackScoreThreshold(pushbackScoreThreshold)
                .maxPushbacks(maxPushbacks)
                .windowSize(windowSize)
                .earlyTerminationAverage(earlyTerminationAverage)
                .maxQuestions(maxQuestions)
                .build();
        log.info("Scoring policy: {}", settings);
        return settings;
    }

    @Bean
    public StageSettings stageSettings(
            @Value("${interview.stages.intro:1}") int intro,
            @Value("${interview.stages.technical:4}") int technical,
            @Value("${interview.stages.behavioral:2}") int behavioral,
            @Value("${interview.stages.closing:1}") int closing,
            @Value("${interview.persona.challenging-below:5.0}") double challengingBelow,
            @Value("${interview.persona.supportive-at-least:8.0}") double supportiveAtLeast) {
        return StageSettings.builder()
                .introQuestions(intro)
                .technicalQuestions(technical)
                .behavioralQuestions(behavioral)
                .closingQuestions(closing)
                .challengingBelow(challengingBelow)
                .supportiveAtLeast(supportiveAtLeast)
                .build();
    }

    @Bean
    public ScoringPolicy scoringPolicy(PolicySettings policySettings) {
        return new ScoringPolicy(policySettings);
    }

    @Bean
    public StagePlanner stagePlanner(StageSettings stageSettings) {
        return new StagePlanner(stageSettings);
    }

    @Bean
    public InterviewCollaborators interviewCollaborators(ProfileAnalyzer profileAnalyzer,
                                                         CompanyResearcher companyResearcher,
                                                         InterviewStrategist strategist,
                                                         QuestionGenerator questionGenerator,
                                                         AnswerScorer answerScorer,
                                                         ReportWriter reportWriter) {
        return InterviewCollaborators.builder()
                .profileAnalyzer(profileAnalyzer)
                .companyResearcher(companyResearcher)
                .strategist(strategist)
                .questionGenerator(questionGenerator)
                .answerScorer(answerScorer)
                .reportWriter(reportWriter)
                .build();
    }
}
