package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.InterviewStrategist;
import com.prepcoach.interviewer.engine.InterviewStrategy;
import com.prepcoach.interviewer.engine.Persona;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmInterviewStrategist implements InterviewStrategist {

    private final LlmClient llmClient;

    @Override
    public InterviewStrategy plan(ProfileSnapshot profile, String companyIntel) {
        String prompt = """
                You are designing a realistic interview flow.

                CANDIDATE PROFILE:
                - Matched skills: %s
                - Missing skills: %s
                - Experience level: %s
                - Weaknesses: %s

                COMPANY CONTEXT:
                %s

                In 3-4 sentences: which persona the interviewer should adopt (supportive, neutral or challenging),
                the order of topics, and which weaknesses to dig into.
                """.formatted(profile.getMatchedSkills(), profile.getMissingSkills(),
                profile.getExperienceLevel(), profile.getWeaknesses(), companyIntel);
        String plan = llmClient.generate(prompt, 0.3);
        Persona persona = personaFrom(plan);
        log.info("Strategy planned with {} persona", persona.getTag());
        return new InterviewStrategy(plan, persona);
    }

    static Persona personaFrom(String plan) {
        String lower = plan.toLowerCase(Locale.ROOT);
        if (lower.contains(Persona.SUPPORTIVE.getTag())) {
            return Persona.SUPPORTIVE;
        }
        if (lower.contains(Persona.CHALLENGING.getTag())) {
            return Persona.CHALLENGING;
        }
        return Persona.NEUTRAL;
    }
}
