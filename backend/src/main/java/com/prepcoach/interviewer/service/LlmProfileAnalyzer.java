package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.ProfileAnalyzer;
import com.prepcoach.interviewer.engine.ProfileSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmProfileAnalyzer implements ProfileAnalyzer {

    private final LlmClient llmClient;
    private final JudgmentParser judgmentParser;

    @Override
    public ProfileSnapshot analyze(String resumeText, String jobDescription) {
        log.info("Analyzing resume ({} chars) against job description ({} chars)",
                resumeText.length(), jobDescription.length());
        ProfileSnapshot profile = judgmentParser.parseProfile(llmClient.generate(buildPrompt(resumeText, jobDescription), 0.3));
        log.info("Profile: {} matched skills, {} missing, level {}",
                profile.getMatchedSkills().size(), profile.getMissingSkills().size(), profile.getExperienceLevel());
        return profile;
    }

    private String buildPrompt(String resumeText, String jobDescription) {
        return """
                You are an expert talent analyzer. Compare the resume with the job description.

                RESUME:
                %s

                JOB DESCRIPTION:
                %s

                Return ONLY a JSON object with:
                "matched_skills": skills the candidate has that the job asks for,
                "missing_skills": skills the job asks for that the resume lacks,
                "strengths": top 3 strong points,
                "weaknesses": top 3 areas to dig into,
                "experience_level": "junior", "mid" or "senior",
                "red_flags": concerns such as gaps or job hopping (may be empty).
                All values except experience_level are arrays of strings.
                """.formatted(resumeText, jobDescription);
    }
}
