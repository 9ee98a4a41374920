package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.ResumeAnalyzer;
import com.prepcoach.interviewer.engine.ResumeReview;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
public class LlmResumeAnalyzer implements ResumeAnalyzer {

    private final LlmClient llmClient;
    private final JudgmentParser judgmentParser;

    @Override
    public ResumeReview analyze(String resumeText, String jobDescription, String companyIntel) {
        log.info("Reviewing resume ({} chars, job description {}, company intel {})",
                resumeText.length(), isBlank(jobDescription) ? "absent" : "present",
                isBlank(companyIntel) ? "absent" : "present");
        ResumeReview review = judgmentParser.parseResumeReview(
                llmClient.generate(buildPrompt(resumeText, jobDescription, companyIntel), 0.3));
        log.info("Resume graded {} (ATS {}/100, {} red flags, {} fatal flaws)", review.getOverallGrade(),
                review.getAtsScore(), review.getRedFlags().size(), review.getFatalFlaws().size());
        return review;
    }

    String buildPrompt(String resumeText, String jobDescription, String companyIntel) {
        String target = isBlank(jobDescription)
                ? ""
                : "\nTARGET JOB:\n" + jobDescription + "\nJudge the fit for this specific role.\n";
        String company = isBlank(companyIntel)
                ? ""
                : "\nCOMPANY EXPECTATIONS:\n" + companyIntel
                + "\nJudge whether the resume matches what this company looks for and fill in company_fit.\n";
        return """
                You are a blunt but fair resume critic with 20 years of hiring experience.
                Find every problem in this resume.

                RESUME:
                %s
                %s%s
                Assess:
                - ATS compatibility (0-100): keywords from the job, plain formatting, standard titles
                - red flags: unexplained gaps, job hopping, vague duties, skills never demonstrated, typos
                - fatal flaws: missing experience or education, no measurable results, mostly unrelated experience
                - strengths: action verbs, quantified results, clear progression, relevant credentials
                - section scores (0-10): contact_info, summary, work_experience, skills, education, projects
                - the 5 most valuable specific rewrites, quoting the original line where possible
                - overall grade: A (interview almost always), B, C, D, F (start over)

                Return ONLY a JSON object, no markdown:
                {"overall_grade": "C", "ats_score": 65,
                 "red_flags": ["..."], "fatal_flaws": ["..."], "strengths": ["..."],
                 "section_scores": {"contact_info": 9, "summary": 4, "work_experience": 5,
                                    "skills": 6, "education": 8, "projects": 0},
                 "company_fit": {"match_level": "Poor|Fair|Good|Excellent", "company_expects": "...",
                                 "resume_shows": "...", "company_gaps": ["..."], "tailoring_tips": ["..."]},
                 "improvement_tips": ["..."], "detailed_feedback": "..."}
                """.formatted(resumeText, target, company);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
