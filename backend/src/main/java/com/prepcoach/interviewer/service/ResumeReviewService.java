package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.CompanyFit;
import com.prepcoach.interviewer.engine.CompanyResearcher;
import com.prepcoach.interviewer.engine.ResumeAnalyzer;
import com.prepcoach.interviewer.engine.ResumeReview;
import com.prepcoach.interviewer.exception.CollaboratorException;
import com.prepcoach.interviewer.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Pre-interview resume critique. Independent of any interview session and never stored.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResumeReviewService {

    private final ResumeAnalyzer resumeAnalyzer;
    private final CompanyResearcher companyResearcher;

    public ResumeReview review(String resumeText, String jobDescription, String companyName) {
        if (isBlank(resumeText)) {
            throw new ValidationException(List.of("resume_text"));
        }
        String companyIntel = isBlank(companyName) ? "" : research(companyName.trim());
        try {
            return resumeAnalyzer.analyze(resumeText, nullToEmpty(jobDescription), companyIntel);
        } catch (CollaboratorException e) {
            log.warn("Resume analysis failed: {}", e.getMessage());
            return ResumeReview.failed(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Resume analysis crashed", e);
            return ResumeReview.failed(e.toString());
        }
    }

    /**
     * Markdown rendering of a review: grade and ATS score, company fit, flaws, strengths,
     * section scores, tips, then the free-text analysis.
     */
    public String render(ResumeReview review) {
        StringBuilder report = new StringBuilder()
                .append("# Resume Analysis Report\n\n")
                .append("## Overall Grade: **").append(review.getOverallGrade()).append("**\n")
                .append("## ATS Compatibility Score: **").append(review.getAtsScore()).append("/100**\n\n");

        CompanyFit fit = review.getCompanyFit();
        if (fit != null) {
            report.append("### Company Fit: **").append(fit.getMatchLevel()).append("**\n\n")
                    .append("**What the company expects:**\n").append(fit.getCompanyExpects()).append("\n\n")
                    .append("**What your resume shows:**\n").append(fit.getResumeShows()).append("\n\n");
            bullets(report, "**Critical gaps for this company:**", fit.getCompanyGaps());
            bullets(report, "**How to tailor for this company:**", fit.getTailoringTips());
            report.append("---\n\n");
        }

        bullets(report, "### Fatal Flaws (fix these first)", review.getFatalFlaws());
        bullets(report, "### Red Flags", review.getRedFlags());
        bullets(report, "### Strengths (keep these)", review.getStrengths());

        if (!review.getSectionScores().isEmpty()) {
            report.append("### Section Scores\n\n");
            for (Map.Entry<String, Integer> section : review.getSectionScores().entrySet()) {
                int score = section.getValue();
                report.append("**").append(sectionTitle(section.getKey())).append("**: ")
                        .append("#".repeat(score)).append(".".repeat(10 - score))
                        .append(' ').append(score).append("/10\n");
            }
            report.append('\n');
        }

        List<String> tips = review.getImprovementTips();
        if (!tips.isEmpty()) {
            report.append("### Top Improvements To Make\n\n");
            for (int i = 0; i < tips.size(); i++) {
                report.append(i + 1).append(". ").append(tips.get(i)).append("\n\n");
            }
        }

        if (!isBlank(review.getDetailedFeedback())) {
            report.append("### Detailed Analysis\n\n").append(review.getDetailedFeedback()).append('\n');
        }
        return report.toString();
    }

    private String research(String companyName) {
        try {
            String intel = companyResearcher.research(companyName);
            return intel == null ? "" : intel;
        } catch (CollaboratorException e) {
            log.warn("Company research for {} failed, reviewing without company fit: {}", companyName, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Company research for {} crashed, reviewing without company fit", companyName, e);
        }
        return "";
    }

    private static void bullets(StringBuilder report, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        report.append(heading).append("\n\n");
        for (String item : items) {
            report.append("- ").append(item).append('\n');
        }
        report.append('\n');
    }

    static String sectionTitle(String key) {
        StringBuilder title = new StringBuilder();
        for (String word : key.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
