package com.prepcoach.interviewer.controller;

import com.prepcoach.interviewer.dto.CompanyFitDto;
import com.prepcoach.interviewer.dto.ResumeReviewDto;
import com.prepcoach.interviewer.dto.ResumeReviewRequestDto;
import com.prepcoach.interviewer.engine.CompanyFit;
import com.prepcoach.interviewer.engine.ResumeReview;
import com.prepcoach.interviewer.exception.ValidationException;
import com.prepcoach.interviewer.service.ResumeReviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/resume")
@RequiredArgsConstructor
@Slf4j
public class ResumeController {

    private final ResumeReviewService reviewService;

    @PostMapping("/review")
    public ResumeReviewDto review(@RequestBody ResumeReviewRequestDto request) {
        ResumeReview review;
        try {
            review = reviewService.review(request.getResumeText(), request.getJobDescription(), request.getCompanyName());
        } catch (ValidationException e) {
            log.info("Rejected resume review: {}", e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage());
        }

        CompanyFit fit = review.getCompanyFit();
        return ResumeReviewDto.builder()
                .overallGrade(review.getOverallGrade())
                .atsScore(review.getAtsScore())
                .redFlags(review.getRedFlags())
                .fatalFlaws(review.getFatalFlaws())
                .strengths(review.getStrengths())
                .sectionScores(review.getSectionScores())
                .improvementTips(review.getImprovementTips())
                .companyFit(fit == null ? null : CompanyFitDto.builder()
                        .matchLevel(fit.getMatchLevel())
                        .companyExpects(fit.getCompanyExpects())
                        .resumeShows(fit.getResumeShows())
                        .companyGaps(fit.getCompanyGaps())
                        .tailoringTips(fit.getTailoringTips())
                        .build())
                .detailedFeedback(review.getDetailedFeedback())
                .degraded(review.isDegraded())
                .report(reviewService.render(review))
                .build();
    }
}
