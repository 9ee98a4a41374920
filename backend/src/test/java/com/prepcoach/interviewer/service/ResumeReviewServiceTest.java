package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.CompanyFit;
import com.prepcoach.interviewer.engine.CompanyResearcher;
import com.prepcoach.interviewer.engine.ResumeAnalyzer;
import com.prepcoach.interviewer.engine.ResumeReview;
import com.prepcoach.interviewer.exception.CollaboratorException;
import com.prepcoach.interviewer.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeReviewServiceTest {

    @Mock
    private ResumeAnalyzer resumeAnalyzer;

    @Mock
    private CompanyResearcher companyResearcher;

    @InjectMocks
    private ResumeReviewService service;

    private static ResumeReview graded(String grade) {
        return ResumeReview.builder().overallGrade(grade).atsScore(70).build();
    }

    @Test
    void blankResumeIsRejectedBeforeAnyModelCall() {
        assertThatThrownBy(() -> service.review("  ", "jd", "Acme"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("resume_text");
        verifyNoInteractions(resumeAnalyzer, companyResearcher);
    }

    @Test
    void companyIntelIsPassedToTheAnalyzer() {
        when(companyResearcher.research("Acme")).thenReturn("Acme hires for ownership");
        when(resumeAnalyzer.analyze("resume", "jd", "Acme hires for ownership")).thenReturn(graded("B"));

        assertThat(service.review("resume", "jd", " Acme ").getOverallGrade()).isEqualTo("B");
    }

    @Test
    void noCompanyMeansNoResearch() {
        when(resumeAnalyzer.analyze("resume", "", "")).thenReturn(graded("A"));

        assertThat(service.review("resume", null, null).getOverallGrade()).isEqualTo("A");
        verifyNoInteractions(companyResearcher);
    }

    @Test
    void failedResearchStillReviewsTheResume() {
        when(companyResearcher.research(anyString())).thenThrow(new CollaboratorException("timeout"));
        when(resumeAnalyzer.analyze("resume", "jd", "")).thenReturn(graded("C"));

        assertThat(service.review("resume", "jd", "Acme").getOverallGrade()).isEqualTo("C");
        verify(resumeAnalyzer).analyze("resume", "jd", "");
    }

    @Test
    void analyzerFailureYieldsPlaceholderReview() {
        when(resumeAnalyzer.analyze("resume", "", "")).thenThrow(new CollaboratorException("Model output is not valid JSON"));

        ResumeReview review = service.review("resume", "", "");

        assertThat(review.getOverallGrade()).isEqualTo(ResumeReview.FAILED_GRADE);
        assertThat(review.getAtsScore()).isZero();
        assertThat(review.isDegraded()).isTrue();
        assertThat(review.getDetailedFeedback()).isEqualTo("Analysis error: Model output is not valid JSON");
    }

    @Test
    void unexpectedAnalyzerErrorAlsoYieldsPlaceholder() {
        when(resumeAnalyzer.analyze("resume", "", "")).thenThrow(new IllegalStateException("pool closed"));

        ResumeReview review = service.review("resume", "", "");

        assertThat(review.isDegraded()).isTrue();
        assertThat(review.getDetailedFeedback()).contains("pool closed");
    }

    @Test
    void rendersSectionsThatHaveContent() {
        ResumeReview review = ResumeReview.builder()
                .overallGrade("C")
                .atsScore(58)
                .fatalFlaws(List.of("No measurable results"))
                .sectionScores(Map.of("work_experience", 3))
                .improvementTips(List.of("Add numbers to the Acme role", "Drop the objective"))
                .companyFit(CompanyFit.builder()
                        .matchLevel("Poor")
                        .companyExpects("Go and Kubernetes")
                        .resumeShows("PHP")
                        .companyGaps(List.of("Kubernetes"))
                        .build())
                .build();

        String report = service.render(review);

        assertThat(report)
                .contains("## Overall Grade: **C**")
                .contains("## ATS Compatibility Score: **58/100**")
                .contains("### Company Fit: **Poor**")
                .contains("- Kubernetes")
                .contains("### Fatal Flaws (fix these first)\n\n- No measurable results")
                .contains("**Work Experience**: ###....... 3/10")
                .contains("2. Drop the objective")
                .doesNotContain("### Red Flags")
                .doesNotContain("### Detailed Analysis");
    }
}
