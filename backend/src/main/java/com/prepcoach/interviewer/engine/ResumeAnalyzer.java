package com.prepcoach.interviewer.engine;

public interface ResumeAnalyzer {

    /**
     * @param jobDescription may be blank
     * @param companyIntel   research summary of the target company, may be blank
     */
    ResumeReview analyze(String resumeText, String jobDescription, String companyIntel);
}
