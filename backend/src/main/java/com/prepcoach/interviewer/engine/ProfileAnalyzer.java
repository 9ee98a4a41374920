package com.prepcoach.interviewer.engine;

public interface ProfileAnalyzer {

    ProfileSnapshot analyze(String resumeText, String jobDescription);
}
