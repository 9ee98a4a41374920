package com.prepcoach.interviewer.engine;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class InterviewSetup {

    public static final String DEFAULT_ROLE = "Engineering Role";

    String candidateName;
    String resumeText;
    String jobDescription;
    String companyName;
    String role;

    public String roleOrDefault() {
        return isBlank(role) ? DEFAULT_ROLE : role.trim();
    }

    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (isBlank(candidateName)) missing.add("candidate_name");
        if (isBlank(resumeText)) missing.add("resume_text");
        if (isBlank(jobDescription)) missing.add("job_description");
        if (isBlank(companyName)) missing.add("company_name");
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
