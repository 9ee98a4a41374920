package com.prepcoach.interviewer.controller;

import com.prepcoach.interviewer.service.InterviewSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service banner with live session counters and the entry points a client starts from.
 */
@RestController
@RequiredArgsConstructor
public class RootController {

    private final InterviewSessionService sessionService;

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("message", "Interview Prep Coach API is running!");
        result.put("active_sessions", sessionService.activeSessions());
        result.put("retained_reports", sessionService.retainedReports());
        result.put("endpoints", Map.of(
                "resume_review", "POST /api/resume/review",
                "start_interview", "POST /api/interview/sessions",
                "history", "GET /api/history/sessions"
        ));
        return result;
    }
}
