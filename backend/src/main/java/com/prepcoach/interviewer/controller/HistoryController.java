package com.prepcoach.interviewer.controller;

import com.prepcoach.interviewer.dto.SessionStatsDto;
import com.prepcoach.interviewer.dto.SessionSummaryDto;
import com.prepcoach.interviewer.exception.SessionNotFoundException;
import com.prepcoach.interviewer.service.SessionHistoryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/history")
@RequiredArgsConstructor
public class HistoryController {

    private final SessionHistoryService historyService;

    @GetMapping("/sessions")
    public List<SessionSummaryDto> recentSessions(@RequestParam(defaultValue = "10") int limit) {
        return historyService.recentSessions(limit);
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionStatsDto sessionStats(@PathVariable Long sessionId) {
        try {
            return historyService.sessionStats(sessionId);
        } catch (SessionNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }
}
