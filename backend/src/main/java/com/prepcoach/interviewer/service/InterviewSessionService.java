package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.engine.InterviewCollaborators;
import com.prepcoach.interviewer.engine.InterviewOrchestrator;
import com.prepcoach.interviewer.engine.InterviewPersistence;
import com.prepcoach.interviewer.engine.InterviewReport;
import com.prepcoach.interviewer.engine.InterviewSetup;
import com.prepcoach.interviewer.engine.OrchestratorState;
import com.prepcoach.interviewer.engine.ScoringPolicy;
import com.prepcoach.interviewer.engine.SessionStart;
import com.prepcoach.interviewer.engine.StagePlanner;
import com.prepcoach.interviewer.engine.TurnOutcome;
import com.prepcoach.interviewer.exception.IllegalSessionStateException;
import com.prepcoach.interviewer.exception.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Keeps one {@link InterviewOrchestrator} per live session.
 *
 * <p>Once a session is done its orchestrator is dropped and only the report is kept, for the
 * most recent {@code interview.sessions.retained-reports} sessions. Older reports are rebuilt
 * from the stored tables.
 */
@Service
@Slf4j
public class InterviewSessionService {

    private final InterviewCollaborators collaborators;
    private final InterviewPersistence persistence;
    private final ScoringPolicy scoringPolicy;
    private final StagePlanner stagePlanner;
    private final SessionIdGenerator sessionIds;
    private final SessionHistoryService historyService;
    private final Clock clock;
    private final int retainedReports;

    private final Map<Long, InterviewOrchestrator> live = new ConcurrentHashMap<>();
    private final Map<Long, InterviewReport> finished = new ConcurrentHashMap<>();
    private final Deque<Long> finishedOrder = new ConcurrentLinkedDeque<>();

    public InterviewSessionService(InterviewCollaborators collaborators,
                                   InterviewPersistence persistence,
                                   ScoringPolicy scoringPolicy,
                                   StagePlanner stagePlanner,
                                   SessionIdGenerator sessionIds,
                                   SessionHistoryService historyService,
                                   Clock clock,
                                   @Value("${interview.sessions.retained-reports:200}") int retainedReports) {
        this.collaborators = collaborators;
        this.persistence = persistence;
        this.scoringPolicy = scoringPolicy;
        this.stagePlanner = stagePlanner;
        this.sessionIds = sessionIds;
        this.historyService = historyService;
        this.clock = clock;
        this.retainedReports = Math.max(0, retainedReports);
    }

    public SessionStart createSession(InterviewSetup setup) {
        InterviewOrchestrator orchestrator = new InterviewOrchestrator(
                collaborators, persistence, scoringPolicy, stagePlanner, sessionIds, clock);
        SessionStart start = orchestrator.start(setup);
        live.put(start.getSessionId(), orchestrator);
        log.info("Session {} is live ({} active)", start.getSessionId(), live.size());
        return start;
    }

    public TurnOutcome submitAnswer(long sessionId, String answer, String nonVerbalSignal) {
        InterviewOrchestrator orchestrator = live.get(sessionId);
        if (orchestrator == null) {
            if (finished.containsKey(sessionId) || historyService.exists(sessionId)) {
                throw new IllegalSessionStateException("submit an answer", OrchestratorState.DONE);
            }
            throw new SessionNotFoundException(sessionId);
        }
        TurnOutcome outcome = orchestrator.submitAnswer(answer, nonVerbalSignal);
        if (orchestrator.getState() == OrchestratorState.DONE) {
            retire(sessionId, orchestrator);
        }
        return outcome;
    }

    public InterviewReport getReport(long sessionId) {
        InterviewOrchestrator orchestrator = live.get(sessionId);
        if (orchestrator != null) {
            return orchestrator.report();
        }
        InterviewReport report = finished.get(sessionId);
        if (report != null) {
            return report;
        }
        log.debug("Report of session {} is no longer in memory, loading from storage", sessionId);
        return historyService.loadReport(sessionId);
    }

    public int activeSessions() {
        return live.size();
    }

    public int retainedReports() {
        return finished.size();
    }

    private void retire(long sessionId, InterviewOrchestrator orchestrator) {
        if (retainedReports > 0) {
            finished.put(sessionId, orchestrator.report());
            finishedOrder.addLast(sessionId);
            while (finishedOrder.size() > retainedReports) {
                Long evicted = finishedOrder.pollFirst();
                if (evicted != null) {
                    finished.remove(evicted);
                }
            }
        }
        live.remove(sessionId);
        log.info("Session {} finished ({} active, {} reports retained)", sessionId, live.size(), finished.size());
    }
}
