package com.prepcoach.interviewer.engine;

import com.prepcoach.interviewer.exception.SessionPersistenceException;

/**
 * Durable sink for session data. Records what it is handed and never mutates it.
 * Every method throws {@link SessionPersistenceException} when the write fails.
 */
public interface InterviewPersistence {

    void createSession(SessionSummary session);

    /** Appends one qa_logs row and bumps the session's question total. */
    void appendTurn(long sessionId, Turn turn);

    void saveProfile(long sessionId, ProfileSnapshot profile);

    /** Inserts or updates the session row. */
    void saveSession(SessionSummary session);
}
