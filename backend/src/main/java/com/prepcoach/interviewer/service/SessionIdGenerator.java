package com.prepcoach.interviewer.service;

import com.prepcoach.interviewer.repository.InterviewSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Hands out session ids before any row is written, continuing after the highest stored id.
 */
@Component
@Slf4j
public class SessionIdGenerator implements LongSupplier {

    private final AtomicLong next;

    public SessionIdGenerator(InterviewSessionRepository sessionRepository) {
        long seed;
        try {
            seed = sessionRepository.findMaxId().orElse(0L) + 1;
        } catch (DataAccessException e) {
            seed = System.currentTimeMillis();
            log.warn("Could not read highest session id ({}), seeding ids from clock: {}", e.getMessage(), seed);
        }
        this.next = new AtomicLong(seed);
        log.info("Session ids start at {}", seed);
    }

    @Override
    public long getAsLong() {
        return next.getAndIncrement();
    }
}
