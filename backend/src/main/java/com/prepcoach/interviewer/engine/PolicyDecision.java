package com.prepcoach.interviewer.engine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PolicyDecision {

    Decision decision;

    /** Set on a forced advance after the pushback budget ran out. */
    boolean topicFailed;

    String reason;

    static PolicyDecision of(Decision decision) {
        return new PolicyDecision(decision, false, null);
    }

    static PolicyDecision forcedAdvance() {
        return new PolicyDecision(Decision.ADVANCE, true, null);
    }

    static PolicyDecision earlyTerminate(String reason) {
        return new PolicyDecision(Decision.EARLY_TERMINATE, false, reason);
    }
}
