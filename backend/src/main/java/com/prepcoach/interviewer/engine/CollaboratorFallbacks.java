package com.prepcoach.interviewer.engine;

import java.util.Locale;

/**
 * Conservative defaults used when a collaborator fails.
 */
public final class CollaboratorFallbacks {

    private CollaboratorFallbacks() {
    }

    public static String question(InterviewStage stage, boolean intensify) {
        if (intensify) {
            return "Let's stay on this topic. Give me a concrete example: what was the situation, "
                    + "what exactly did you do, and what was the measurable outcome?";
        }
        return switch (stage) {
            case INTRO -> "Walk me through the most relevant experience on your resume for this role.";
            case TECHNICAL -> "Describe a technically challenging system you built. "
                    + "What trade-offs did you make and why?";
            case BEHAVIORAL -> "Tell me about a time a project did not go as planned. "
                    + "What went wrong and what did you do about it?";
            case CLOSING -> "Which skill required for this role is your weakest today, "
                    + "and how do you plan to close that gap?";
            case COMPLETE -> "Is there anything else you would like us to know before we wrap up?";
        };
    }

    public static String companyIntel(String companyName) {
        return companyName + " values innovation, teamwork, and technical excellence.";
    }

    public static InterviewStrategy strategy() {
        return new InterviewStrategy("Start with experience, test technical depth, "
                + "then behavioral examples and gaps.", Persona.NEUTRAL);
    }

    public static ReportText report(double overallScore, String earlyTerminationReason) {
        String band;
        if (overallScore >= 8.0) {
            band = "Strong performance: ready for interviews at this level.";
        } else if (overallScore >= 6.0) {
            band = "Solid performance with clear areas to sharpen.";
        } else if (overallScore >= 4.0) {
            band = "Below the bar for this role today; focused practice needed.";
        } else {
            band = "Not ready for this role yet.";
        }
        String verdict = String.format(Locale.ROOT, "Overall score %.1f/10. %s", overallScore, band);
        if (earlyTerminationReason != null) {
            verdict += " Interview ended early: " + earlyTerminationReason + ".";
        }
        return new ReportText(verdict,
                "Review the weaknesses and tips recorded for each question and rehearse answers "
                        + "with concrete examples, numbers and outcomes.");
    }
}
