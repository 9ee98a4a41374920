package com.prepcoach.interviewer.engine;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Rolling view over the most recent turn scores.
 */
final class ScoreWindow {

    private final List<Double> scores;
    private final int size;

    private ScoreWindow(List<Double> scores, int size) {
        this.scores = scores;
        this.size = size;
    }

    static ScoreWindow of(List<Double> scores, int size) {
        return new ScoreWindow(scores, size);
    }

    boolean isFull() {
        return scores.size() >= size;
    }

    /**
     * Mean of the last {@code size} scores, empty until that many exist.
     */
    OptionalDouble average() {
        if (!isFull()) {
            return OptionalDouble.empty();
        }
        return scores.subList(scores.size() - size, scores.size()).stream()
                .mapToDouble(Double::doubleValue)
                .average();
    }
}
