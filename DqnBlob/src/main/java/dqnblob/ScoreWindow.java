package dqnblob;

import java.util.ArrayDeque;
import java.util.Deque;

// Rolling window of the last N values of one metric
public class ScoreWindow {
    private final Deque<Double> scores = new ArrayDeque<>();
    private final int windowSize;
    private double sum;

    public ScoreWindow(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
        }
        this.windowSize = windowSize;
    }

    public void add(double score) {
        if (scores.size() >= windowSize) {
            sum -= scores.removeFirst(); // Remove oldest score
        }
        scores.addLast(score);
        sum += score;
    }

    public double average() {
        return scores.isEmpty() ? 0.0 : sum / scores.size();
    }

    public int size() {
        return scores.size();
    }
}
