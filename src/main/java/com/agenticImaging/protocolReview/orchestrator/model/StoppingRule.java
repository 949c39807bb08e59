package com.agenticImaging.protocolReview.orchestrator.model;

import lombok.Getter;

/**
 * Confidence gate evaluated after every REVIEW.
 * 
 * Looping continues while {@code iteration < maxIterations} and the run has not yet converged,
 * where converged means {@code iteration >= minIterations && confidence >= threshold}. The floor
 * keeps a lucky first pass from skipping review; the cap bounds a non-convergent pair.
 */
@Getter
public final class StoppingRule {
    
    public static final int DEFAULT_MAX_ITERATIONS = 6;
    public static final int DEFAULT_MIN_ITERATIONS = 2;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.75;
    
    private final int maxIterations;
    private final int minIterations;
    private final double confidenceThreshold;
    
    public StoppingRule(int maxIterations, int minIterations, double confidenceThreshold) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (minIterations < 1 || minIterations > maxIterations) {
            throw new IllegalArgumentException("minIterations must be in [1, " + maxIterations + "], got " + minIterations);
        }
        if (!(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0)) {
            throw new IllegalArgumentException("confidenceThreshold must be in [0, 1], got " + confidenceThreshold);
        }
        this.maxIterations = maxIterations;
        this.minIterations = minIterations;
        this.confidenceThreshold = confidenceThreshold;
    }
    
    public static StoppingRule standard() {
        return new StoppingRule(DEFAULT_MAX_ITERATIONS, DEFAULT_MIN_ITERATIONS, DEFAULT_CONFIDENCE_THRESHOLD);
    }
    
    /**
     * @param iteration Number of completed iterations (1-based)
     * @param confidence Feedback confidence of the latest review
     * @return true if the threshold is met at or after the minimum iteration
     */
    public boolean isConverged(int iteration, double confidence) {
        return iteration >= minIterations && confidence >= confidenceThreshold;
    }
    
    /**
     * @param iteration Number of completed iterations (1-based)
     * @param confidence Feedback confidence of the latest review
     * @return true if another GENERATE/REVIEW cycle should run
     */
    public boolean shouldContinue(int iteration, double confidence) {
        return iteration < maxIterations && !isConverged(iteration, confidence);
    }
}
