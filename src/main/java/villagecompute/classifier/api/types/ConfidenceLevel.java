/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Discrete confidence bucket attached to every classification result.
 *
 * <p>
 * Constants are declared in ascending order so that {@link #compareTo(Enum)} follows the ordering
 * {@code UNCERTAIN < LOW < MEDIUM < HIGH}.
 */
public enum ConfidenceLevel {

    /** Score below 0.4. */
    UNCERTAIN("Uncertain", 0.0),

    /** Score in [0.4, 0.6). */
    LOW("Low", 0.4),

    /** Score in [0.6, 0.8). */
    MEDIUM("Medium", 0.6),

    /** Score of 0.8 or above. */
    HIGH("High", 0.8);

    private final String label;
    private final double lowerBound;

    ConfidenceLevel(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Lowest score that still maps to this level.
     */
    public double getLowerBound() {
        return lowerBound;
    }

    /**
     * Buckets a score. Values outside [0,1] are clamped first; NaN maps to {@link #UNCERTAIN}.
     *
     * @param score
     *            confidence score
     * @return the matching level
     */
    public static ConfidenceLevel fromScore(double score) {
        if (Double.isNaN(score)) {
            return UNCERTAIN;
        }
        double clamped = Math.max(0.0, Math.min(1.0, score));
        if (clamped >= HIGH.lowerBound) {
            return HIGH;
        }
        if (clamped >= MEDIUM.lowerBound) {
            return MEDIUM;
        }
        if (clamped >= LOW.lowerBound) {
            return LOW;
        }
        return UNCERTAIN;
    }

    /**
     * Whether a result at this level must be routed to a reviewer regardless of other signals.
     */
    public boolean requiresReview() {
        return this == LOW || this == UNCERTAIN;
    }
}
