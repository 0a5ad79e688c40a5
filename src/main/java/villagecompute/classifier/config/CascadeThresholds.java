/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.config;

/**
 * Acceptance thresholds of the classifier cascade and retrieval depth.
 *
 * @param primaryAcceptance
 *            minimum stage confidence that ends the cascade at the primary stage
 * @param fallbackAcceptance
 *            minimum stage confidence that ends the cascade at the fallback stage
 * @param retrievalTopK
 *            maximum matches per similarity collection
 */
public record CascadeThresholds(double primaryAcceptance, double fallbackAcceptance, int retrievalTopK) {

    public static CascadeThresholds defaults() {
        return new CascadeThresholds(0.70, 0.60, 5);
    }
}
