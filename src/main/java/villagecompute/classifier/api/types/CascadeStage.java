/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Ordered stages of the classifier cascade. The cascade walks them with a closed switch.
 */
public enum CascadeStage {

    /** Primary legal model; accepted at the primary threshold. */
    PRIMARY,

    /** Remote then local general-purpose model; accepted at the fallback threshold. */
    FALLBACK,

    /** Rule-based floor. Always accepted. */
    PATTERN_BASED,

    /** Terminal state after an uncaught exception. */
    EMERGENCY;

    public String tagValue() {
        return name().toLowerCase();
    }
}
