/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Identifies which cascade stage produced the accepted classification.
 */
public enum ModelUsed {

    /** Legal-domain primary language model. */
    PRIMARY("Primary"),

    /** Locally hosted general-purpose fallback model. */
    FALLBACK("Fallback"),

    /** Remote general-purpose fallback endpoint. */
    FALLBACK_API("FallbackAPI"),

    /** Regex and keyword rules; never fails. */
    PATTERN_BASED("PatternBased"),

    /** Pattern rules invoked after an unexpected exception escaped the cascade. */
    EMERGENCY("Emergency");

    private final String label;

    ModelUsed(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
