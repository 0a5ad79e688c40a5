/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Why a cascade stage did not produce an accepted classification.
 */
public enum StageErrorKind {

    /** Endpoint unreachable, model failed to load, or the model slot could not be obtained. */
    UNAVAILABLE,

    /** Call exceeded its bounded timeout. */
    TIMEOUT,

    /** Model answered with blank text or text that does not name a taxonomy category. */
    UNUSABLE_RESPONSE,

    /** Model answered but the stage confidence missed the acceptance threshold. */
    BELOW_THRESHOLD
}
