/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * Diagnostic record of a stage or endpoint that did not produce the accepted classification.
 *
 * @param stage
 *            cascade stage
 * @param model
 *            model handle name, e.g. {@code fallback-api}
 * @param kind
 *            failure kind
 * @param message
 *            human-readable detail
 */
public record StageErrorType(CascadeStage stage, String model, StageErrorKind kind, String message) {
}
