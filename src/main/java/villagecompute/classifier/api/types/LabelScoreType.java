/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * One label returned by the zero-shot validator endpoint.
 *
 * @param label
 *            candidate label
 * @param score
 *            probability assigned to the label
 */
public record LabelScoreType(String label, double score) {
}
