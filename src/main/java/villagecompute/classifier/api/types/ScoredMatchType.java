/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

/**
 * A retrieval hit paired with its similarity score in [0,1].
 *
 * @param item
 *            matched item
 * @param score
 *            similarity score, higher is closer
 * @param <T>
 *            item type
 */
public record ScoredMatchType<T>(T item, double score) {
}
