/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Model-free assessment of a (category, document type) answer against the document text.
 *
 * @param keywordConfidence
 *            average of the category and document-type keyword sub-scores, in [0,1]
 * @param qualityMetrics
 *            text-quality signals
 * @param uncertaintyFlags
 *            insertion-ordered human-readable reasons to distrust the answer
 */
public record HeuristicScoreType(double keywordConfidence, QualityMetricsType qualityMetrics,
        Set<String> uncertaintyFlags) {

    public HeuristicScoreType {
        uncertaintyFlags = uncertaintyFlags == null ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(uncertaintyFlags));
    }

    public HeuristicScoreType withFlag(String flag) {
        Set<String> flags = new LinkedHashSet<>(uncertaintyFlags);
        flags.add(flag);
        return new HeuristicScoreType(keywordConfidence, qualityMetrics, flags);
    }
}
