/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.api.types;

import java.util.List;

/**
 * The cascade's single accepted classification plus diagnostics from the stages that were passed over.
 *
 * @param accepted
 *            accepted stage output
 * @param heuristic
 *            heuristic assessment current for {@code accepted}; null for rule-based stages
 * @param stageErrors
 *            reasons earlier stages were not accepted, in cascade order
 * @param emergencyError
 *            message of the exception that forced the emergency path, null otherwise
 */
public record CascadeOutcomeType(RawClassificationType accepted, HeuristicScoreType heuristic,
        List<StageErrorType> stageErrors, String emergencyError) {

    public CascadeOutcomeType {
        stageErrors = stageErrors == null ? List.of() : List.copyOf(stageErrors);
    }

    public boolean isEmergency() {
        return accepted.modelUsed() == ModelUsed.EMERGENCY;
    }
}
