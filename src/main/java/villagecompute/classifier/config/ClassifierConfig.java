/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.classifier.config;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.classifier.config.AiConfig.AiConfigurationException;

/**
 * Configuration of the cascade thresholds and confidence-scoring weights.
 *
 * <p>
 * The defaults reproduce the calibrated behavior of the classifier and should only be changed as part of a deliberate
 * recalibration:
 * <ul>
 * <li>{@code classifier.cascade.primary-acceptance} - 0.70</li>
 * <li>{@code classifier.cascade.fallback-acceptance} - 0.60</li>
 * <li>{@code classifier.retrieval.top-k} - 5</li>
 * <li>{@code classifier.scoring.structure-bonus} - 0.20</li>
 * <li>{@code classifier.scoring.legal-formatting-bonus} - 0.15</li>
 * <li>{@code classifier.scoring.word-count-bonus} - 0.10</li>
 * <li>{@code classifier.scoring.ocr-penalty} - 0.20</li>
 * <li>{@code classifier.scoring.flag-penalty} - 0.10</li>
 * <li>{@code classifier.scoring.long-document-words} - 200</li>
 * <li>{@code classifier.scoring.short-document-words} - 50</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class ClassifierConfig {

    private static final Logger LOG = Logger.getLogger(ClassifierConfig.class);

    @ConfigProperty(
            name = "classifier.cascade.primary-acceptance",
            defaultValue = "0.70")
    double primaryAcceptance;

    @ConfigProperty(
            name = "classifier.cascade.fallback-acceptance",
            defaultValue = "0.60")
    double fallbackAcceptance;

    @ConfigProperty(
            name = "classifier.retrieval.top-k",
            defaultValue = "5")
    int retrievalTopK;

    @ConfigProperty(
            name = "classifier.scoring.structure-bonus",
            defaultValue = "0.20")
    double structureBonus;

    @ConfigProperty(
            name = "classifier.scoring.legal-formatting-bonus",
            defaultValue = "0.15")
    double legalFormattingBonus;

    @ConfigProperty(
            name = "classifier.scoring.word-count-bonus",
            defaultValue = "0.10")
    double wordCountBonus;

    @ConfigProperty(
            name = "classifier.scoring.ocr-penalty",
            defaultValue = "0.20")
    double ocrPenalty;

    @ConfigProperty(
            name = "classifier.scoring.flag-penalty",
            defaultValue = "0.10")
    double flagPenalty;

    @ConfigProperty(
            name = "classifier.scoring.long-document-words",
            defaultValue = "200")
    int longDocumentWords;

    @ConfigProperty(
            name = "classifier.scoring.short-document-words",
            defaultValue = "50")
    int shortDocumentWords;

    /**
     * Rejects thresholds and weights outside [0,1], a fallback threshold above the primary threshold, and
     * non-positive word limits or retrieval depth.
     *
     * @throws AiConfigurationException
     *             on any violation
     */
    @PostConstruct
    public void validateConfiguration() {
        requireUnit("classifier.cascade.primary-acceptance", primaryAcceptance);
        requireUnit("classifier.cascade.fallback-acceptance", fallbackAcceptance);
        requireUnit("classifier.scoring.structure-bonus", structureBonus);
        requireUnit("classifier.scoring.legal-formatting-bonus", legalFormattingBonus);
        requireUnit("classifier.scoring.word-count-bonus", wordCountBonus);
        requireUnit("classifier.scoring.ocr-penalty", ocrPenalty);
        requireUnit("classifier.scoring.flag-penalty", flagPenalty);

        if (fallbackAcceptance > primaryAcceptance) {
            throw invalid("classifier.cascade.fallback-acceptance (" + fallbackAcceptance
                    + ") must not exceed classifier.cascade.primary-acceptance (" + primaryAcceptance + ")");
        }
        if (retrievalTopK <= 0) {
            throw invalid("classifier.retrieval.top-k must be positive, got " + retrievalTopK);
        }
        if (shortDocumentWords <= 0 || longDocumentWords <= shortDocumentWords) {
            throw invalid("classifier.scoring.long-document-words must exceed short-document-words, both positive");
        }
        LOG.infof("Cascade thresholds: primary=%.2f, fallback=%.2f, topK=%d", primaryAcceptance, fallbackAcceptance,
                retrievalTopK);
    }

    @Produces
    @Singleton
    public ScoringWeights scoringWeights() {
        return new ScoringWeights(structureBonus, legalFormattingBonus, wordCountBonus, ocrPenalty, flagPenalty,
                longDocumentWords, shortDocumentWords);
    }

    @Produces
    @Singleton
    public CascadeThresholds cascadeThresholds() {
        return new CascadeThresholds(primaryAcceptance, fallbackAcceptance, retrievalTopK);
    }

    private static void requireUnit(String property, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw invalid(property + " must be between 0.0 and 1.0, got " + value);
        }
    }

    private static AiConfigurationException invalid(String message) {
        LOG.fatal(message);
        return new AiConfigurationException(message);
    }
}
