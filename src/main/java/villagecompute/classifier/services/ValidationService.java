/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.LabelScoreType;
import villagecompute.classifier.api.types.ValidatorOutcomeType;
import villagecompute.classifier.exceptions.ValidatorException;
import villagecompute.classifier.integration.validator.ZeroShotValidatorClient;

/**
 * Cross-checks a cascade answer with the zero-shot validator.
 *
 * <p>
 * The validator picks the best category from the full taxonomy and the best document type from the taxonomy's
 * representative subset. It only annotates agreement and never changes the cascade's labels. When the validator is
 * disabled or fails, the outcome is {@link ValidatorOutcomeType#unavailable(String)}.
 */
@ApplicationScoped
public class ValidationService {

    private static final Logger LOG = Logger.getLogger(ValidationService.class);

    static final int VALIDATION_CHARS = 1000;

    @ConfigProperty(
            name = "classifier.validator.enabled",
            defaultValue = "true")
    boolean enabled;

    @Inject
    ZeroShotValidatorClient validatorClient;

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    /**
     * Validates a (category, document type) answer against the document text.
     *
     * @param text
     *            document text; only the first 1,000 characters are sent
     * @param category
     *            category chosen by the cascade
     * @param documentType
     *            document type chosen by the cascade
     * @return agreement annotation, never null
     */
    public ValidatorOutcomeType validate(String text, String category, String documentType) {
        if (!enabled) {
            return ValidatorOutcomeType.unavailable("Validator disabled");
        }
        if (text == null || text.isBlank()) {
            return ValidatorOutcomeType.unavailable("No text to validate");
        }

        String excerpt = SimilarityIndexService.prefix(text, VALIDATION_CHARS);
        try {
            List<LabelScoreType> categories = validatorClient.classify(excerpt, taxonomyRegistry.categoryNames());
            List<LabelScoreType> types = validatorClient.classify(excerpt, taxonomyRegistry.validatorDocumentTypes());

            LabelScoreType topCategory = categories.get(0);
            LabelScoreType topType = types.get(0);
            boolean categoryMatch = topCategory.label().equals(category);
            boolean docTypeMatch = topType.label().equals(documentType);
            double overall = (topCategory.score() + topType.score()) / 2.0;

            if (!categoryMatch) {
                LOG.infof("Validator disagrees on category: cascade=%s, validator=%s (%.2f)", category,
                        topCategory.label(), topCategory.score());
            }
            return new ValidatorOutcomeType(true, topCategory.label(), topType.label(), topCategory.score(),
                    topType.score(), categoryMatch, docTypeMatch, overall, null);

        } catch (ValidatorException e) {
            LOG.warnf("Validator unavailable: %s", e.getMessage());
            return ValidatorOutcomeType.unavailable(e.getMessage());
        }
    }
}
