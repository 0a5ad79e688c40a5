/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.ConfidenceLevel;
import villagecompute.classifier.api.types.ModelUsed;
import villagecompute.classifier.api.types.RawClassificationType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.api.types.TaxonomyKind;

/**
 * Rule-based classifier used as the cascade's unconditional floor.
 *
 * <p>
 * Document type is decided first, then category. Rules come from the taxonomy entries' {@code textPatterns} and
 * {@code filenameHints}, evaluated in taxonomy order so earlier entries outrank later ones (sworn-statement markers
 * outrank generic form markers). Filename hints are consulted only when no entry's text patterns match.
 *
 * <p>
 * <b>Category resolution:</b> text patterns, then filename hints, then the document type's fallback category, then
 * the taxonomy default.
 *
 * <p>
 * <b>Points</b> (each rule group counts once):
 * <ul>
 * <li>+1 type matched by text; +1 more if two or more of its text patterns matched</li>
 * <li>+2 filename hint corroborates a text-matched type</li>
 * <li>+1 type matched by filename only</li>
 * <li>+1 category matched by text; +1 more if two or more of its text patterns matched</li>
 * <li>+1 filename hint corroborates a text-matched category</li>
 * </ul>
 * Labels: High at 4 or more points, Medium at 2 or more, otherwise Low.
 *
 * <p>
 * Pure and thread-safe. Never fails for any text or filename, including null.
 */
@ApplicationScoped
public class PatternClassificationService {

    private static final Logger LOG = Logger.getLogger(PatternClassificationService.class);

    static final int HIGH_POINTS = 4;
    static final int MEDIUM_POINTS = 2;

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    /**
     * Classifies by rules alone.
     *
     * @param text
     *            document text, may be null
     * @param filename
     *            source filename, may be null
     * @param modelUsed
     *            {@link ModelUsed#PATTERN_BASED} or {@link ModelUsed#EMERGENCY}
     * @return classification with a discrete stage confidence
     */
    public RawClassificationType classify(String text, String filename, ModelUsed modelUsed) {
        String safeText = text == null ? "" : text;
        String safeName = filename == null ? "" : filename;

        RuleMatch type = match(taxonomyRegistry.documentTypes(), safeText, safeName);
        RuleMatch category = match(taxonomyRegistry.categories(), safeText, safeName);

        String documentType = type.entry != null ? type.entry.name() : taxonomyRegistry.defaultDocumentType();
        String categoryName;
        String categorySource;
        if (category.entry != null) {
            categoryName = category.entry.name();
            categorySource = category.fromText ? "text patterns" : "filename hint";
        } else if (type.entry != null && type.entry.fallbackCategory() != null) {
            categoryName = type.entry.fallbackCategory();
            categorySource = "document type default";
        } else {
            categoryName = taxonomyRegistry.defaultCategory();
            categorySource = "taxonomy default";
        }

        int points = points(type) + points(category);
        ConfidenceLevel level = points >= HIGH_POINTS ? ConfidenceLevel.HIGH
                : points >= MEDIUM_POINTS ? ConfidenceLevel.MEDIUM : ConfidenceLevel.LOW;

        String reasoning = String.format("Pattern-based classification: type '%s' from %s, category '%s' from %s "
                + "(%d rule points)", documentType, describe(type), categoryName, categorySource, points);
        LOG.debugf("%s", reasoning);

        return new RawClassificationType(categoryName, documentType, level.getLowerBound(), modelUsed, "", reasoning,
                level);
    }

    private static int points(RuleMatch match) {
        if (match.entry == null) {
            return 0;
        }
        if (!match.fromText) {
            return 1;
        }
        int points = 1;
        if (match.textSignals >= 2) {
            points++;
        }
        if (match.filenameCorroborates) {
            points += match.entry.kind() == TaxonomyKind.DOCUMENT_TYPE ? 2 : 1;
        }
        return points;
    }

    private static String describe(RuleMatch type) {
        if (type.entry == null) {
            return "taxonomy default";
        }
        return type.fromText ? type.textSignals + " text signal(s)" : "filename hint";
    }

    private static RuleMatch match(List<TaxonomyEntryType> entries, String text, String filename) {
        for (TaxonomyEntryType entry : entries) {
            int signals = countMatches(entry.textPatterns(), text);
            if (signals > 0) {
                return new RuleMatch(entry, true, signals, countMatches(entry.filenameHints(), filename) > 0);
            }
        }
        if (!filename.isBlank()) {
            for (TaxonomyEntryType entry : entries) {
                if (countMatches(entry.filenameHints(), filename) > 0) {
                    return new RuleMatch(entry, false, 0, true);
                }
            }
        }
        return new RuleMatch(null, false, 0, false);
    }

    private static int countMatches(List<String> regexes, String value) {
        if (value.isEmpty() || regexes.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (String regex : regexes) {
            if (compiled(regex).matcher(value).find()) {
                count++;
            }
        }
        return count;
    }

    private static Pattern compiled(String regex) {
        return PATTERN_CACHE.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }

    /**
     * First matching rule entry and how it matched.
     */
    private static final class RuleMatch {

        private final TaxonomyEntryType entry;
        private final boolean fromText;
        private final int textSignals;
        private final boolean filenameCorroborates;

        private RuleMatch(TaxonomyEntryType entry, boolean fromText, int textSignals, boolean filenameCorroborates) {
            this.entry = entry;
            this.fromText = fromText;
            this.textSignals = textSignals;
            this.filenameCorroborates = filenameCorroborates;
        }
    }
}
