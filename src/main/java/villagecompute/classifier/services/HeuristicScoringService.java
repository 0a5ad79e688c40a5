/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.AlternativeClassificationType;
import villagecompute.classifier.api.types.HeuristicScoreType;
import villagecompute.classifier.api.types.InconsistencyRuleType;
import villagecompute.classifier.api.types.QualityMetricsType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.config.ScoringWeights;
import villagecompute.classifier.util.KeywordMatcher;

/**
 * Model-free confidence signals computed directly from document text.
 *
 * <p>
 * <b>Keyword confidence:</b> two sub-scores, one against the category's keyword list and one against the document
 * type's, each {@code min(matches / (keywords * 0.3), 1.0)}, averaged. Matching 30% of a keyword list saturates its
 * sub-score.
 *
 * <p>
 * <b>Quality signals:</b>
 * <ul>
 * <li>structure - upper-case section headers (WHEREAS, ARTICLE, SECTION, EXHIBIT), numbered lines, lettered
 * subsections</li>
 * <li>legal formatting - court captions, case numbers, "Plaintiff ... v." captions, dated signature lines</li>
 * <li>OCR damage - symbol runs of three or more, a majority of one- and two-letter tokens, or repeated 1/l/I and 0/o
 * glyph confusion</li>
 * </ul>
 *
 * <p>
 * <b>Uncertainty flags</b> accumulate independently: short document, OCR damage, more than two categories with
 * keyword hits, hedging language in the model answer, and known type/category mismatches.
 *
 * <p>
 * Stateless and thread-safe. Never calls a model; empty text is valid input.
 */
@ApplicationScoped
public class HeuristicScoringService {

    private static final Logger LOG = Logger.getLogger(HeuristicScoringService.class);

    public static final String FLAG_TOO_SHORT = "Document too short for reliable classification";
    public static final String FLAG_OCR_ISSUES = "Possible OCR issues detected in extracted text";
    public static final String FLAG_MIXED_CATEGORIES = "Document contains mixed category indicators";
    public static final String FLAG_MODEL_HEDGING = "Model expressed uncertainty in classification";

    static final double KEYWORD_SATURATION = 0.3;
    static final double ALTERNATIVE_MIN_RATIO = 0.10;
    static final int MAX_ALTERNATIVES = 2;
    static final int MIXED_CATEGORY_LIMIT = 2;

    private static final List<Pattern> STRUCTURE_PATTERNS = List.of(
            Pattern.compile(
                    "\\b(WHEREAS|NOW,?\\s+THEREFORE|ARTICLE\\s+[IVXLC\\d]+|SECTION\\s+\\d+|EXHIBIT\\s+[A-Z\\d]+)\\b"),
            Pattern.compile("(?m)^\\s*\\d+(\\.\\d+)*\\.\\s+[A-Z]"),
            Pattern.compile("\\((?:[a-z]|[ivx]{1,4})\\)\\s+\\S"));

    private static final List<Pattern> LEGAL_FORMATTING_PATTERNS = List.of(
            Pattern.compile("\\bIN THE\\b.{0,100}\\bCOURT\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCase\\s+No\\.", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bPlaintiffs?\\b.{0,200}\\bv(s)?\\.", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\\bDated:?\\s*\\w+\\s+\\d{1,2},\\s*\\d{4}", Pattern.CASE_INSENSITIVE));

    private static final Pattern SYMBOL_RUN = Pattern.compile("[^\\w\\s]{3,}");
    private static final String PROSE_PUNCTUATION = ".,;:!?'\"()[]-\u2013\u2014\u2018\u2019\u201c\u201d\u00a7$%/&";
    private static final Pattern GLYPH_CONFUSION = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:[Il|]*(?:[Il|]1|1[Il|])[Il1|]*|\\p{Ll}+[01]\\p{Ll}+)(?![\\p{L}\\p{N}])");
    private static final double SHORT_TOKEN_DENSITY_LIMIT = 0.5;
    private static final int SHORT_TOKEN_MIN_TOKENS = 10;

    private static final List<String> HEDGING_PHRASES = List.of("appears to be", "seems like", "seems to be",
            "possibly", "likely", "unclear", "difficult to determine", "uncertain", "ambiguous", "could be",
            "not sure");

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    @Inject
    ScoringWeights weights;

    /**
     * Scores an answer with no model reasoning attached.
     */
    public HeuristicScoreType score(String text, String category, String documentType) {
        return score(text, category, documentType, "");
    }

    /**
     * Scores a (category, document type) answer against the document text.
     *
     * @param text
     *            document text, may be empty
     * @param category
     *            chosen category, or null when the answer named none
     * @param documentType
     *            chosen document type, or null when the answer named none
     * @param modelResponse
     *            free text of the model that produced the answer, checked for hedging
     * @return keyword confidence, quality metrics and uncertainty flags
     */
    public HeuristicScoreType score(String text, String category, String documentType, String modelResponse) {
        String normalized = KeywordMatcher.normalize(text);
        QualityMetricsType quality = analyzeQuality(text);
        double keywordConfidence = keywordConfidence(normalized, category, documentType);
        Set<String> flags = uncertaintyFlags(normalized, quality, category, documentType, modelResponse);

        LOG.debugf("Heuristic score for %s/%s: keywords=%.2f, words=%d, flags=%d", category, documentType,
                keywordConfidence, quality.wordCount(), flags.size());
        return new HeuristicScoreType(keywordConfidence, quality, flags);
    }

    /**
     * Combines keyword confidence with the quality bonuses and penalties into a score in [0,1].
     */
    public double overallConfidence(HeuristicScoreType heuristic) {
        QualityMetricsType quality = heuristic.qualityMetrics();
        double score = heuristic.keywordConfidence();
        if (quality.hasStructure()) {
            score += weights.structureBonus();
        }
        if (quality.hasLegalFormatting()) {
            score += weights.legalFormattingBonus();
        }
        if (quality.wordCount() > weights.longDocumentWords()) {
            score += weights.wordCountBonus();
        }
        if (quality.ocrQualityIssues()) {
            score -= weights.ocrPenalty();
        }
        score -= weights.flagPenalty() * heuristic.uncertaintyFlags().size();
        return clamp(score);
    }

    /**
     * Average of the category and document-type keyword sub-scores.
     *
     * @param normalizedText
     *            lower-cased document text
     */
    public double keywordConfidence(String normalizedText, String category, String documentType) {
        double categoryScore = taxonomyRegistry.category(category).map(e -> keywordSubScore(normalizedText, e))
                .orElse(0.0);
        double typeScore = taxonomyRegistry.documentType(documentType).map(e -> keywordSubScore(normalizedText, e))
                .orElse(0.0);
        return (categoryScore + typeScore) / 2.0;
    }

    static double keywordSubScore(String normalizedText, TaxonomyEntryType entry) {
        if (entry.keywords().isEmpty()) {
            return 0.0;
        }
        int matches = KeywordMatcher.countMatches(normalizedText, entry.keywords());
        return Math.min(matches / (entry.keywords().size() * KEYWORD_SATURATION), 1.0);
    }

    /**
     * Derives text-quality signals. Null is treated as empty text.
     */
    public QualityMetricsType analyzeQuality(String text) {
        String safe = text == null ? "" : text;
        String trimmed = safe.trim();
        int wordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        boolean hasStructure = STRUCTURE_PATTERNS.stream().anyMatch(p -> p.matcher(safe).find());
        boolean hasLegalFormatting = LEGAL_FORMATTING_PATTERNS.stream().anyMatch(p -> p.matcher(safe).find());
        boolean ocrIssues = hasSymbolRuns(safe) || hasShortTokenDensity(trimmed) || hasGlyphConfusion(safe);

        return new QualityMetricsType(wordCount, hasStructure, hasLegalFormatting, ocrIssues);
    }

    private Set<String> uncertaintyFlags(String normalizedText, QualityMetricsType quality, String category,
            String documentType, String modelResponse) {
        Set<String> flags = new LinkedHashSet<>();

        if (quality.wordCount() < weights.shortDocumentWords()) {
            flags.add(FLAG_TOO_SHORT);
        }
        if (quality.ocrQualityIssues()) {
            flags.add(FLAG_OCR_ISSUES);
        }

        long categoriesWithHits = taxonomyRegistry.categories().stream()
                .filter(c -> KeywordMatcher.countMatches(normalizedText, c.keywords()) > 0).count();
        if (categoriesWithHits > MIXED_CATEGORY_LIMIT) {
            flags.add(FLAG_MIXED_CATEGORIES);
        }

        if (containsHedging(modelResponse)) {
            flags.add(FLAG_MODEL_HEDGING);
        }

        inconsistency(category, documentType).ifPresent(rule -> flags.add(rule.message()));
        return flags;
    }

    /**
     * Known mismatch rule for the pair, if any.
     */
    public Optional<InconsistencyRuleType> inconsistency(String category, String documentType) {
        if (category == null || documentType == null) {
            return Optional.empty();
        }
        return taxonomyRegistry.inconsistencies().stream().filter(r -> r.matches(documentType, category))
                .findFirst();
    }

    /**
     * Whether a model's free text contains hedging language.
     */
    public boolean containsHedging(String modelResponse) {
        String normalized = KeywordMatcher.normalize(modelResponse);
        return KeywordMatcher.countMatches(normalized, HEDGING_PHRASES) > 0;
    }

    /**
     * Ranks every category other than the chosen one by keyword-match ratio and keeps the top two above 0.10.
     *
     * @param text
     *            document text
     * @param chosenCategory
     *            category excluded from the ranking
     * @return alternatives, highest ratio first; ties keep taxonomy order
     */
    public List<AlternativeClassificationType> alternatives(String text, String chosenCategory) {
        String normalized = KeywordMatcher.normalize(text);
        List<AlternativeClassificationType> ranked = new ArrayList<>();
        for (TaxonomyEntryType category : taxonomyRegistry.categories()) {
            if (category.name().equals(chosenCategory)) {
                continue;
            }
            double ratio = KeywordMatcher.matchRatio(normalized, category.keywords());
            if (ratio > ALTERNATIVE_MIN_RATIO) {
                ranked.add(new AlternativeClassificationType(category.name(), ratio, String.format(Locale.ROOT,
                        "Contains %.0f%% of %s keywords", ratio * 100, category.name())));
            }
        }
        ranked.sort(Comparator.comparingDouble(AlternativeClassificationType::score).reversed());
        return ranked.size() > MAX_ALTERNATIVES ? List.copyOf(ranked.subList(0, MAX_ALTERNATIVES)) : ranked;
    }

    private static boolean hasSymbolRuns(String text) {
        Matcher matcher = SYMBOL_RUN.matcher(text);
        while (matcher.find()) {
            // closing quotes, brackets and ellipses are ordinary prose
            long noise = matcher.group().chars().filter(c -> PROSE_PUNCTUATION.indexOf(c) < 0).count();
            if (noise >= 2) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasShortTokenDensity(String trimmed) {
        if (trimmed.isEmpty()) {
            return false;
        }
        int alphabetic = 0;
        int shortTokens = 0;
        for (String token : trimmed.split("\\s+")) {
            String letters = token.replaceAll("[^\\p{L}]", "");
            if (letters.isEmpty()) {
                continue;
            }
            alphabetic++;
            if (letters.length() <= 2) {
                shortTokens++;
            }
        }
        return alphabetic >= SHORT_TOKEN_MIN_TOKENS && (double) shortTokens / alphabetic > SHORT_TOKEN_DENSITY_LIMIT;
    }

    private static boolean hasGlyphConfusion(String text) {
        Matcher matcher = GLYPH_CONFUSION.matcher(text);
        int hits = 0;
        while (matcher.find()) {
            hits++;
            if (hits >= 2) {
                return true;
            }
        }
        return false;
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
