package villagecompute.classifier.util;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Whole-word keyword matching against lower-cased document text.
 *
 * <p>
 * A keyword matches when it appears in the text with no letter or digit directly before or after it, so
 * {@code "lease"} matches "the lease term" but not "release". Multi-word keywords match across any run of
 * whitespace.
 */
public final class KeywordMatcher {

    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    private KeywordMatcher() {
        // Utility class - prevent instantiation
    }

    /**
     * Lower-cases text for matching. Null becomes the empty string.
     */
    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    /**
     * Counts how many distinct keywords occur in already-normalized text.
     *
     * @param normalizedText
     *            output of {@link #normalize(String)}
     * @param keywords
     *            lower-case keywords
     * @return number of keywords found at least once
     */
    public static int countMatches(String normalizedText, List<String> keywords) {
        if (normalizedText.isEmpty() || keywords.isEmpty()) {
            return 0;
        }
        int matches = 0;
        for (String keyword : keywords) {
            if (!keyword.isEmpty() && patternFor(keyword).matcher(normalizedText).find()) {
                matches++;
            }
        }
        return matches;
    }

    /**
     * Fraction of keywords present in the text, in [0,1]. Zero for an empty keyword list.
     */
    public static double matchRatio(String normalizedText, List<String> keywords) {
        if (keywords.isEmpty()) {
            return 0.0;
        }
        return (double) countMatches(normalizedText, keywords) / keywords.size();
    }

    private static Pattern patternFor(String keyword) {
        return PATTERN_CACHE.computeIfAbsent(keyword, k -> {
            String body = Pattern.quote(k).replace(" ", "\\E\\s+\\Q");
            return Pattern.compile("(?<![\\p{L}\\p{N}])" + body + "(?![\\p{L}\\p{N}])");
        });
    }
}
