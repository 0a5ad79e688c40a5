package villagecompute.classifier.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import villagecompute.classifier.api.types.ParsedClassificationType;

/**
 * Recovers {@code (category, document type)} from a language model's free-text answer.
 *
 * <p>
 * Models are asked to answer {@code Category: <x>; Type: <y>} followed by {@code Reasoning: <text>}. Answers drift
 * from that format in practice, so the parser:
 * <ul>
 * <li>scans every {@code Category:} and {@code Type:} occurrence (keys are case-sensitive) and keeps the first value
 * that maps onto the vocabulary</li>
 * <li>cuts a value at {@code ;}, a line break, or the next {@code Key:} on the same line</li>
 * <li>strips markdown emphasis, quotes, brackets and a trailing period before comparing</li>
 * <li>accepts a value that starts with a vocabulary label followed by a non-alphanumeric character (longest label
 * wins), e.g. {@code "Court Filing - motion to compel"}</li>
 * </ul>
 * Values that cannot be mapped fall back to the supplied defaults with the corresponding matched flag cleared. The
 * parser never throws.
 */
public final class ClassificationResponseParser {

    private static final Pattern CATEGORY_KEY = Pattern.compile("(?<![A-Za-z])Category\\s*:\\s*([^;\\r\\n]*)");
    private static final Pattern TYPE_KEY = Pattern.compile("(?<![A-Za-z])Type\\s*:\\s*([^;\\r\\n]*)");
    private static final Pattern REASONING_KEY = Pattern.compile("(?<![A-Za-z])Reasoning\\s*:\\s*(.*)",
            Pattern.DOTALL);
    private static final Pattern NEXT_KEY = Pattern
            .compile("\\s+(?:Document\\s+)?(?:Category|Type|Reasoning|Confidence)\\s*:.*$");
    private static final Pattern CLASSIFICATION_LINE = Pattern.compile("(?m)^.*(?:Category|Type)\\s*:.*$");

    private static final int MAX_REASONING_LENGTH = 1000;

    private ClassificationResponseParser() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses a model answer.
     *
     * @param response
     *            raw model output, may be null
     * @param categories
     *            category vocabulary
     * @param documentTypes
     *            document type vocabulary
     * @param defaultCategory
     *            category used when none can be mapped
     * @param defaultDocumentType
     *            document type used when none can be mapped
     * @return parsed classification, never null
     */
    public static ParsedClassificationType parse(String response, Collection<String> categories,
            Collection<String> documentTypes, String defaultCategory, String defaultDocumentType) {
        String text = response == null ? "" : response.replace("**", "").replace("__", "");

        String category = findLabel(text, CATEGORY_KEY, categories);
        String documentType = findLabel(text, TYPE_KEY, documentTypes);

        return new ParsedClassificationType(category != null ? category : defaultCategory,
                documentType != null ? documentType : defaultDocumentType, extractReasoning(text), category != null,
                documentType != null);
    }

    private static String findLabel(String text, Pattern key, Collection<String> vocabulary) {
        Matcher matcher = key.matcher(text);
        while (matcher.find()) {
            String label = mapToVocabulary(matcher.group(1), vocabulary);
            if (label != null) {
                return label;
            }
        }
        return null;
    }

    static String mapToVocabulary(String rawValue, Collection<String> vocabulary) {
        String value = NEXT_KEY.matcher(rawValue).replaceFirst("");
        value = clean(value);
        if (value.isEmpty()) {
            return null;
        }
        if (vocabulary.contains(value)) {
            return value;
        }

        List<String> labels = new ArrayList<>(vocabulary);
        labels.sort(Comparator.comparingInt(String::length).reversed());
        for (String label : labels) {
            if (label.isEmpty() || !value.startsWith(label)) {
                continue;
            }
            if (value.length() == label.length() || !Character.isLetterOrDigit(value.charAt(label.length()))) {
                return label;
            }
        }
        return null;
    }

    private static String clean(String value) {
        String cleaned = value.trim();
        boolean changed = true;
        while (changed && !cleaned.isEmpty()) {
            changed = false;
            char first = cleaned.charAt(0);
            if (first == '"' || first == '\'' || first == '[' || first == '(' || first == '`' || first == '*') {
                cleaned = cleaned.substring(1).trim();
                changed = true;
                continue;
            }
            char last = cleaned.charAt(cleaned.length() - 1);
            if (last == '"' || last == '\'' || last == ']' || last == ')' || last == '`' || last == '*'
                    || last == ',') {
                cleaned = cleaned.substring(0, cleaned.length() - 1).trim();
                changed = true;
            }
        }
        return cleaned;
    }

    private static String extractReasoning(String text) {
        Matcher matcher = REASONING_KEY.matcher(text);
        String reasoning;
        if (matcher.find()) {
            reasoning = matcher.group(1);
        } else {
            reasoning = CLASSIFICATION_LINE.matcher(text).replaceAll("");
        }
        reasoning = reasoning.trim().replaceAll("\\s+", " ");
        if (reasoning.length() > MAX_REASONING_LENGTH) {
            reasoning = reasoning.substring(0, MAX_REASONING_LENGTH);
        }
        return reasoning;
    }
}
