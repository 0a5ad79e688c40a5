package villagecompute.classifier.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.classifier.api.types.ExampleDocType;
import villagecompute.classifier.api.types.InconsistencyRuleType;
import villagecompute.classifier.api.types.TaxonomyDefinitionType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.api.types.TaxonomyKind;
import villagecompute.classifier.exceptions.TaxonomyLoadException;

/**
 * Reads and validates the taxonomy and curated example JSON resources.
 *
 * <p>
 * Validation rejects:
 * <ul>
 * <li>missing or duplicate entry names within a kind</li>
 * <li>a default category or document type that is not defined</li>
 * <li>fallback categories, inconsistency rules or validator labels naming undefined entries</li>
 * <li>pattern rules that are not valid regular expressions</li>
 * <li>examples whose category or document type is not defined</li>
 * </ul>
 */
public final class TaxonomyLoader {

    private static final Logger LOG = Logger.getLogger(TaxonomyLoader.class);

    private TaxonomyLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads a taxonomy resource from the classpath.
     *
     * @param resource
     *            classpath resource path, e.g. {@code taxonomy/legal-taxonomy.json}
     * @param objectMapper
     *            JSON mapper
     * @return validated taxonomy definition
     * @throws TaxonomyLoadException
     *             if the resource is missing, unreadable or invalid
     */
    public static TaxonomyDefinitionType loadTaxonomy(String resource, ObjectMapper objectMapper) {
        try (InputStream in = open(resource)) {
            TaxonomyDefinitionType definition = parseTaxonomy(objectMapper.readTree(in));
            LOG.infof("Loaded taxonomy %s: %d categories, %d document types", resource,
                    definition.categories().size(), definition.documentTypes().size());
            return definition;
        } catch (IOException e) {
            throw new TaxonomyLoadException("Failed to read taxonomy resource " + resource, e);
        }
    }

    /**
     * Loads curated examples from the classpath and checks them against the taxonomy.
     */
    public static List<ExampleDocType> loadExamples(String resource, ObjectMapper objectMapper,
            TaxonomyDefinitionType taxonomy) {
        try (InputStream in = open(resource)) {
            JsonNode root = objectMapper.readTree(in);
            if (root == null || !root.isArray()) {
                throw new TaxonomyLoadException("Example resource " + resource + " must contain a JSON array");
            }
            Set<String> categories = names(taxonomy.categories());
            Set<String> types = names(taxonomy.documentTypes());
            List<ExampleDocType> examples = new ArrayList<>();
            for (JsonNode node : root) {
                ExampleDocType example = new ExampleDocType(text(node, "id"), text(node, "text"),
                        text(node, "category"), text(node, "documentType"), text(node, "reasoning"));
                if (example.id().isBlank() || example.text().isBlank()) {
                    throw new TaxonomyLoadException("Example in " + resource + " is missing id or text");
                }
                if (!categories.contains(example.category()) || !types.contains(example.documentType())) {
                    throw new TaxonomyLoadException("Example " + example.id() + " uses labels outside the taxonomy: "
                            + example.category() + " / " + example.documentType());
                }
                examples.add(example);
            }
            return examples;
        } catch (IOException e) {
            throw new TaxonomyLoadException("Failed to read example resource " + resource, e);
        }
    }

    /**
     * Parses and validates a taxonomy document.
     */
    public static TaxonomyDefinitionType parseTaxonomy(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new TaxonomyLoadException("Taxonomy must be a JSON object");
        }
        List<TaxonomyEntryType> categories = parseEntries(root.get("categories"), TaxonomyKind.CATEGORY);
        List<TaxonomyEntryType> documentTypes = parseEntries(root.get("documentTypes"), TaxonomyKind.DOCUMENT_TYPE);

        List<InconsistencyRuleType> inconsistencies = new ArrayList<>();
        JsonNode rules = root.get("inconsistencies");
        if (rules != null) {
            for (JsonNode rule : rules) {
                inconsistencies.add(new InconsistencyRuleType(text(rule, "documentType"), text(rule, "category"),
                        text(rule, "message")));
            }
        }

        TaxonomyDefinitionType definition = new TaxonomyDefinitionType(text(root, "defaultCategory"),
                text(root, "defaultDocumentType"), categories, documentTypes, inconsistencies,
                strings(root.get("validatorDocumentTypes")));
        validate(definition);
        return definition;
    }

    private static List<TaxonomyEntryType> parseEntries(JsonNode array, TaxonomyKind kind) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            throw new TaxonomyLoadException("Taxonomy must define at least one " + kind.name().toLowerCase());
        }
        List<TaxonomyEntryType> entries = new ArrayList<>();
        for (JsonNode node : array) {
            String fallback = text(node, "fallbackCategory");
            entries.add(new TaxonomyEntryType(text(node, "name"), kind, text(node, "description"),
                    strings(node.get("keywords")), new LinkedHashSet<>(strings(node.get("exampleDocumentTypes"))),
                    strings(node.get("textPatterns")), strings(node.get("filenameHints")),
                    fallback.isBlank() ? null : fallback, null));
        }
        return entries;
    }

    private static void validate(TaxonomyDefinitionType definition) {
        Set<String> categories = uniqueNames(definition.categories(), TaxonomyKind.CATEGORY);
        Set<String> types = uniqueNames(definition.documentTypes(), TaxonomyKind.DOCUMENT_TYPE);

        if (!categories.contains(definition.defaultCategory())) {
            throw new TaxonomyLoadException("Default category '" + definition.defaultCategory() + "' is not defined");
        }
        if (!types.contains(definition.defaultDocumentType())) {
            throw new TaxonomyLoadException(
                    "Default document type '" + definition.defaultDocumentType() + "' is not defined");
        }
        for (TaxonomyEntryType type : definition.documentTypes()) {
            if (type.fallbackCategory() != null && !categories.contains(type.fallbackCategory())) {
                throw new TaxonomyLoadException("Document type '" + type.name() + "' falls back to undefined category '"
                        + type.fallbackCategory() + "'");
            }
        }
        for (InconsistencyRuleType rule : definition.inconsistencies()) {
            if (!types.contains(rule.documentType()) || !categories.contains(rule.category())) {
                throw new TaxonomyLoadException("Inconsistency rule references undefined labels: "
                        + rule.documentType() + " / " + rule.category());
            }
        }
        for (String label : definition.validatorDocumentTypes()) {
            if (!types.contains(label)) {
                throw new TaxonomyLoadException("Validator document type '" + label + "' is not defined");
            }
        }
        List<TaxonomyEntryType> all = new ArrayList<>(definition.categories());
        all.addAll(definition.documentTypes());
        for (TaxonomyEntryType entry : all) {
            List<String> regexes = new ArrayList<>(entry.textPatterns());
            regexes.addAll(entry.filenameHints());
            for (String regex : regexes) {
                try {
                    Pattern.compile(regex);
                } catch (PatternSyntaxException e) {
                    throw new TaxonomyLoadException("Invalid pattern rule for '" + entry.name() + "': " + regex, e);
                }
            }
        }
    }

    private static Set<String> uniqueNames(List<TaxonomyEntryType> entries, TaxonomyKind kind) {
        Set<String> seen = new HashSet<>();
        for (TaxonomyEntryType entry : entries) {
            if (entry.name() == null || entry.name().isBlank()) {
                throw new TaxonomyLoadException("Taxonomy " + kind.name().toLowerCase() + " without a name");
            }
            if (!seen.add(entry.name())) {
                throw new TaxonomyLoadException(
                        "Duplicate taxonomy " + kind.name().toLowerCase() + ": " + entry.name());
            }
        }
        return seen;
    }

    private static Set<String> names(List<TaxonomyEntryType> entries) {
        Set<String> names = new HashSet<>();
        entries.forEach(e -> names.add(e.name()));
        return names;
    }

    private static InputStream open(String resource) {
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            in = TaxonomyLoader.class.getClassLoader().getResourceAsStream(resource);
        }
        if (in == null) {
            throw new TaxonomyLoadException("Resource not found on classpath: " + resource);
        }
        return in;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(v -> values.add(v.asText()));
        }
        return values;
    }
}
