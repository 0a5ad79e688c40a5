/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.List;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.ExampleDocType;
import villagecompute.classifier.api.types.PastDocType;
import villagecompute.classifier.api.types.RetrievalContextType;
import villagecompute.classifier.api.types.ScoredMatchType;
import villagecompute.classifier.api.types.TaxonomyEntryType;
import villagecompute.classifier.api.types.TaxonomyKind;

/**
 * Builds the context-augmented prompts sent to the cascade's language models.
 *
 * <p>
 * <b>Primary prompt</b> (legal-domain model): 1,500-character excerpt, two nearest definitions, two nearest examples.
 * <br>
 * <b>Fallback prompt</b> (general-purpose model): 2,500-character excerpt, three nearest definitions, three nearest
 * examples and two similar past documents.
 *
 * <p>
 * Both list the complete taxonomy and require the answer format {@code Category: <x>; Type: <y>} followed by a
 * {@code Reasoning:} line, which {@link villagecompute.classifier.util.ClassificationResponseParser} understands.
 */
@ApplicationScoped
public class ClassificationPromptBuilder {

    static final int PRIMARY_EXCERPT_CHARS = 1500;
    static final int FALLBACK_EXCERPT_CHARS = 2500;
    static final int EXAMPLE_EXCERPT_CHARS = 200;
    static final int PAST_DOC_EXCERPT_CHARS = 200;
    static final int KEYWORDS_PER_DEFINITION = 8;

    @Inject
    TaxonomyRegistry taxonomyRegistry;

    /**
     * Prompt for the legal-domain primary model.
     */
    public String buildPrimaryPrompt(String text, RetrievalContextType context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("""
                You are a legal document classification specialist. Classify the legal document below into exactly one \
                category and one document type from the taxonomy.

                """);
        appendDefinitions(prompt, context.similarCategories(), 2);
        appendExamples(prompt, context.similarExamples(), 2);
        appendTaxonomy(prompt);
        appendDocument(prompt, text, PRIMARY_EXCERPT_CHARS);
        appendAnswerFormat(prompt);
        return prompt.toString();
    }

    /**
     * Prompt for the general-purpose fallback models.
     */
    public String buildFallbackPrompt(String text, RetrievalContextType context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("""
                You are an expert legal assistant. Classify the document below into exactly one category and one \
                document type. Use the reference definitions, examples and previously classified documents as \
                guidance, but judge the document on its own content.

                """);
        appendDefinitions(prompt, context.similarCategories(), 3);
        appendExamples(prompt, context.similarExamples(), 3);
        appendPastDocuments(prompt, context.similarDocuments(), 2);
        appendTaxonomy(prompt);
        appendDocument(prompt, text, FALLBACK_EXCERPT_CHARS);
        appendAnswerFormat(prompt);
        return prompt.toString();
    }

    private void appendDefinitions(StringBuilder prompt, List<ScoredMatchType<TaxonomyEntryType>> definitions,
            int limit) {
        if (definitions.isEmpty()) {
            return;
        }
        prompt.append("RELEVANT DEFINITIONS:\n");
        for (ScoredMatchType<TaxonomyEntryType> match : definitions.subList(0, Math.min(limit, definitions.size()))) {
            TaxonomyEntryType entry = match.item();
            List<String> keywords = entry.keywords().subList(0,
                    Math.min(KEYWORDS_PER_DEFINITION, entry.keywords().size()));
            prompt.append(String.format(Locale.ROOT, "- %s \"%s\" (similarity %.2f): %s Keywords: %s%n",
                    entry.kind() == TaxonomyKind.CATEGORY ? "Category" : "Document type", entry.name(), match.score(),
                    entry.description(), String.join(", ", keywords)));
        }
        prompt.append('\n');
    }

    private void appendExamples(StringBuilder prompt, List<ScoredMatchType<ExampleDocType>> examples, int limit) {
        if (examples.isEmpty()) {
            return;
        }
        prompt.append("EXAMPLES:\n");
        int index = 1;
        for (ScoredMatchType<ExampleDocType> match : examples.subList(0, Math.min(limit, examples.size()))) {
            ExampleDocType example = match.item();
            prompt.append(String.format(Locale.ROOT, """
                    Example %d:
                    Document: %s
                    Classification: Category: %s; Type: %s
                    Reasoning: %s

                    """, index++, truncate(example.text(), EXAMPLE_EXCERPT_CHARS), example.category(),
                    example.documentType(), example.reasoning()));
        }
    }

    private void appendPastDocuments(StringBuilder prompt, List<ScoredMatchType<PastDocType>> documents, int limit) {
        if (documents.isEmpty()) {
            return;
        }
        prompt.append("PREVIOUSLY CLASSIFIED SIMILAR DOCUMENTS:\n");
        for (ScoredMatchType<PastDocType> match : documents.subList(0, Math.min(limit, documents.size()))) {
            PastDocType doc = match.item();
            prompt.append(String.format(Locale.ROOT, "- %s -> Category: %s; Type: %s (confidence %s): %s%n",
                    doc.filename().isEmpty() ? "untitled" : doc.filename(), doc.documentCategory(),
                    doc.documentType(), doc.confidenceLevel(), truncate(doc.textExcerpt(), PAST_DOC_EXCERPT_CHARS)));
        }
        prompt.append('\n');
    }

    private void appendTaxonomy(StringBuilder prompt) {
        prompt.append("CATEGORIES:\n");
        taxonomyRegistry.categoryNames().forEach(name -> prompt.append("- ").append(name).append('\n'));
        prompt.append("\nDOCUMENT TYPES:\n");
        taxonomyRegistry.documentTypeNames().forEach(name -> prompt.append("- ").append(name).append('\n'));
        prompt.append('\n');
    }

    private void appendDocument(StringBuilder prompt, String text, int maxChars) {
        prompt.append("DOCUMENT TO CLASSIFY:\n");
        prompt.append(truncate(text == null ? "" : text, maxChars));
        prompt.append("\n\n");
    }

    private void appendAnswerFormat(StringBuilder prompt) {
        prompt.append("""
                Respond in exactly this format, using names copied verbatim from the lists above:
                Category: <category>; Type: <document type>
                Reasoning: <one sentence>
                """);
    }

    private static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, maxChars) + "...";
    }
}
