package villagecompute.classifier.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import villagecompute.classifier.api.types.ParsedClassificationType;

/**
 * Unit tests for {@link ClassificationResponseParser}.
 *
 * <p>
 * The fixture table covers the answer shapes seen from the legal and general-purpose models. The fuzz test pins the
 * guarantee that parsing never throws and never yields a label outside the vocabulary.
 */
class ClassificationResponseParserTest {

    private static final List<String> CATEGORIES = List.of("Immigration", "Criminal", "Intellectual Property",
            "Employment", "Real Estate", "Litigation", "Corporate", "Contract", "General Legal");

    private static final List<String> TYPES = List.of("Affidavit/Declaration", "Court Order/Judgment", "Court Filing",
            "Official Form/Application", "Employment Agreement", "Patent License", "Contract", "Legal Memo",
            "Financial Document", "Medical Record", "ID or Civil Document", "Correspondence",
            "Misc. Reference Material");

    private static final String DEFAULT_CATEGORY = "General Legal";
    private static final String DEFAULT_TYPE = "Misc. Reference Material";

    private static ParsedClassificationType parse(String response) {
        return ClassificationResponseParser.parse(response, CATEGORIES, TYPES, DEFAULT_CATEGORY, DEFAULT_TYPE);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', textBlock = """
            Category: Contract; Type: Contract                              | Contract              | Contract
            Category: Litigation; Type: Court Filing                        | Litigation            | Court Filing
            **Category:** Employment; **Type:** Employment Agreement        | Employment            | Employment Agreement
            Category: "Immigration"; Type: [Official Form/Application]      | Immigration           | Official Form/Application
            Category: Intellectual Property, Type: Patent License           | Intellectual Property | Patent License
            Category: Real Estate (lease dispute); Type: Correspondence     | Real Estate           | Correspondence
            Category: Criminal Type: Court Order/Judgment                   | Criminal              | Court Order/Judgment
            Document Category: Corporate; Document Type: Legal Memo         | Corporate             | Legal Memo
            Category: Tax Law; Type: Contract                               | General Legal         | Contract
            category: contract; type: contract                              | General Legal         | Misc. Reference Material
            I think this is a contract.                                     | General Legal         | Misc. Reference Material
            """)
    void testParse_fixtureTable(String response, String expectedCategory, String expectedType) {
        ParsedClassificationType parsed = parse(response);

        assertEquals(expectedCategory, parsed.category(), "category for: " + response);
        assertEquals(expectedType, parsed.documentType(), "type for: " + response);
    }

    @Test
    void testParse_multiLineAnswerWithReasoning() {
        ParsedClassificationType parsed = parse("""
                Category: Litigation; Type: Affidavit/Declaration
                Reasoning: Sworn statement submitted in support of a pending motion.
                """);

        assertTrue(parsed.fullyMatched());
        assertEquals("Sworn statement submitted in support of a pending motion.", parsed.reasoning());
    }

    @Test
    void testParse_reasoningFallsBackToRemainingText() {
        ParsedClassificationType parsed = parse("""
                The document is a lease between a landlord and tenant.
                Category: Real Estate; Type: Contract
                """);

        assertEquals("Real Estate", parsed.category());
        assertEquals("The document is a lease between a landlord and tenant.", parsed.reasoning());
    }

    @Test
    void testParse_unmappedValuesClearMatchedFlags() {
        ParsedClassificationType parsed = parse("Category: Maritime; Type: Bill of Lading");

        assertFalse(parsed.categoryMatched());
        assertFalse(parsed.documentTypeMatched());
        assertEquals(DEFAULT_CATEGORY, parsed.category());
        assertEquals(DEFAULT_TYPE, parsed.documentType());
    }

    @Test
    void testParse_laterKeyUsedWhenFirstIsUnmappable() {
        ParsedClassificationType parsed = parse("""
                Category: <category>; Type: <document type>
                Category: Corporate; Type: Legal Memo
                """);

        assertEquals("Corporate", parsed.category());
        assertEquals("Legal Memo", parsed.documentType());
    }

    @Test
    void testParse_nullAndBlank() {
        assertEquals(DEFAULT_CATEGORY, parse(null).category());
        assertEquals(DEFAULT_TYPE, parse("   ").documentType());
        assertEquals("", parse(null).reasoning());
    }

    @Test
    void testMapToVocabulary_prefersLongestLabel() {
        List<String> vocabulary = List.of("Contract", "Contract Amendment");

        assertEquals("Contract Amendment", ClassificationResponseParser.mapToVocabulary("Contract Amendment",
                vocabulary));
        assertEquals("Contract", ClassificationResponseParser.mapToVocabulary("Contract - supply", vocabulary));
        assertNull(ClassificationResponseParser.mapToVocabulary("Contractual", vocabulary));
    }

    @Test
    void testParse_fuzzNeverThrowsOrLeavesVocabulary() {
        Random random = new Random(20240611L);
        String[] fragments = { "Category:", "Type:", "Reasoning:", ";", "\n", "**", "\"", "[", ")", " ",
                "Contract", "Litigation", "Court Filing", "Immigration", "Misc.", "Type", "Category", ":", ",", "é",
                "\t", "Legal Memo", "Real", "Estate", "<", ">", "Document " };

        for (int i = 0; i < 2000; i++) {
            StringBuilder response = new StringBuilder();
            int parts = random.nextInt(20);
            for (int p = 0; p < parts; p++) {
                if (random.nextInt(4) == 0) {
                    response.append((char) (32 + random.nextInt(95)));
                } else {
                    response.append(fragments[random.nextInt(fragments.length)]);
                }
            }

            ParsedClassificationType parsed = parse(response.toString());

            assertNotNull(parsed);
            assertTrue(CATEGORIES.contains(parsed.category()), "category outside vocabulary for: " + response);
            assertTrue(TYPES.contains(parsed.documentType()), "type outside vocabulary for: " + response);
            assertTrue(parsed.reasoning().length() <= 1000);
        }
    }
}
