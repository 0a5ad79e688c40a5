/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.classifier.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import villagecompute.classifier.config.AiConfig.AiConfigurationException;
import villagecompute.classifier.integration.ai.ModelHandle;

/**
 * Unit tests for {@link AiConfig} validation logic.
 *
 * <p>
 * <b>Note:</b> These are lightweight unit tests that don't require Quarkus context. No model client is contacted:
 * handles only build their clients on first use.
 */
class AiConfigTest {

    private static AiConfig validConfig() {
        AiConfig config = new AiConfig();
        config.primaryBaseUrl = "http://localhost:8000/v1";
        config.primaryModelName = "Equall/Saul-7B-Instruct-v1";
        config.primaryApiKey = "not-required";
        config.primaryMaxTokens = 100;
        config.primaryTimeoutSeconds = 30;
        config.fallbackApiBaseUrl = "http://localhost:8001";
        config.fallbackApiModelName = "mistral";
        config.fallbackApiKey = "not-required";
        config.fallbackApiMaxTokens = 150;
        config.fallbackApiTimeoutSeconds = 10;
        config.fallbackLocalBaseUrl = "http://localhost:11434";
        config.fallbackLocalModelName = "mistral";
        config.fallbackLocalMaxTokens = 150;
        config.fallbackLocalTimeoutSeconds = 60;
        config.temperature = 0.1;
        config.slotTimeoutSeconds = 120;
        config.embeddingBaseUrl = "http://localhost:8002/v1";
        config.embeddingModelName = "all-MiniLM-L6-v2";
        config.embeddingApiKey = "not-required";
        config.embeddingTimeoutSeconds = 30;
        return config;
    }

    /**
     * Verifies that validation succeeds with the default endpoints.
     */
    @Test
    void testValidationSucceedsWithDefaults() {
        AiConfig config = validConfig();

        assertDoesNotThrow(config::validateConfiguration, "Validation should succeed with local endpoints");
    }

    @Test
    void testValidationFailsWithBlankPrimaryUrl() {
        AiConfig config = validConfig();
        config.primaryBaseUrl = " ";

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithNonHttpUrl() {
        AiConfig config = validConfig();
        config.fallbackLocalBaseUrl = "ftp://models.internal";

        assertThrows(AiConfigurationException.class, config::validateConfiguration,
                "Only http(s) endpoints are accepted");
    }

    @Test
    void testValidationFailsWithRelativeUrl() {
        AiConfig config = validConfig();
        config.embeddingBaseUrl = "/v1/embeddings";

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithTemperatureOutOfRange() {
        AiConfig config = validConfig();
        config.temperature = 2.5;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidationFailsWithNonPositiveTimeout() {
        AiConfig config = validConfig();
        config.slotTimeoutSeconds = 0;

        assertThrows(AiConfigurationException.class, config::validateConfiguration);
    }

    /**
     * Verifies that producing handles does not contact any model server.
     */
    @Test
    void testHandlesAreCreatedUnloaded() {
        AiConfig config = validConfig();

        ModelHandle primary = config.createPrimaryModel();
        ModelHandle local = config.createFallbackLocalModel();

        assertNotNull(primary);
        assertEquals("primary", primary.getName());
        assertEquals("fallback-local", local.getName());
        assertFalse(primary.isLoaded());
        assertEquals(1, local.availableSlots());
    }
}
