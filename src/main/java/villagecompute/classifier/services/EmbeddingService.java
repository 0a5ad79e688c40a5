/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import org.jboss.logging.Logger;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.exceptions.EmbeddingUnavailableException;

/**
 * Encodes text into the shared embedding space used by every similarity collection (all-MiniLM-L6-v2 by default,
 * 384 dimensions, cosine similarity).
 */
@ApplicationScoped
public class EmbeddingService {

    private static final Logger LOG = Logger.getLogger(EmbeddingService.class);

    @Inject
    EmbeddingModel embeddingModel;

    /**
     * Encodes text into a vector.
     *
     * @param text
     *            non-blank text
     * @return embedding vector
     * @throws EmbeddingUnavailableException
     *             if the text is blank or the embedding model fails
     */
    public float[] encode(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("Cannot encode blank text");
        }
        try {
            LOG.debugf("Generating embedding for text: %s", text.substring(0, Math.min(100, text.length())));
            Response<Embedding> response = embeddingModel.embed(text);
            Embedding embedding = response == null ? null : response.content();
            if (embedding == null || embedding.vector() == null || embedding.vector().length == 0) {
                throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
            }
            return embedding.vector();
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to generate embedding");
            throw new EmbeddingUnavailableException("Failed to generate embedding: " + e.getMessage(), e);
        }
    }
}
