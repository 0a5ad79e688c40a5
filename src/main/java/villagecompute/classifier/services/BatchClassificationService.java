/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.services;

import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.DocumentInputType;
import villagecompute.classifier.integration.ai.ModelHandles;

/**
 * Classifies a batch of documents sequentially and optionally releases model memory afterwards.
 *
 * <p>
 * Documents are processed in order so the single inference slot per model handle is never contended by the batch
 * itself. Results are returned in input order.
 */
@ApplicationScoped
public class BatchClassificationService {

    private static final Logger LOG = Logger.getLogger(BatchClassificationService.class);

    @Inject
    DocumentClassificationService classificationService;

    @Inject
    ModelHandles modelHandles;

    /**
     * @param documents
     *            documents to classify
     * @param releaseModelsAfter
     *            unload every model handle once the batch is done, even if it was interrupted by an error
     * @return one result per document, in input order
     */
    public List<ClassificationResultType> classifyAll(List<DocumentInputType> documents, boolean releaseModelsAfter) {
        List<ClassificationResultType> results = new ArrayList<>(documents.size());
        try {
            for (DocumentInputType document : documents) {
                results.add(classificationService.classify(document.text(), document.filename()));
            }
        } finally {
            if (releaseModelsAfter) {
                modelHandles.unloadAll();
            }
        }

        long reviewCount = results.stream().filter(ClassificationResultType::needsHumanReview).count();
        LOG.infof("Batch classification complete: %d documents, %d flagged for review", results.size(),
                reviewCount);
        return results;
    }

    /**
     * Warms every model handle before a large batch.
     */
    public void warmUp() {
        modelHandles.reloadAll();
    }
}
