/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.integration.ai;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Lifecycle owner of the three language-model handles used by the cascade.
 *
 * <p>
 * Classification calls never load or unload models themselves. The host process (or
 * {@code BatchClassificationService} after a large batch) calls {@link #unloadAll()} to release model memory and
 * {@link #reloadAll()} to warm the clients again.
 */
@ApplicationScoped
public class ModelHandles {

    private static final Logger LOG = Logger.getLogger(ModelHandles.class);

    @Inject
    @Named("primary")
    ModelHandle primary;

    @Inject
    @Named("fallback-api")
    ModelHandle fallbackApi;

    @Inject
    @Named("fallback-local")
    ModelHandle fallbackLocal;

    public ModelHandles() {
    }

    public ModelHandles(ModelHandle primary, ModelHandle fallbackApi, ModelHandle fallbackLocal) {
        this.primary = primary;
        this.fallbackApi = fallbackApi;
        this.fallbackLocal = fallbackLocal;
    }

    public ModelHandle primary() {
        return primary;
    }

    public ModelHandle fallbackApi() {
        return fallbackApi;
    }

    public ModelHandle fallbackLocal() {
        return fallbackLocal;
    }

    public List<ModelHandle> all() {
        return List.of(primary, fallbackApi, fallbackLocal);
    }

    /**
     * Releases every loaded model client.
     */
    public void unloadAll() {
        all().forEach(ModelHandle::unload);
        LOG.info("Released all model handles");
    }

    /**
     * Rebuilds every model client. A handle that fails to load is logged and left unloaded; the cascade treats it
     * as unavailable on the next call.
     */
    public void reloadAll() {
        for (ModelHandle handle : all()) {
            try {
                handle.load();
            } catch (RuntimeException e) {
                LOG.warnf(e, "Model %s could not be reloaded", handle.getName());
            }
        }
    }
}
