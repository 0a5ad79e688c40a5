/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.classifier.integration.ai;

import dev.langchain4j.model.chat.ChatModel;
import org.jboss.logging.Logger;
import villagecompute.classifier.api.types.StageErrorKind;
import villagecompute.classifier.exceptions.ModelUnavailableException;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Shared, lazily loaded language-model client guarded by a single inference slot.
 *
 * <p>
 * At most one inference runs per handle at any time. Concurrent callers queue on a fair {@link Semaphore}; a caller
 * that cannot obtain the slot within the configured slot timeout gets a {@link ModelUnavailableException} so the
 * cascade can move on instead of blocking indefinitely.
 *
 * <p>
 * The underlying {@link ChatModel} is built on first use and can be released with {@link #unload()} between
 * unrelated batch jobs. {@link #load()} rebuilds it eagerly.
 *
 * <p>
 * Every failure of the underlying client is rethrown as {@link ModelUnavailableException} with kind
 * {@link StageErrorKind#TIMEOUT} or {@link StageErrorKind#UNAVAILABLE}.
 */
public class ModelHandle {

    private static final Logger LOG = Logger.getLogger(ModelHandle.class);

    private final String name;
    private final Supplier<ChatModel> loader;
    private final Duration slotTimeout;
    private final Semaphore slot = new Semaphore(1, true);

    private volatile ChatModel model;

    /**
     * @param name
     *            handle name used in logs and diagnostics, e.g. {@code primary}
     * @param loader
     *            builds the chat model client
     * @param slotTimeout
     *            maximum time to wait for the inference slot
     */
    public ModelHandle(String name, Supplier<ChatModel> loader, Duration slotTimeout) {
        this.name = name;
        this.loader = loader;
        this.slotTimeout = slotTimeout;
    }

    public String getName() {
        return name;
    }

    /**
     * Sends a prompt to the model and returns its text answer.
     *
     * @param prompt
     *            complete prompt text
     * @return model answer, never null
     * @throws ModelUnavailableException
     *             if the slot cannot be obtained, the model cannot be loaded, or the call fails or times out
     */
    public String complete(String prompt) {
        boolean acquired = slot.tryAcquire();
        if (!acquired) {
            LOG.warnf("Model %s busy, waiting up to %ds for inference slot", name, slotTimeout.toSeconds());
            try {
                acquired = slot.tryAcquire(slotTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ModelUnavailableException(StageErrorKind.UNAVAILABLE,
                        "Interrupted while waiting for model " + name, e);
            }
            if (!acquired) {
                throw new ModelUnavailableException(StageErrorKind.UNAVAILABLE,
                        "Model " + name + " inference slot not available within " + slotTimeout.toSeconds() + "s");
            }
        }

        try {
            ChatModel chatModel = ensureLoaded();
            long start = System.currentTimeMillis();
            String answer = chatModel.chat(prompt);
            LOG.debugf("Model %s answered in %dms", name, System.currentTimeMillis() - start);
            return answer == null ? "" : answer;
        } catch (ModelUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            StageErrorKind kind = isTimeout(e) ? StageErrorKind.TIMEOUT : StageErrorKind.UNAVAILABLE;
            throw new ModelUnavailableException(kind, "Model " + name + " call failed: " + e.getMessage(), e);
        } finally {
            slot.release();
        }
    }

    /**
     * Builds the underlying client if it is not loaded yet.
     *
     * @throws ModelUnavailableException
     *             if the client cannot be built
     */
    public synchronized void load() {
        ensureLoaded();
    }

    /**
     * Releases the underlying client. The next {@link #complete(String)} rebuilds it.
     */
    public synchronized void unload() {
        if (model != null) {
            LOG.infof("Unloading model %s", name);
            model = null;
        }
    }

    public boolean isLoaded() {
        return model != null;
    }

    public int availableSlots() {
        return slot.availablePermits();
    }

    private ChatModel ensureLoaded() {
        ChatModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (model == null) {
                try {
                    LOG.infof("Loading model %s", name);
                    model = loader.get();
                } catch (RuntimeException e) {
                    throw new ModelUnavailableException(StageErrorKind.UNAVAILABLE,
                            "Model " + name + " could not be loaded: " + e.getMessage(), e);
                }
                if (model == null) {
                    throw new ModelUnavailableException(StageErrorKind.UNAVAILABLE,
                            "Model " + name + " loader returned no client");
                }
            }
            return model;
        }
    }

    static boolean isTimeout(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase();
                if (lower.contains("timed out") || lower.contains("timeout")) {
                    return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
