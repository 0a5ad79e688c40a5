package villagecompute.classifier.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.classifier.api.types.ClassificationResultType;
import villagecompute.classifier.api.types.StageErrorType;
import villagecompute.classifier.integration.ai.ModelHandle;
import villagecompute.classifier.integration.ai.ModelHandles;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers and records classifier metrics.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counters:</b> {@code classifier_classifications_total{model_used,confidence_level}} - completed
 * classifications by accepted stage and bucket</li>
 * <li><b>Counters:</b> {@code classifier_stage_failures_total{stage,kind}} - stages passed over, by reason</li>
 * <li><b>Counters:</b> {@code classifier_review_required_total} - results routed to human review</li>
 * <li><b>Timers:</b> {@code classifier_classification_duration} - end-to-end latency of {@code classify}</li>
 * <li><b>Gauges:</b> {@code classifier_model_slots_available{model}} - free inference slots per model handle</li>
 * </ul>
 *
 * <p>
 * A steadily rising share of {@code model_used=PatternBased} usually means a model endpoint is down rather than that
 * documents got harder.
 */
@ApplicationScoped
public class ClassificationMetrics {

    private static final Logger LOG = Logger.getLogger(ClassificationMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    ModelHandles modelHandles;

    private final Map<String, Counter> classificationCounters = new ConcurrentHashMap<>();

    private final Map<String, Counter> stageFailureCounters = new ConcurrentHashMap<>();

    /**
     * Registers the model slot gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        for (ModelHandle handle : modelHandles.all()) {
            Gauge.builder("classifier_model_slots_available", handle, ModelHandle::availableSlots)
                    .description("Free inference slots for the " + handle.getName() + " model")
                    .tags(List.of(Tag.of("model", handle.getName()))).register(registry);
            LOG.debugf("Registered gauge: classifier_model_slots_available{model=%s}", handle.getName());
        }
    }

    /**
     * Records one completed classification.
     *
     * @param result
     *            final result
     * @param duration
     *            wall-clock time spent in {@code classify}
     */
    public void recordClassification(ClassificationResultType result, Duration duration) {
        String modelUsed = result.modelUsed().getLabel();
        String level = result.confidenceLevel().getLabel();
        String key = modelUsed + ":" + level;

        Counter counter = classificationCounters.computeIfAbsent(key, k -> {
            return Counter.builder("classifier_classifications_total").description("Total documents classified")
                    .tags(List.of(Tag.of("model_used", modelUsed), Tag.of("confidence_level", level)))
                    .register(registry);
        });
        counter.increment();

        if (result.needsHumanReview()) {
            Counter.builder("classifier_review_required_total").description("Results flagged for human review")
                    .register(registry).increment();
        }

        Timer.builder("classifier_classification_duration").description("End-to-end classification latency")
                .register(registry).record(duration);
    }

    /**
     * Records a stage that was passed over.
     */
    public void recordStageFailure(StageErrorType error) {
        String stage = error.stage().tagValue();
        String kind = error.kind().name();
        String key = stage + ":" + kind;

        Counter counter = stageFailureCounters.computeIfAbsent(key, k -> {
            return Counter.builder("classifier_stage_failures_total")
                    .description("Cascade stages that did not produce the accepted classification")
                    .tags(List.of(Tag.of("stage", stage), Tag.of("kind", kind))).register(registry);
        });
        counter.increment();
    }
}
