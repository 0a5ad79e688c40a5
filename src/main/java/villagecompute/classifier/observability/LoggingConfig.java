package villagecompute.classifier.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC fields and helpers for enriching classification logs with request context.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - current span identifier within the trace</li>
 * <li>{@code classification_id} - random identifier of one {@code classify} call</li>
 * <li>{@code document_name} - filename of the document being classified</li>
 * <li>{@code cascade_stage} - cascade stage currently executing</li>
 * </ul>
 *
 * <p>
 * <b>Usage:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setClassificationId(UUID.randomUUID().toString());
 * LoggingConfig.setDocumentName(filename);
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> {@link MDC} is ThreadLocal. Each classification call must clear it when done.
 */
public final class LoggingConfig {

    /** OpenTelemetry trace identifier (32 hex characters). */
    public static final String MDC_TRACE_ID = "trace_id";

    /** OpenTelemetry span identifier (16 hex characters). */
    public static final String MDC_SPAN_ID = "span_id";

    /** Identifier of one classification call. */
    public static final String MDC_CLASSIFICATION_ID = "classification_id";

    /** Filename of the document under classification. */
    public static final String MDC_DOCUMENT_NAME = "document_name";

    /** Cascade stage currently executing (e.g. "primary", "fallback"). */
    public static final String MDC_CASCADE_STAGE = "cascade_stage";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span into MDC. Empty strings are used when no span
     * is active so the log structure stays consistent.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setClassificationId(String classificationId) {
        if (classificationId != null) {
            MDC.put(MDC_CLASSIFICATION_ID, classificationId);
        }
    }

    public static void setDocumentName(String documentName) {
        if (documentName != null && !documentName.isEmpty()) {
            MDC.put(MDC_DOCUMENT_NAME, documentName);
        }
    }

    public static void setCascadeStage(String stage) {
        if (stage != null) {
            MDC.put(MDC_CASCADE_STAGE, stage);
        }
    }

    /**
     * Removes every field this class manages.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_CLASSIFICATION_ID);
        MDC.remove(MDC_DOCUMENT_NAME);
        MDC.remove(MDC_CASCADE_STAGE);
    }
}
