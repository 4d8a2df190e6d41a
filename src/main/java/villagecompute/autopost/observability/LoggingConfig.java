package villagecompute.autopost.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for pipeline and scheduler logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry identifiers of the current span</li>
 * <li>{@code job_id} - Scheduled post primary key</li>
 * <li>{@code account_id} - Publishing account</li>
 * <li>{@code pipeline_stage} - Stage currently running for the post</li>
 * <li>{@code request_origin} - What started the work ({@code timer}, {@code run-now}, an HTTP path)</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the pipeline:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobId(postId);
 * LoggingConfig.setStage(PipelineStage.PUBLISH);
 * ...
 * LoggingConfig.clearMDC();
 * </pre>
 *
 * <p>
 * MDC is thread-local. Pipeline tasks run on pooled threads, so every task must clear MDC when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_ACCOUNT_ID = "account_id";

    public static final String MDC_PIPELINE_STAGE = "pipeline_stage";

    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace and span ids from the current OpenTelemetry span. Empty strings when no span is active.
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

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setAccountId(String accountId) {
        if (accountId != null) {
            MDC.put(MDC_ACCOUNT_ID, accountId);
        }
    }

    public static void setStage(String stageCode) {
        if (stageCode != null) {
            MDC.put(MDC_PIPELINE_STAGE, stageCode);
        } else {
            MDC.remove(MDC_PIPELINE_STAGE);
        }
    }

    public static void setRequestOrigin(String origin) {
        if (origin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, origin);
        }
    }

    /**
     * Removes every field set by this class.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_ACCOUNT_ID);
        MDC.remove(MDC_PIPELINE_STAGE);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
