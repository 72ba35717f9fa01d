package com.researchplatform.orchestrator.logger;

import com.researchplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each research run's progress through the pipeline stages. Pure side effects; never
 * changes pipeline behavior.
 *
 * <p>Usage with {@code doOnEach} (reads traceId from the Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(PipelineKeys.MARKET_DATA))
 * </pre>
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_STARTED  = "RUN_STARTED";
    public static final String RUN_FINISHED = "RUN_FINISHED";

    /**
     * Returns a {@code doOnEach} consumer that logs {@code stageName} on {@code onNext}, and the
     * failure on {@code onError}. The traceId is bridged to MDC only for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (signal.isOnNext()) {
                String traceId = TraceContextUtil.getTraceId(signal.getContextView());
                TraceContextUtil.withMdc(traceId, () ->
                    log.info("[PipelineFlow] stage={} traceId={}", stageName, traceId));
            } else if (signal.isOnError()) {
                String traceId = TraceContextUtil.getTraceId(signal.getContextView());
                Throwable error = signal.getThrowable();
                TraceContextUtil.withMdc(traceId, () ->
                    log.error("[PipelineFlow] stage={} failed traceId={} reason={}",
                        stageName, traceId, error == null ? null : error.getMessage()));
            }
        };
    }

    public void logWithTraceId(String event, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[PipelineFlow] stage={} traceId={}", event, traceId));
    }
}
