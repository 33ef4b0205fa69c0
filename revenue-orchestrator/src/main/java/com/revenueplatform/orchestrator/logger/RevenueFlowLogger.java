package com.revenueplatform.orchestrator.logger;

import com.revenueplatform.common.engine.EngineResult;
import com.revenueplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a revenue run. Pure side effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #RUN_RECEIVED}: request accepted by the API or scheduler</li>
 *   <li>{@link #MARKET_DATA_FETCHED}: comparable selection received</li>
 *   <li>{@link #PROPERTY_DATA_FETCHED}: property metrics received</li>
 *   <li>{@link #ENGINE_COMPLETED}: engine result assembled</li>
 *   <li>{@link #REPORT_PUBLISHED}: report event handed to the publisher</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(RevenueFlowLogger.MARKET_DATA_FETCHED))
 * </pre>
 */
@Component
public class RevenueFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(RevenueFlowLogger.class);

    public static final String RUN_RECEIVED          = "RUN_RECEIVED";
    public static final String MARKET_DATA_FETCHED   = "MARKET_DATA_FETCHED";
    public static final String PROPERTY_DATA_FETCHED = "PROPERTY_DATA_FETCHED";
    public static final String ENGINE_COMPLETED      = "ENGINE_COMPLETED";
    public static final String REPORT_PUBLISHED      = "REPORT_PUBLISHED";

    /**
     * {@code doOnEach} consumer that reads the traceId from the Reactor Context.
     * Fires on {@code onNext} only.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[RevenueFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[RevenueFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** One-line digest of the engine output. */
    public void logResult(String propertyId, EngineResult result, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[RevenueFlow] stage={} propertyId={} newAps={} diagnosis={} newTargetRent={} "
                     + "marketState={} mode={} recommendations={} promotions={} traceId={}",
                     ENGINE_COMPLETED, propertyId,
                     String.format("%.4f", result.core().newAps()),
                     result.monthlyReview().diagnosis().type(),
                     String.format("%.2f", result.monthlyReview().correction().newTargetRent()),
                     result.weeklyReview().marketState(),
                     result.weeklyReview().operatingMode(),
                     result.weeklyReview().counts().total(),
                     result.promotions().size(),
                     traceId)
        );
    }
}
