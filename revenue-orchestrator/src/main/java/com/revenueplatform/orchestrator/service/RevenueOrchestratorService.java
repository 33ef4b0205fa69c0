package com.revenueplatform.orchestrator.service;

import com.revenueplatform.common.engine.EngineInput;
import com.revenueplatform.common.engine.EngineResult;
import com.revenueplatform.common.engine.RevenueDecisionEngine;
import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.exception.MissingMarketException;
import com.revenueplatform.common.exception.RevenueEngineException;
import com.revenueplatform.common.model.ComparableSelection;
import com.revenueplatform.common.model.PropertySummary;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.common.model.SourcedMarketSelection;
import com.revenueplatform.common.model.SourcedPropertyData;
import com.revenueplatform.common.report.RevenueReportPublisher;
import com.revenueplatform.common.trace.TraceContextUtil;
import com.revenueplatform.orchestrator.adapter.MarketDataAdapter;
import com.revenueplatform.orchestrator.logger.RevenueFlowLogger;
import com.revenueplatform.orchestrator.model.BatchRunSummary;
import com.revenueplatform.orchestrator.model.RevenueRunResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Runs the revenue engine for one property, or for every listed property in turn.
 *
 * <h3>Single run</h3>
 * <pre>
 *   request ─► resolve market id (request, else revenue.default-market-id)
 *           ─► zip(comparables, property data)       market-data-service
 *           ─► reject empty selection                 MissingMarketException
 *           ─► RevenueDecisionEngine.run
 *           ─► RevenueReportPublisher.publish         fire-and-forget
 *           ─► RevenueRunResponse
 * </pre>
 *
 * <h3>Batch run</h3>
 * Properties come from Hospitable via market-data-service and are processed
 * sequentially with {@code concatMap}. A failing property is logged and counted;
 * the batch keeps going.
 */
@Service
public class RevenueOrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(RevenueOrchestratorService.class);

    private final MarketDataAdapter marketDataAdapter;
    private final RevenueDecisionEngine engine;
    private final RevenueReportPublisher reportPublisher;
    private final RevenueFlowLogger flowLogger;
    private final Clock clock;
    private final RunDefaults defaults;

    /** Values used when a request leaves a field empty. */
    public record RunDefaults(String marketId, double previousAps, double currentTargetRent, int daysOut) {}

    @Autowired
    public RevenueOrchestratorService(
            MarketDataAdapter marketDataAdapter,
            RevenueDecisionEngine engine,
            RevenueReportPublisher reportPublisher,
            RevenueFlowLogger flowLogger,
            Clock clock,
            @Value("${revenue.default-market-id:}") String defaultMarketId,
            @Value("${revenue.defaults.previous-aps:1.0}") double defaultPreviousAps,
            @Value("${revenue.defaults.current-target-rent:0}") double defaultTargetRent,
            @Value("${revenue.defaults.days-out:21}") int defaultDaysOut) {
        this(marketDataAdapter, engine, reportPublisher, flowLogger, clock,
             new RunDefaults(defaultMarketId, defaultPreviousAps, defaultTargetRent, defaultDaysOut));
    }

    public RevenueOrchestratorService(
            MarketDataAdapter marketDataAdapter,
            RevenueDecisionEngine engine,
            RevenueReportPublisher reportPublisher,
            RevenueFlowLogger flowLogger,
            Clock clock,
            RunDefaults defaults) {
        this.marketDataAdapter = marketDataAdapter;
        this.engine            = engine;
        this.reportPublisher   = reportPublisher;
        this.flowLogger        = flowLogger;
        this.clock             = clock;
        this.defaults          = defaults;
    }

    public Mono<RevenueRunResponse> run(RevenueRunRequest request) {
        return Mono.defer(() -> {
            String traceId    = TraceContextUtil.orNew(request.traceId());
            String propertyId = request.propertyId();
            String marketId   = resolveMarketId(request.marketId());
            ReviewType reviewType = request.reviewType() != null ? request.reviewType() : ReviewType.ON_DEMAND;

            if (propertyId == null || propertyId.isBlank()) {
                return Mono.error(new RevenueEngineException("Orchestrator", "propertyId is required"));
            }
            if (marketId == null) {
                return Mono.error(new MissingMarketException(propertyId, request.marketId()));
            }

            log.info("Revenue run started. propertyId={} marketId={} reviewType={} traceId={}",
                     propertyId, marketId, reviewType, traceId);

            Mono<RevenueRunResponse> pipeline = Mono.just(request)
                .doOnEach(flowLogger.stage(RevenueFlowLogger.RUN_RECEIVED))
                .flatMap(r -> Mono.zip(
                    marketDataAdapter.fetchComparables(marketId, r.filters(), traceId)
                        .doOnEach(flowLogger.stage(RevenueFlowLogger.MARKET_DATA_FETCHED)),
                    marketDataAdapter.fetchPropertyData(propertyId, traceId)
                        .doOnEach(flowLogger.stage(RevenueFlowLogger.PROPERTY_DATA_FETCHED))))
                .switchIfEmpty(Mono.error(() -> new MissingMarketException(propertyId, marketId)))
                .map(t -> execute(request, propertyId, marketId, reviewType, traceId, t.getT1(), t.getT2()))
                .doOnError(e -> log.error("Revenue run failed. propertyId={} marketId={} traceId={}: {}",
                                          propertyId, marketId, traceId, e.getMessage()));

            return TraceContextUtil.withTraceId(pipeline, traceId);
        });
    }

    public Mono<BatchRunSummary> runAll(String marketId, ReviewType reviewType) {
        return Mono.defer(() -> {
            String batchTraceId = TraceContextUtil.newTraceId();
            ReviewType type = reviewType != null ? reviewType : ReviewType.ON_DEMAND;
            return marketDataAdapter.listProperties(batchTraceId)
                .doOnNext(properties -> log.info("Batch run started. properties={} reviewType={} traceId={}",
                                                 properties.size(), type, batchTraceId))
                .flatMapMany(Flux::fromIterable)
                .concatMap(property -> runOne(property, marketId, type))
                .collectList()
                .map(BatchRunSummary::of)
                .doOnNext(summary -> log.info("Batch run complete: {} succeeded, {} failed out of {}. traceId={}",
                                              summary.succeeded(), summary.failed(), summary.total(), batchTraceId));
        });
    }

    // ── internals ─────────────────────────────────────────────────────────────

    private Mono<BatchRunSummary.Outcome> runOne(PropertySummary property, String marketId, ReviewType type) {
        RevenueRunRequest request = new RevenueRunRequest(
            property.id(), marketId, null, null, null, null, type, null);
        return run(request)
            .map(r -> new BatchRunSummary.Outcome(property.id(), true))
            .onErrorResume(e -> {
                log.warn("Batch property failed. propertyId={} name={} error={}",
                         property.id(), property.name(), e.getMessage());
                return Mono.just(new BatchRunSummary.Outcome(property.id(), false));
            });
    }

    private RevenueRunResponse execute(RevenueRunRequest request, String propertyId, String marketId,
                                       ReviewType reviewType, String traceId,
                                       SourcedMarketSelection market, SourcedPropertyData property) {
        ComparableSelection selection = market.selection();
        if (selection == null || selection.marketData() == null) {
            throw new MissingMarketException(propertyId, marketId);
        }
        if (property.data() == null) {
            throw new RevenueEngineException("Orchestrator", "no property data for propertyId=" + propertyId);
        }

        EngineInput input = new EngineInput(
            property.data(),
            selection.marketData(),
            request.previousAps()        != null ? request.previousAps()        : defaults.previousAps(),
            request.currentTargetRent()  != null ? request.currentTargetRent()  : defaults.currentTargetRent(),
            request.daysOut()            != null ? request.daysOut()            : defaults.daysOut());

        EngineResult result = engine.run(input);
        flowLogger.logResult(propertyId, result, traceId);

        RevenueReportEvent event = new RevenueReportEvent(
            traceId, reviewType, propertyId, marketId,
            selection, market.live(),
            property.data(), property.live(),
            result, clock.instant());
        reportPublisher.publish(event);
        flowLogger.logWithTraceId(RevenueFlowLogger.REPORT_PUBLISHED, traceId);

        return RevenueRunResponse.from(event);
    }

    private String resolveMarketId(String requested) {
        if (requested != null && !requested.isBlank()) return requested;
        String fallback = defaults.marketId();
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }
}
