package com.revenueplatform.scheduler.job;

import com.revenueplatform.common.event.RevenueRunRequest;
import com.revenueplatform.common.model.ReviewType;
import com.revenueplatform.common.trace.TraceContextUtil;
import com.revenueplatform.scheduler.client.OrchestratorClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cron triggers for the two recurring reviews.
 *
 * <pre>
 *   weekly   scheduler.weekly-cron   (Mon 09:00)   ReviewType.WEEKLY    promotion scan
 *   monthly  scheduler.monthly-cron  (1st 08:00)   ReviewType.MONTHLY   stabilization audit
 * </pre>
 *
 * Each firing posts one {@link RevenueRunRequest} per configured {@link ReviewTarget},
 * one after another. Failures are logged and counted; the next firing is unaffected.
 */
@Component
public class RevenueReviewScheduler {

    private static final Logger log = LoggerFactory.getLogger(RevenueReviewScheduler.class);

    private final OrchestratorClient orchestratorClient;
    private final List<ReviewTarget> targets;
    private final RunParameters parameters;

    /** Engine inputs the scheduler does not learn from upstream. */
    public record RunParameters(double previousAps, double currentTargetRent, int daysOut) {}

    @Autowired
    public RevenueReviewScheduler(OrchestratorClient orchestratorClient,
                                  @Value("${scheduler.targets:}") String targetsConfig,
                                  @Value("${scheduler.previous-aps:1.00}") double previousAps,
                                  @Value("${scheduler.current-target-rent:65000}") double currentTargetRent,
                                  @Value("${scheduler.days-out:21}") int daysOut) {
        this(orchestratorClient, ReviewTarget.parseAll(targetsConfig),
             new RunParameters(previousAps, currentTargetRent, daysOut));
    }

    public RevenueReviewScheduler(OrchestratorClient orchestratorClient,
                                  List<ReviewTarget> reviewTargets,
                                  RunParameters parameters) {
        this.orchestratorClient = orchestratorClient;
        this.targets            = reviewTargets;
        this.parameters         = parameters;
    }

    @Scheduled(cron = "${scheduler.weekly-cron:0 0 9 * * MON}", zone = "${scheduler.zone:UTC}")
    public void weeklyPromotionScan() {
        log.info("=== {} ===", ReviewType.WEEKLY.title());
        runReview(ReviewType.WEEKLY).subscribe();
    }

    @Scheduled(cron = "${scheduler.monthly-cron:0 0 8 1 * *}", zone = "${scheduler.zone:UTC}")
    public void monthlyStabilizationAudit() {
        log.info("=== {} ===", ReviewType.MONTHLY.title());
        runReview(ReviewType.MONTHLY).subscribe();
    }

    /** @return number of targets the orchestrator accepted */
    public Mono<Long> runReview(ReviewType reviewType) {
        if (targets.isEmpty()) {
            log.warn("No review targets configured. reviewType={}", reviewType);
            return Mono.just(0L);
        }
        return Flux.fromIterable(targets)
            .concatMap(target -> orchestratorClient.triggerRun(request(target, reviewType)))
            .filter(Boolean::booleanValue)
            .count()
            .doOnNext(ok -> log.info("Review complete. reviewType={} succeeded={} failed={} total={}",
                                     reviewType, ok, targets.size() - ok, targets.size()));
    }

    RevenueRunRequest request(ReviewTarget target, ReviewType reviewType) {
        return new RevenueRunRequest(
            target.propertyId(),
            target.marketId(),
            target.filters(),
            parameters.previousAps(),
            parameters.currentTargetRent(),
            parameters.daysOut(),
            reviewType,
            TraceContextUtil.newTraceId());
    }
}
