package com.revenueplatform.orchestrator.publisher;

import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.report.RevenueReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sends {@link RevenueReportEvent}s to notification-service (fire-and-forget).
 * Delivery failures are logged and never reach the run.
 */
@Component
public class RestReportPublisher implements RevenueReportPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestReportPublisher.class);

    private final WebClient notificationClient;

    public RestReportPublisher(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    @Override
    public void publish(RevenueReportEvent event) {
        notificationClient.post()
            .uri("/api/v1/notify/revenue-report")
            .header("X-Trace-Id", event.traceId())
            .bodyValue(event)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Revenue report published. traceId={} propertyId={} status={}",
                                event.traceId(), event.propertyId(), r.getStatusCode()),
                err -> log.warn("Revenue report publish failed (non-critical). traceId={} propertyId={}",
                                event.traceId(), event.propertyId(), err)
            );
    }
}
