package com.revenueplatform.common.report;

import com.revenueplatform.common.event.RevenueReportEvent;

/**
 * Publishes a completed {@link RevenueReportEvent}.
 *
 * <p>Current implementation: {@code RestReportPublisher}, an HTTP call to
 * notification-service. Implementations must not block the calling thread.
 */
public interface RevenueReportPublisher {

    void publish(RevenueReportEvent event);
}
