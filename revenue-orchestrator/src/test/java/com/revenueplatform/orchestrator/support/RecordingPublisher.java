package com.revenueplatform.orchestrator.support;

import com.revenueplatform.common.event.RevenueReportEvent;
import com.revenueplatform.common.report.RevenueReportPublisher;

import java.util.ArrayList;
import java.util.List;

public final class RecordingPublisher implements RevenueReportPublisher {

    public final List<RevenueReportEvent> events = new ArrayList<>();

    @Override
    public void publish(RevenueReportEvent event) {
        events.add(event);
    }
}
