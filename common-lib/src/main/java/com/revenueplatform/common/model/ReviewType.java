package com.revenueplatform.common.model;

/** Which trigger produced a run; drives the report title. */
public enum ReviewType {

    WEEKLY("Weekly Promotion Scan"),
    MONTHLY("Monthly Stabilization Audit"),
    ON_DEMAND("Revenue Engine Audit");

    private final String title;

    ReviewType(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
