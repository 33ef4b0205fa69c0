package com.revenueplatform.common.model;

/**
 * Demand-pace classification of the comparable market, computed once per run
 * from forward occupancy and its ratio to the historical pace.
 */
public enum MarketState {
    HOT,
    NEUTRAL,
    COLD
}
