package com.revenueplatform.common.exception;

/** No market data could be obtained for a run; the engine is never invoked. */
public class MissingMarketException extends RevenueEngineException {
    private final String propertyId;

    public MissingMarketException(String propertyId, String marketId) {
        super("Orchestrator", "no market data for propertyId=" + propertyId + " marketId=" + marketId);
        this.propertyId = propertyId;
    }

    public String getPropertyId() {
        return propertyId;
    }
}
