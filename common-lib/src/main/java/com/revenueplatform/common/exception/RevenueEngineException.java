package com.revenueplatform.common.exception;

/**
 * Unchecked failure raised by a platform component. The message is prefixed with the
 * component name, e.g. {@code [Orchestrator] no market data}.
 */
public class RevenueEngineException extends RuntimeException {
    private final String component;

    public RevenueEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public RevenueEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
