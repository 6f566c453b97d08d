package com.dlxtrade.backend.dto;

/**
 * Read view of one engine: whether its loop is running and the configuration it runs with.
 */
public record EngineStatusView<C>(boolean running, C config) {

    public static <C> EngineStatusView<C> stopped() {
        return new EngineStatusView<>(false, null);
    }
}
