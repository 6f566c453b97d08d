package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.Position;

import java.util.List;

/**
 * Optional capability of an {@link OrderGateway}. Gateways that track positions implement it
 * alongside the gateway interface; engines check for it once when they are built.
 */
public interface PositionManagement {

    List<Position> getOpenPositions(String userId, String symbol);

    void closePosition(String userId, String symbol, String positionId);
}
