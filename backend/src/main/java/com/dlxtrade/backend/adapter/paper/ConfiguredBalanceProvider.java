package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.config.EngineProperties;
import com.dlxtrade.backend.port.BalanceProvider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Paper balance: every user trades against the configured simulated balance.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredBalanceProvider implements BalanceProvider {

    private final EngineProperties engineProperties;

    @Override
    public BigDecimal balance(String userId) {
        return engineProperties.getRisk().getSimulatedBalance();
    }
}
