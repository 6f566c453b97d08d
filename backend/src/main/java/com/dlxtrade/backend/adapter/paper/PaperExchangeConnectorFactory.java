package com.dlxtrade.backend.adapter.paper;

import com.dlxtrade.backend.port.ExchangeConnectorFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class PaperExchangeConnectorFactory implements ExchangeConnectorFactory {

    private final OrderBookChannel orderBookChannel;
    private final PaperOrderGateway paperOrderGateway;

    @Override
    public ExchangeConnection connect(String userId) {
        log.info("Paper exchange connection opened userId={}", userId);
        return new ExchangeConnection(orderBookChannel, paperOrderGateway);
    }
}
