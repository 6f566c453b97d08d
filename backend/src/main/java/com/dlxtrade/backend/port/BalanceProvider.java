package com.dlxtrade.backend.port;

import java.math.BigDecimal;

public interface BalanceProvider {

    BigDecimal balance(String userId);
}
