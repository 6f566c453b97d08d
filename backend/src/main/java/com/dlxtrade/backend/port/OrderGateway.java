package com.dlxtrade.backend.port;

import com.dlxtrade.backend.model.Order;
import com.dlxtrade.backend.model.OrderRequest;

public interface OrderGateway {

    Order placeOrder(String userId, OrderRequest request);

    void cancelOrder(String orderId);
}
