package com.ns.funnel.order;

import com.ns.funnel.model.OrderType;

public final class OrderStrategies {

    private OrderStrategies() {
    }

    public static FunnelOrderStrategy forOrder(OrderType orderType) {
        switch (orderType) {
            case SEQUENTIAL:
                return new SequentialOrderStrategy();
            case STRICT:
                return new StrictOrderStrategy();
            case UNORDERED:
                return new UnorderedOrderStrategy();
            default:
                throw new IllegalArgumentException("Unknown funnel order " + orderType);
        }
    }
}
