package com.ns.funnel.order;

import com.ns.funnel.model.OrderType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OrderStrategiesTest {

    @ParameterizedTest
    @EnumSource(OrderType.class)
    void strategyMatchesRequestedOrder(OrderType orderType) {
        assertEquals(orderType, OrderStrategies.forOrder(orderType).getOrderType());
    }

    @Test
    void onlyStrictOrderNeedsNonMatchingEvents() {
        assertInstanceOf(StrictOrderStrategy.class, OrderStrategies.forOrder(OrderType.STRICT));
        assertTrue(OrderStrategies.forOrder(OrderType.STRICT).requiresAllEvents());
        assertFalse(OrderStrategies.forOrder(OrderType.SEQUENTIAL).requiresAllEvents());
        assertFalse(OrderStrategies.forOrder(OrderType.UNORDERED).requiresAllEvents());
    }
}
