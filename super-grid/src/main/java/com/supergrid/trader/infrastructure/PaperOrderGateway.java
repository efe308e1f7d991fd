package com.supergrid.trader.infrastructure;

import com.supergrid.trader.domain.Fill;
import com.supergrid.trader.domain.GatewayEventListener;
import com.supergrid.trader.domain.GatewayMode;
import com.supergrid.trader.domain.MarketSnapshot;
import com.supergrid.trader.domain.OrderGateway;
import com.supergrid.trader.domain.OrderIntent;
import com.supergrid.trader.domain.OrderType;
import com.supergrid.trader.domain.OrderUpdate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process order matching for backtests.
 * Orders rest until the next snapshot, which crosses them:
 * market orders fill at the touch, limit orders once the last price
 * reaches their limit.
 */
@Slf4j
public class PaperOrderGateway implements OrderGateway {

    private final Map<String, OrderIntent> restingOrders = new LinkedHashMap<>();
    private final List<String> cancelledOrderIds = new ArrayList<>();
    private final AtomicLong orderSequence = new AtomicLong();

    @Override
    public GatewayMode mode() {
        return GatewayMode.BACKTEST;
    }

    @Override
    public String sendOrder(OrderIntent intent) {
        if (intent == null) {
            throw new IllegalArgumentException("Order intent cannot be null");
        }
        String orderId = "PAPER-" + orderSequence.incrementAndGet();
        restingOrders.put(orderId, intent);
        log.debug("Paper order {} resting: {} {} @ {}", orderId,
                intent.getDirection(), intent.getVolume(), intent.getPrice());
        return orderId;
    }

    @Override
    public void cancelAll(String symbol) {
        Iterator<Map.Entry<String, OrderIntent>> it = restingOrders.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, OrderIntent> entry = it.next();
            if (entry.getValue().getSymbol().equals(symbol)) {
                cancelledOrderIds.add(entry.getKey());
                it.remove();
            }
        }
    }

    @Override
    public void matchOrders(MarketSnapshot snapshot, GatewayEventListener listener) {
        for (String orderId : cancelledOrderIds) {
            listener.onOrderUpdate(OrderUpdate.builder()
                    .orderId(orderId)
                    .active(false)
                    .status("CANCELLED")
                    .build());
        }
        cancelledOrderIds.clear();

        // collect first: listeners may send or cancel while we report
        List<Fill> crossed = new ArrayList<>();
        Iterator<Map.Entry<String, OrderIntent>> it = restingOrders.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, OrderIntent> entry = it.next();
            BigDecimal fillPrice = crossPrice(entry.getValue(), snapshot);
            if (fillPrice != null) {
                OrderIntent order = entry.getValue();
                crossed.add(Fill.builder()
                        .orderId(entry.getKey())
                        .symbol(order.getSymbol())
                        .direction(order.getDirection())
                        .price(fillPrice)
                        .volume(order.getVolume())
                        .time(LocalDateTime.now())
                        .build());
                it.remove();
            }
        }

        for (Fill fill : crossed) {
            log.debug("Paper order {} filled: {} {} @ {}", fill.getOrderId(),
                    fill.getDirection(), fill.getVolume(), fill.getPrice());
            listener.onOrderUpdate(OrderUpdate.builder()
                    .orderId(fill.getOrderId())
                    .active(false)
                    .status("FILLED")
                    .build());
            listener.onFill(fill);
        }
    }

    /**
     * Execution price if the snapshot crosses the order, otherwise null.
     */
    private BigDecimal crossPrice(OrderIntent order, MarketSnapshot snapshot) {
        boolean buy = order.isBuy();
        if (order.getOrderType() == OrderType.MARKET) {
            return buy ? snapshot.getAskPrice() : snapshot.getBidPrice();
        }

        BigDecimal last = snapshot.getLastPrice();
        if (buy && last.compareTo(order.getPrice()) <= 0) {
            return order.getPrice();
        }
        if (!buy && last.compareTo(order.getPrice()) >= 0) {
            return order.getPrice();
        }
        return null;
    }

    public Map<String, OrderIntent> getRestingOrders() {
        return Collections.unmodifiableMap(restingOrders);
    }
}
