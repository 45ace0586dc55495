package com.riskguard.position;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.model.RiskEvent;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Working orders per account, tracked from OrderChanged events. Only what the stop-loss
 * grace check needs is kept: the symbol and whether the order is a stop.
 */
@Component
public class OpenOrderBook {

    private final Map<String, Map<String, WorkingOrder>> orders = new ConcurrentHashMap<>();

    public void apply(RiskEvent event) {
        if (event.getKind() != EventKind.ORDER_CHANGED || event.getOrderId() == null) {
            return;
        }
        Map<String, WorkingOrder> book = orders.computeIfAbsent(event.getAccountId(), k -> new ConcurrentHashMap<>());
        if (event.getOrderStatus() != null && event.getOrderStatus().isWorking()) {
            book.put(event.getOrderId(), new WorkingOrder(event.getSymbol(), event.isStopOrder()));
        } else {
            book.remove(event.getOrderId());
        }
    }

    public boolean hasStopOrder(String accountId, String symbol) {
        return orders.getOrDefault(accountId, Map.of()).values().stream()
                .anyMatch(order -> order.stop() && order.symbol() != null && order.symbol().equalsIgnoreCase(symbol));
    }

    public int workingCount(String accountId) {
        return orders.getOrDefault(accountId, Map.of()).size();
    }

    private record WorkingOrder(String symbol, boolean stop) {}
}
