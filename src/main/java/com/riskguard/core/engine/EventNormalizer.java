package com.riskguard.core.engine;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.OrderKind;
import com.riskguard.domain.enums.OrderStatus;
import com.riskguard.domain.model.RiskEvent;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw broker callbacks into {@link RiskEvent}s.
 *
 * <p>Broker payload conventions:
 * <ul>
 *   <li>{@code contractId} looks like {@code CON.F.US.MNQ.Z25}; the root symbol is the
 *       second-to-last segment. An explicit {@code symbol} field wins.</li>
 *   <li>Positions report an unsigned {@code size} with {@code type} 1 (long) or 2 (short).</li>
 *   <li>{@code profitAndLoss} is null on half-turn (opening) fills.</li>
 * </ul>
 * Unknown event types and payloads without an account are dropped with a log line.
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    private static final int POSITION_TYPE_SHORT = 2;

    private final Clock clock;

    public EventNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Optional<RiskEvent> normalize(String brokerEventType, Map<String, Object> payload) {
        EventKind kind = kindOf(brokerEventType);
        if (kind == null) {
            log.debug("Ignoring broker event type {}", brokerEventType);
            return Optional.empty();
        }
        String accountId = string(payload.get("accountId"));
        if (accountId == null) {
            log.warn("stage=event.malformed type={} reason=missing accountId payload={}", brokerEventType, payload);
            return Optional.empty();
        }

        RiskEvent.RiskEventBuilder builder = RiskEvent.builder()
                .kind(kind)
                .accountId(accountId)
                .symbol(symbolOf(payload))
                .eventId(string(payload.get("id")))
                .timestamp(timestampOf(payload));

        switch (kind) {
            case TRADE_EXECUTED -> builder
                    .realizedPnl(decimal(payload.get("profitAndLoss")))
                    .tradeSize(integer(payload.get("size")))
                    .price(decimal(payload.get("price")));
            case POSITION_CHANGED -> builder
                    .netSize(signedSize(payload))
                    .averagePrice(decimal(payload.get("averagePrice")))
                    .marketPrice(decimal(payload.get("marketPrice")))
                    .unrealizedPnl(decimal(payload.get("unrealizedPnl")));
            case ORDER_CHANGED -> builder
                    .orderId(string(payload.get("id")))
                    .orderKind(OrderKind.fromBrokerCode(integer(payload.get("type"))))
                    .orderStatus(OrderStatus.fromBrokerCode(integer(payload.get("status"))))
                    .stopPrice(decimal(payload.get("stopPrice")));
            case ACCOUNT_STATUS_CHANGED -> builder.canTrade(bool(payload.get("canTrade")));
        }
        return Optional.of(builder.build());
    }

    static EventKind kindOf(String brokerEventType) {
        if (brokerEventType == null) {
            return null;
        }
        String type = brokerEventType.toUpperCase(Locale.ROOT);
        if (type.startsWith("TRADE") || type.equals("GATEWAYUSERTRADE")) {
            return EventKind.TRADE_EXECUTED;
        }
        if (type.startsWith("POSITION") || type.equals("GATEWAYUSERPOSITION")) {
            return EventKind.POSITION_CHANGED;
        }
        if (type.startsWith("ORDER") || type.equals("GATEWAYUSERORDER")) {
            return EventKind.ORDER_CHANGED;
        }
        if (type.startsWith("ACCOUNT") || type.equals("GATEWAYUSERACCOUNT")) {
            return EventKind.ACCOUNT_STATUS_CHANGED;
        }
        return null;
    }

    static String symbolOf(Map<String, Object> payload) {
        String symbol = string(payload.get("symbol"));
        if (symbol == null) {
            String contractId = string(payload.get("contractId"));
            if (contractId != null) {
                String[] parts = contractId.split("\\.");
                symbol = parts.length >= 2 ? parts[parts.length - 2] : contractId;
            }
        }
        return symbol != null ? symbol.toUpperCase(Locale.ROOT) : null;
    }

    private static Integer signedSize(Map<String, Object> payload) {
        Integer netSize = integer(payload.get("netSize"));
        if (netSize != null) {
            return netSize;
        }
        Integer size = integer(payload.get("size"));
        if (size == null) {
            return 0;
        }
        Integer type = integer(payload.get("type"));
        return type != null && type == POSITION_TYPE_SHORT ? -Math.abs(size) : Math.abs(size);
    }

    private Instant timestampOf(Map<String, Object> payload) {
        Object raw = payload.getOrDefault("timestamp", payload.get("creationTimestamp"));
        if (raw instanceof Instant) {
            return (Instant) raw;
        }
        if (raw instanceof String) {
            try {
                return OffsetDateTime.parse((String) raw).toInstant();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable timestamp {}, using arrival time", raw);
            }
        }
        return clock.instant();
    }

    private static String string(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }

    private static Integer integer(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.valueOf(value.toString().trim());
    }

    private static Boolean bool(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.valueOf(value.toString());
    }
}
