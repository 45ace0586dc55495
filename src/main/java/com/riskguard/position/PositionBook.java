package com.riskguard.position;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.model.Position;
import com.riskguard.domain.model.RiskEvent;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Current positions per account, rebuilt from PositionChanged events.
 *
 * <p>Not persisted: the broker adapter replays a position snapshot on (re)connect, which
 * repopulates the book. Flat positions are removed.
 */
@Component
public class PositionBook {

    private final Map<String, Map<String, Position>> positions = new ConcurrentHashMap<>();

    /**
     * Applies a PositionChanged event.
     *
     * @return the net size held before this event (0 if none)
     */
    public int apply(RiskEvent event) {
        if (event.getKind() != EventKind.POSITION_CHANGED || event.getSymbol() == null) {
            return 0;
        }
        Map<String, Position> book = positions.computeIfAbsent(event.getAccountId(), k -> new ConcurrentHashMap<>());
        Position previous = book.get(event.getSymbol());
        int previousSize = previous != null ? previous.getNetSize() : 0;

        if (event.netSizeOrZero() == 0) {
            book.remove(event.getSymbol());
        } else {
            book.put(event.getSymbol(), Position.builder()
                    .accountId(event.getAccountId())
                    .symbol(event.getSymbol())
                    .netSize(event.netSizeOrZero())
                    .averagePrice(event.getAveragePrice())
                    .marketPrice(event.getMarketPrice())
                    .unrealizedPnl(event.getUnrealizedPnl())
                    .build());
        }
        return previousSize;
    }

    public Optional<Position> get(String accountId, String symbol) {
        return Optional.ofNullable(positions.getOrDefault(accountId, Map.of()).get(symbol));
    }

    public List<Position> openPositions(String accountId) {
        Collection<Position> book = positions.getOrDefault(accountId, Map.of()).values();
        return book.stream().filter(p -> p.getNetSize() != 0).collect(Collectors.toList());
    }

    /** Signed sum across all symbols. */
    public int netTotal(String accountId) {
        return openPositions(accountId).stream().mapToInt(Position::getNetSize).sum();
    }

    /** Sum of absolute sizes across all symbols. */
    public int grossTotal(String accountId) {
        return openPositions(accountId).stream().mapToInt(p -> Math.abs(p.getNetSize())).sum();
    }

    /** Sum of reported unrealized P&L; positions without a figure count as zero. */
    public BigDecimal totalUnrealized(String accountId) {
        return openPositions(accountId).stream()
                .map(Position::getUnrealizedPnl)
                .filter(pnl -> pnl != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void clear(String accountId) {
        positions.remove(accountId);
    }
}
