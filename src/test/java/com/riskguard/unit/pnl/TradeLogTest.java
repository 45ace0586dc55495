package com.riskguard.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.entity.TradeRecordEntity;
import com.riskguard.pnl.TradeLog;
import com.riskguard.repository.jpa.TradeRecordJpaRepository;
import com.riskguard.support.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TradeLogTest {

    private static final String ACCOUNT = "PRAC-1";
    private static final Instant START = Instant.parse("2026-03-10T15:00:00Z");

    @Mock
    private TradeRecordJpaRepository tradeRecordJpaRepository;

    private MutableClock clock;
    private TradeLog tradeLog;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tradeLog = new TradeLog(tradeRecordJpaRepository, clock);
    }

    @Test
    @DisplayName("Second record of the same trade id is ignored")
    void duplicateTradeIdIgnored() {
        assertThat(tradeLog.record(trade("T-1", clock.instant()))).isTrue();
        assertThat(tradeLog.record(trade("T-1", clock.instant()))).isFalse();

        assertThat(tradeLog.countInLast(ACCOUNT, Duration.ofMinutes(1))).isEqualTo(1);
        verify(tradeRecordJpaRepository, times(1)).saveAndFlush(any(TradeRecordEntity.class));
    }

    @Test
    @DisplayName("Trade id already stored in the table counts as recorded")
    void storedTradeIdIsRecorded() {
        when(tradeRecordJpaRepository.existsByAccountIdAndTradeId(ACCOUNT, "T-9")).thenReturn(true);

        assertThat(tradeLog.isRecorded(ACCOUNT, "T-9")).isTrue();
        assertThat(tradeLog.record(trade("T-9", clock.instant()))).isFalse();
        verify(tradeRecordJpaRepository, never()).saveAndFlush(any(TradeRecordEntity.class));
    }

    @Test
    @DisplayName("Fills without a broker id in the same millisecond get distinct stored ids")
    void anonymousFillsGetDistinctIds() {
        tradeLog.record(trade(null, START));
        tradeLog.record(trade(null, START));

        ArgumentCaptor<TradeRecordEntity> captor = ArgumentCaptor.forClass(TradeRecordEntity.class);
        verify(tradeRecordJpaRepository, times(2)).saveAndFlush(captor.capture());
        List<String> storedIds = captor.getAllValues().stream().map(TradeRecordEntity::getTradeId).collect(Collectors.toList());
        assertThat(storedIds).doesNotHaveDuplicates().allSatisfy(id -> assertThat(id).startsWith("anon-"));
        assertThat(tradeLog.countInLast(ACCOUNT, Duration.ofMinutes(1))).isEqualTo(2);
    }

    @Test
    @DisplayName("Sliding window only counts trades inside it")
    void slidingWindowCount() {
        tradeLog.record(trade("T-1", START));
        tradeLog.record(trade("T-2", START.plusSeconds(20)));
        tradeLog.record(trade("T-3", START.plusSeconds(50)));
        clock.set(START.plusSeconds(70));

        assertThat(tradeLog.countInLast(ACCOUNT, Duration.ofSeconds(60))).isEqualTo(2);
        assertThat(tradeLog.countInLast(ACCOUNT, Duration.ofHours(1))).isEqualTo(3);
        assertThat(tradeLog.countSince(ACCOUNT, START.plusSeconds(20))).isEqualTo(1);
    }

    @Test
    @DisplayName("reload rebuilds the window from stored records")
    void reloadRebuildsWindow() {
        when(tradeRecordJpaRepository.findByAccountIdAndExecutedAtAfterOrderByExecutedAtAsc(any(), any()))
                .thenReturn(List.of(
                        TradeRecordEntity.builder().accountId(ACCOUNT).tradeId("T-1").executedAt(START.minusSeconds(30)).build(),
                        TradeRecordEntity.builder().accountId(ACCOUNT).tradeId("T-2").executedAt(START.minusSeconds(10)).build()));

        tradeLog.reload(ACCOUNT);

        assertThat(tradeLog.countInLast(ACCOUNT, Duration.ofMinutes(1))).isEqualTo(2);
        assertThat(tradeLog.isRecorded(ACCOUNT, "T-2")).isTrue();
    }

    private static RiskEvent trade(String tradeId, Instant at) {
        return RiskEvent.builder()
                .kind(EventKind.TRADE_EXECUTED)
                .accountId(ACCOUNT)
                .symbol("MNQ")
                .eventId(tradeId)
                .timestamp(at)
                .realizedPnl(new BigDecimal("-10"))
                .tradeSize(1)
                .build();
    }
}
