package com.riskguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_records table. Every executed trade (half-turns included) is
 * recorded once, keyed by the broker trade id. Feeds the rolling-window frequency counts
 * and makes trade replay after a restart a no-op.
 */
@Entity
@Table(
        name = "trade_records",
        uniqueConstraints = @UniqueConstraint(name = "uk_trade_records_trade", columnNames = {"account_id", "trade_id"}),
        indexes = @Index(name = "idx_trade_records_account_time", columnList = "account_id, executed_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "trade_id", nullable = false, length = 64)
    private String tradeId;

    @Column(length = 32)
    private String symbol;

    @Column(name = "realized_pnl", precision = 15, scale = 2)
    private BigDecimal realizedPnl;

    @Column(name = "executed_at", nullable = false)
    private Instant executedAt;
}
