package com.riskguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the daily_pnl table.
 * One row per account per trading day (calendar date in the account timezone).
 * Rows for past dates are historical and never rewritten.
 */
@Entity
@Table(
        name = "daily_pnl",
        uniqueConstraints = @UniqueConstraint(name = "uk_daily_pnl_account_date", columnNames = {"account_id", "trade_date"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyPnlEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "realized_pnl", precision = 15, scale = 2, nullable = false)
    private BigDecimal realizedPnl;

    @Column(name = "trade_count", nullable = false)
    private int tradeCount;

    @Column(name = "updated_at")
    private Instant updatedAt;
}
