package com.riskguard.entity;

import com.riskguard.domain.enums.ResetType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the reset_log table. The latest row per (account, type) is the
 * last-reset marker that keeps a reset from firing twice on one date.
 */
@Entity
@Table(name = "reset_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResetLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reset_type", nullable = false, length = 16)
    private ResetType resetType;

    @Column(name = "reset_date", nullable = false)
    private LocalDate resetDate;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;
}
