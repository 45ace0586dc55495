package com.riskguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the audit_log table. Append-only: one row per enforcement attempt,
 * written whether the broker call succeeded or not.
 */
@Entity
@Table(name = "audit_log", indexes = @Index(name = "idx_audit_account_ts", columnList = "account_id, timestamp"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Instant timestamp;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(nullable = false, length = 40)
    private String action;

    @Column(length = 32)
    private String symbol;

    @Column(length = 500)
    private String reason;

    @Column(nullable = false, length = 20)
    private String result;

    @Column(length = 1000)
    private String detail;
}
