package com.riskguard.entity;

import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the lockouts table. symbol_key is "*" for an account-wide lockout.
 */
@Entity
@Table(
        name = "lockouts",
        uniqueConstraints = @UniqueConstraint(name = "uk_lockouts_account_symbol", columnNames = {"account_id", "symbol_key"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LockoutEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(name = "symbol_key", nullable = false, length = 32)
    private String symbolKey;

    @Column(length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private LockoutKind kind;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    private RuleKind source;

    @Column(name = "reset_bound")
    private boolean resetBound;
}
