package com.riskguard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
 * JPA entity for the timers table. The expiry action is stored as data
 * (action_type plus its arguments) so a restart can rebuild it.
 */
@Entity
@Table(
        name = "timers",
        uniqueConstraints = @UniqueConstraint(name = "uk_timers_account_name", columnNames = {"account_id", "name"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, length = 64)
    private String accountId;

    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "action_type", nullable = false, length = 32)
    private String actionType;

    @Column(name = "action_symbol", length = 32)
    private String actionSymbol;

    @Column(name = "action_ref", length = 128)
    private String actionRef;

    @Column(name = "created_at")
    private Instant createdAt;
}
