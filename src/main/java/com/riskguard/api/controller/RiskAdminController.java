package com.riskguard.api.controller;

import com.riskguard.api.dto.request.BrokerEventRequest;
import com.riskguard.api.dto.response.AuditEntryResponse;
import com.riskguard.api.dto.response.LockoutResponse;
import com.riskguard.calendar.ResetScheduler;
import com.riskguard.config.RiskGuardProperties;
import com.riskguard.core.engine.EventNormalizer;
import com.riskguard.core.engine.RiskEngine;
import com.riskguard.domain.model.DailyPnl;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.enforcement.AuditService;
import com.riskguard.exception.ResourceNotFoundException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.PnlStats;
import com.riskguard.pnl.RealizedPnlAccumulator;
import com.riskguard.rule.RiskRule;
import com.riskguard.rule.RuleSet;
import com.riskguard.timer.TimerManager;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin endpoints for the protected account.
 *
 * <ul>
 *   <li>GET /api/risk/status -- daily P&L, active lockouts and timers, engine counters</li>
 *   <li>GET /api/risk/lockouts -- active lockouts with time remaining</li>
 *   <li>DELETE /api/risk/lockouts?symbol= -- admin unlock (account-wide when symbol is omitted)</li>
 *   <li>POST /api/risk/reset -- manual reset of daily P&L and reset-bound lockouts</li>
 *   <li>GET /api/risk/pnl/history and /pnl/stats -- realized P&L by day and summary</li>
 *   <li>GET /api/risk/audit -- latest enforcement audit rows</li>
 *   <li>POST /api/risk/events -- relay a raw broker event into the engine</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskAdminController {

    private static final Logger log = LoggerFactory.getLogger(RiskAdminController.class);

    private final RiskGuardProperties riskGuardProperties;
    private final LockoutManager lockoutManager;
    private final TimerManager timerManager;
    private final RealizedPnlAccumulator realizedPnlAccumulator;
    private final ResetScheduler resetScheduler;
    private final AuditService auditService;
    private final RiskEngine riskEngine;
    private final EventNormalizer eventNormalizer;
    private final RuleSet ruleSet;
    private final Clock clock;

    public RiskAdminController(
            RiskGuardProperties riskGuardProperties,
            LockoutManager lockoutManager,
            TimerManager timerManager,
            RealizedPnlAccumulator realizedPnlAccumulator,
            ResetScheduler resetScheduler,
            AuditService auditService,
            RiskEngine riskEngine,
            EventNormalizer eventNormalizer,
            RuleSet ruleSet,
            Clock clock) {
        this.riskGuardProperties = riskGuardProperties;
        this.lockoutManager = lockoutManager;
        this.timerManager = timerManager;
        this.realizedPnlAccumulator = realizedPnlAccumulator;
        this.resetScheduler = resetScheduler;
        this.auditService = auditService;
        this.riskEngine = riskEngine;
        this.eventNormalizer = eventNormalizer;
        this.ruleSet = ruleSet;
        this.clock = clock;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        String accountId = accountId();
        Instant now = clock.instant();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("accountId", accountId);
        status.put("dailyRealizedPnl", realizedPnlAccumulator.getDaily(accountId).getTotal());
        status.put("lockedOut", lockoutManager.isLockedOut(accountId, null));
        status.put("activeLockouts", lockoutManager.activeLockouts(accountId).size());
        status.put("activeTimers", timerManager.activeTimers(accountId).size());
        status.put("nextReset", resetScheduler.nextResetTime(now));
        status.put("enabledRules", ruleSet.rules().stream()
                .map(RiskRule::kind)
                .map(kind -> kind.getConfigName())
                .collect(Collectors.toList()));
        status.put("processedEvents", riskEngine.getProcessedEvents());
        status.put("queueDepth", riskEngine.getQueueDepth());
        status.put("engineRunning", riskEngine.isRunning());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/lockouts")
    public ResponseEntity<List<LockoutResponse>> getLockouts() {
        Instant now = clock.instant();
        return ResponseEntity.ok(lockoutManager.activeLockouts(accountId()).stream()
                .map(lockout -> LockoutResponse.from(lockout, now))
                .collect(Collectors.toList()));
    }

    @DeleteMapping("/lockouts")
    public ResponseEntity<Map<String, Object>> clearLockout(@RequestParam(required = false) String symbol) {
        String accountId = accountId();
        log.warn("Admin unlock requested: account={} symbol={}", accountId, symbol);
        if (!lockoutManager.clear(accountId, symbol, "admin")) {
            throw new ResourceNotFoundException(
                    "No lockout for " + accountId + (symbol != null ? " " + symbol : " (account-wide)"));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", accountId);
        body.put("symbol", symbol);
        body.put("cleared", true);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> triggerReset() {
        resetScheduler.triggerManualReset();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("accountId", accountId());
        body.put("dailyRealizedPnl", realizedPnlAccumulator.getDaily(accountId()).getTotal());
        body.put("activeLockouts", lockoutManager.activeLockouts(accountId()).size());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/pnl/history")
    public ResponseEntity<List<DailyPnl>> getPnlHistory() {
        return ResponseEntity.ok(realizedPnlAccumulator.history(accountId()));
    }

    @GetMapping("/pnl/stats")
    public ResponseEntity<PnlStats> getPnlStats() {
        return ResponseEntity.ok(realizedPnlAccumulator.stats(accountId()));
    }

    @GetMapping("/audit")
    public ResponseEntity<List<AuditEntryResponse>> getAudit() {
        return ResponseEntity.ok(auditService.recent(accountId()).stream()
                .map(AuditEntryResponse::from)
                .collect(Collectors.toList()));
    }

    @PostMapping("/events")
    public ResponseEntity<Map<String, Object>> ingestEvent(@Valid @RequestBody BrokerEventRequest request) {
        Optional<RiskEvent> event = eventNormalizer.normalize(request.getType(), request.getPayload());
        boolean accepted = event.map(riskEngine::submit).orElse(false);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", request.getType());
        body.put("accepted", accepted);
        return ResponseEntity.accepted().body(body);
    }

    private String accountId() {
        String accountId = riskGuardProperties.getAccountId();
        if (accountId == null) {
            throw new ResourceNotFoundException("riskguard.account-id is not configured");
        }
        return accountId;
    }
}
