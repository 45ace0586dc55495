package com.riskguard.enforcement;

import com.riskguard.broker.BrokerGateway;
import com.riskguard.config.EnforcementConfig;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.event.EventPublisherHelper;
import com.riskguard.exception.BrokerException;
import com.riskguard.exception.PersistenceException;
import com.riskguard.exception.TransientBrokerException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.position.PositionBook;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a winning verdict into broker commands, audit rows and, where the verdict calls for one,
 * a lockout.
 *
 * <p>Each broker call runs on a dedicated pool so that it can be bounded by
 * {@code riskguard.enforcement.call-timeout-ms}. Transient failures and timeouts are retried
 * with exponential backoff up to {@code max-retries} attempts; other broker errors fail at once.
 * Every call is audited. A lockout is installed only if all of its broker steps succeeded;
 * otherwise the intended lockout is audited as skipped.
 *
 * <p>Flattening the account follows the same order as an emergency exit: working orders are
 * cancelled first, then all positions are closed. Both steps are attempted even if the first fails.
 */
@Service
public class EnforcementExecutor {

    private static final Logger log = LoggerFactory.getLogger(EnforcementExecutor.class);

    private final BrokerGateway brokerGateway;
    private final LockoutManager lockoutManager;
    private final PositionBook positionBook;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final EnforcementConfig enforcementConfig;
    private final ExecutorService brokerCallPool;

    public EnforcementExecutor(
            BrokerGateway brokerGateway,
            LockoutManager lockoutManager,
            PositionBook positionBook,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            EnforcementConfig enforcementConfig) {
        this.brokerGateway = brokerGateway;
        this.lockoutManager = lockoutManager;
        this.positionBook = positionBook;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.enforcementConfig = enforcementConfig;
        AtomicInteger threadCount = new AtomicInteger();
        this.brokerCallPool = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "broker-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Enforces a breached verdict for an account. Never throws: failures are reported in the result.
     */
    public EnforcementResult enforce(String accountId, RuleVerdict verdict) {
        EnforcementResult result = EnforcementResult.builder()
                .accountId(accountId)
                .action(verdict.getAction())
                .symbol(verdict.getSymbol())
                .success(true)
                .build();
        log.info(
                "stage=enforcement.attempt account={} rule={} action={} symbol={} reason={}",
                accountId,
                verdict.getRuleKind(),
                verdict.getAction(),
                verdict.getSymbol(),
                verdict.getReason());

        switch (verdict.getAction()) {
            case CLOSE_SYMBOL -> step(result, verdict, "CLOSE_POSITION", () ->
                    brokerGateway.closePosition(accountId, verdict.getSymbol()));
            case REDUCE_TO_LIMIT -> step(result, verdict, "REDUCE_POSITION", () ->
                    brokerGateway.reducePosition(accountId, verdict.getSymbol(), verdict.getTargetSize()));
            case CANCEL_ORDERS -> step(result, verdict, "CANCEL_ORDERS", () -> brokerGateway.cancelAllOrders(accountId));
            case CLOSE_ALL -> flatten(result, verdict);
            case COOLDOWN -> {
                if (verdict.isFlatten()) {
                    flatten(result, verdict);
                }
                installLockout(result, verdict, () -> lockoutManager.setCooldown(
                        accountId, verdict.getSymbol(), verdict.getReason(), verdict.getCooldown(), verdict.getRuleKind()));
            }
            case HARD_LOCKOUT_UNTIL -> {
                if (verdict.isAccountWide()) {
                    flatten(result, verdict);
                } else if (positionBook.get(accountId, verdict.getSymbol()).isPresent()) {
                    step(result, verdict, "CLOSE_POSITION", () -> brokerGateway.closePosition(accountId, verdict.getSymbol()));
                }
                installLockout(result, verdict, () -> lockoutManager.setHard(
                        accountId,
                        verdict.getSymbol(),
                        verdict.getReason(),
                        verdict.getLockoutUntil(),
                        verdict.getRuleKind(),
                        verdict.isResetBound()));
            }
            case MODIFY_STOP -> {
                auditService.record(accountId, "MODIFY_STOP", verdict.getSymbol(), verdict.getReason(),
                        AuditService.RESULT_SUCCESS, "stopPrice=" + verdict.getStopPrice());
                eventPublisherHelper.publishStopAdjustment(
                        this, accountId, verdict.getSymbol(), verdict.getStopPrice(), verdict.getReason());
            }
            case NONE -> log.debug("Nothing to enforce for {}", accountId);
        }

        if (result.hasErrors()) {
            result.setSuccess(false);
            log.error(
                    "stage=enforcement.result account={} action={} success=false calls={} errors={}",
                    accountId,
                    verdict.getAction(),
                    result.getBrokerCalls(),
                    result.getErrors());
        } else {
            log.info(
                    "stage=enforcement.result account={} action={} success=true calls={} lockout={}",
                    accountId,
                    verdict.getAction(),
                    result.getBrokerCalls(),
                    result.isLockoutInstalled());
        }
        return result;
    }

    private void flatten(EnforcementResult result, RuleVerdict verdict) {
        String accountId = result.getAccountId();
        step(result, verdict, "CANCEL_ORDERS", () -> brokerGateway.cancelAllOrders(accountId));
        step(result, verdict, "CLOSE_ALL_POSITIONS", () -> brokerGateway.closeAllPositions(accountId));
    }

    private void step(EnforcementResult result, RuleVerdict verdict, String action, Runnable call) {
        String accountId = result.getAccountId();
        result.setBrokerCalls(result.getBrokerCalls() + 1);
        try {
            int attempts = callWithRetry(action, call);
            auditService.record(accountId, action, verdict.getSymbol(), verdict.getReason(),
                    AuditService.RESULT_SUCCESS, "attempts=" + attempts);
            eventPublisherHelper.publishEnforcement(this, accountId, action, verdict.getSymbol(), verdict.getReason(), true);
        } catch (BrokerException e) {
            String error = action + " failed: " + e.getMessage();
            result.getErrors().add(error);
            log.error("stage=enforcement.step account={} action={} symbol={}: {}", accountId, action, verdict.getSymbol(), e.getMessage());
            auditService.record(accountId, action, verdict.getSymbol(), verdict.getReason(), AuditService.RESULT_FAILED, error);
            eventPublisherHelper.publishEnforcement(this, accountId, action, verdict.getSymbol(), verdict.getReason(), false);
        }
    }

    private void installLockout(EnforcementResult result, RuleVerdict verdict, Runnable install) {
        String action = "LOCKOUT_" + verdict.getAction().name();
        if (result.hasErrors()) {
            auditService.record(result.getAccountId(), action, verdict.getSymbol(), verdict.getReason(),
                    AuditService.RESULT_SKIPPED, "broker enforcement failed: " + result.getErrors());
            return;
        }
        try {
            install.run();
            result.setLockoutInstalled(true);
            auditService.record(result.getAccountId(), action, verdict.getSymbol(), verdict.getReason(),
                    AuditService.RESULT_INSTALLED, describeLockout(verdict));
        } catch (PersistenceException e) {
            result.getErrors().add(action + " failed: " + e.getMessage());
            log.error("stage=enforcement.lockout account={} failed to persist lockout: {}", result.getAccountId(), e.getMessage(), e);
            auditService.record(result.getAccountId(), action, verdict.getSymbol(), verdict.getReason(),
                    AuditService.RESULT_FAILED, e.getMessage());
        }
    }

    /**
     * Runs one broker call, retrying transient failures.
     *
     * @return the number of attempts it took
     * @throws BrokerException the last failure once retries are exhausted, or the first
     *     non-transient failure
     */
    int callWithRetry(String action, Runnable call) {
        int maxAttempts = Math.max(1, enforcementConfig.getMaxRetries());
        BrokerException lastException = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<?> future = brokerCallPool.submit(call);
            try {
                future.get(enforcementConfig.getCallTimeoutMs(), TimeUnit.MILLISECONDS);
                return attempt;
            } catch (TimeoutException e) {
                future.cancel(true);
                lastException = new TransientBrokerException(
                        action + " timed out after " + enforcementConfig.getCallTimeoutMs() + "ms", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof BrokerException && ((BrokerException) cause).isRetryable()) {
                    lastException = (BrokerException) cause;
                } else if (cause instanceof BrokerException) {
                    throw (BrokerException) cause;
                } else {
                    throw new BrokerException(action + " failed: " + cause.getMessage(), cause);
                }
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new BrokerException(action + " interrupted", e);
            }
            log.warn("{} attempt {}/{} failed: {}", action, attempt, maxAttempts, lastException.getMessage());
            if (attempt < maxAttempts) {
                sleep(enforcementConfig.getInitialBackoffMs() << (attempt - 1));
            }
        }
        throw lastException;
    }

    private static String describeLockout(RuleVerdict verdict) {
        return switch (verdict.getAction()) {
            case COOLDOWN -> "cooldown=" + verdict.getCooldown().getSeconds() + "s";
            case HARD_LOCKOUT_UNTIL -> verdict.getLockoutUntil() != null ? "until=" + verdict.getLockoutUntil() : "permanent";
            default -> null;
        };
    }

    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @PreDestroy
    public void shutdown() {
        brokerCallPool.shutdownNow();
    }
}
