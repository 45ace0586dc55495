package com.riskguard.core.engine;

import com.riskguard.domain.enums.EnforcementCategory;
import com.riskguard.domain.enums.EventKind;
import com.riskguard.domain.enums.LockoutKind;
import com.riskguard.domain.enums.RuleKind;
import com.riskguard.domain.enums.VerdictActionType;
import com.riskguard.domain.model.Lockout;
import com.riskguard.domain.model.RiskEvent;
import com.riskguard.domain.model.RuleVerdict;
import com.riskguard.domain.model.Timer;
import com.riskguard.domain.model.TimerAction;
import com.riskguard.enforcement.EnforcementExecutor;
import com.riskguard.enforcement.EnforcementResult;
import com.riskguard.event.EventPublisherHelper;
import com.riskguard.exception.PersistenceException;
import com.riskguard.lockout.LockoutManager;
import com.riskguard.pnl.TradeLedger;
import com.riskguard.rule.RiskRule;
import com.riskguard.rule.RuleContext;
import com.riskguard.rule.RuleSet;
import com.riskguard.rule.impl.NoStopLossGraceRule;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Central event processor.
 *
 * <p>Broker events enter through {@link #submit} and are consumed one at a time by a single
 * event-loop thread. For each event the engine:
 * <ol>
 *   <li>updates the position and order books, records trades and their realized P&L</li>
 *   <li>asks the {@link LockoutManager} whether the account (or symbol) is locked out; if so no
 *       rule runs, and an event that adds exposure is closed immediately</li>
 *   <li>otherwise evaluates every enabled rule in order and picks the most restrictive breach</li>
 *   <li>hands the winning verdict to the {@link EnforcementExecutor} on a worker thread</li>
 * </ol>
 *
 * <p>Per-account ordering: while an enforcement for an account is in flight, further work for
 * that account is parked in the account's lane and replayed once the enforcement completes.
 * Other accounts keep flowing.
 *
 * <p>{@link #process(RiskEvent)} and {@link #processQueued()} run work on the caller's thread,
 * which is how tests drive the engine without starting the loop.
 */
@Service
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private final RuleSet ruleSet;
    private final RuleContext context;
    private final TradeLedger tradeLedger;
    private final EnforcementExecutor enforcementExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final Executor enforcementWorker;

    private final BlockingQueue<Work> inbound = new LinkedBlockingQueue<>();
    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final AtomicLong processedEvents = new AtomicLong();

    private volatile boolean running;
    private Thread loopThread;

    public RiskEngine(
            RuleSet ruleSet,
            RuleContext context,
            TradeLedger tradeLedger,
            EnforcementExecutor enforcementExecutor,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("enforcementWorker") Executor enforcementWorker) {
        this.ruleSet = ruleSet;
        this.context = context;
        this.tradeLedger = tradeLedger;
        this.enforcementExecutor = enforcementExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.enforcementWorker = enforcementWorker;
    }

    // ==============================
    // INGRESS AND LOOP
    // ==============================

    /**
     * Queues an event for processing.
     *
     * @return false once shutdown has begun
     */
    public boolean submit(RiskEvent event) {
        if (!accepting.get()) {
            log.warn("stage=event.rejected reason=shutting-down account={} kind={}", event.getAccountId(), event.getKind());
            return false;
        }
        inbound.add(Work.event(event));
        return true;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::runLoop, "risk-engine");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Risk engine started with {} rules", ruleSet.size());
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            try {
                Work work = inbound.poll(100, TimeUnit.MILLISECONDS);
                if (work != null) {
                    handle(work);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("stage=engine.loop unexpected error: {}", e.getMessage(), e);
            }
        }
        log.info("Risk engine loop stopped");
    }

    /**
     * Drains everything currently queued on the caller's thread.
     *
     * @return number of work items handled
     */
    public int processQueued() {
        int handled = 0;
        Work work;
        while ((work = inbound.poll()) != null) {
            handle(work);
            handled++;
        }
        return handled;
    }

    private void handle(Work work) {
        Lane lane = lane(work.accountId());
        if (work.type() == WorkType.DRAIN) {
            drain(lane);
            return;
        }
        if (lane.isBusy() || !lane.backlog.isEmpty()) {
            lane.backlog.addLast(work);
            log.debug("stage=lane.held account={} backlog={}", work.accountId(), lane.backlog.size());
            return;
        }
        run(lane, work);
    }

    private void drain(Lane lane) {
        while (!lane.isBusy() && !lane.backlog.isEmpty()) {
            run(lane, lane.backlog.pollFirst());
        }
    }

    private void run(Lane lane, Work work) {
        Work current = work;
        try {
            if (current.type() == WorkType.EVENT) {
                // keep the book-enriched event so a retry does not apply the position twice
                current = Work.event(applyToBooks(current.event()));
                evaluateEvent(lane, current.event());
            } else {
                dispatch(lane, current.verdict());
            }
        } catch (PersistenceException e) {
            // retried from the lane on the next tick
            lane.stalled = true;
            lane.backlog.addFirst(current);
            log.error("stage=engine.persistence account={} work={} will retry: {}", current.accountId(), current.type(), e.getMessage());
        }
    }

    // ==============================
    // EVENT PROCESSING
    // ==============================

    /**
     * Processes one event synchronously, bypassing the inbound queue.
     *
     * @throws PersistenceException if state could not be persisted; the event should be retried
     */
    public ProcessingOutcome process(RiskEvent event) {
        return evaluateEvent(lane(event.getAccountId()), applyToBooks(event));
    }

    /**
     * Applies position and order updates to the books. A position event comes back with its
     * previous size filled in; an event that already carries one has been applied before.
     */
    private RiskEvent applyToBooks(RiskEvent event) {
        if (event.is(EventKind.POSITION_CHANGED) && event.getPreviousSize() == null) {
            int previous = context.getPositionBook().apply(event);
            return event.toBuilder().previousSize(previous).build();
        }
        if (event.is(EventKind.ORDER_CHANGED)) {
            context.getOpenOrderBook().apply(event);
        }
        return event;
    }

    private ProcessingOutcome evaluateEvent(Lane lane, RiskEvent event) {
        String accountId = event.getAccountId();

        switch (event.getKind()) {
            case TRADE_EXECUTED -> {
                if (!tradeLedger.book(event)) {
                    log.info("stage=event.duplicate account={} tradeId={}", accountId, event.getEventId());
                    return ProcessingOutcome.builder().event(event).duplicate(true).build();
                }
            }
            case ACCOUNT_STATUS_CHANGED -> {
                if (Boolean.TRUE.equals(event.getCanTrade())) {
                    context.getLockoutManager().clearBySource(accountId, RuleKind.AUTH_LOSS_GUARD, "broker");
                }
            }
        }
        processedEvents.incrementAndGet();
        log.debug("stage=event.received account={} kind={} symbol={}", accountId, event.getKind(), event.getSymbol());

        Lockout blocking = context.getLockoutManager().effective(accountId, event.getSymbol());
        if (blocking != null) {
            return gate(lane, event, blocking);
        }

        List<RuleVerdict> breaches = evaluate(event);
        if (breaches.isEmpty()) {
            return ProcessingOutcome.builder().event(event).build();
        }
        RuleVerdict winner = mostRestrictive(breaches);
        for (RuleVerdict breach : breaches) {
            eventPublisherHelper.publishRuleBreach(this, accountId, breach, breach == winner);
        }
        log.info(
                "stage=verdict.selected account={} rule={} action={} symbol={} candidates={}",
                accountId,
                winner.getRuleKind(),
                winner.getAction(),
                winner.getSymbol(),
                breaches.size());
        return ProcessingOutcome.builder()
                .event(event)
                .breaches(breaches)
                .enforced(winner)
                .enforcement(dispatch(lane, winner))
                .build();
    }

    private ProcessingOutcome gate(Lane lane, RiskEvent event, Lockout blocking) {
        String accountId = event.getAccountId();
        if (!event.increasesExposure()) {
            log.debug("stage=gate.blocked account={} kind={} lockout={}", accountId, event.getKind(), blocking.getReason());
            return ProcessingOutcome.builder().event(event).blockingLockout(blocking).build();
        }
        RuleVerdict bypass = RuleVerdict.builder()
                .breached(true)
                .action(VerdictActionType.CLOSE_SYMBOL)
                .ruleKind(blocking.getSource())
                .category(EnforcementCategory.TRADE_BY_TRADE)
                .symbol(event.getSymbol())
                .reason("New exposure in " + event.getSymbol() + " while locked out: " + blocking.getReason())
                .build();
        log.warn("stage=gate.bypass account={} symbol={} size={} lockout={}",
                accountId, event.getSymbol(), event.getNetSize(), blocking.getReason());
        return ProcessingOutcome.builder()
                .event(event)
                .blockingLockout(blocking)
                .enforced(bypass)
                .enforcement(dispatch(lane, bypass))
                .build();
    }

    private List<RuleVerdict> evaluate(RiskEvent event) {
        List<RuleVerdict> breaches = new ArrayList<>();
        for (RiskRule rule : ruleSet.rules()) {
            RuleVerdict verdict;
            try {
                verdict = rule.evaluate(event, context);
            } catch (PersistenceException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("stage=rule.error rule={} account={} kind={}: {}",
                        rule.kind().getConfigName(), event.getAccountId(), event.getKind(), e.getMessage(), e);
                continue;
            }
            if (verdict != null && verdict.isBreached()) {
                log.info("stage=rule.breach rule={} account={} action={} reason={}",
                        rule.kind().getConfigName(), event.getAccountId(), verdict.getAction(), verdict.getReason());
                breaches.add(verdict);
            }
        }
        return breaches;
    }

    /**
     * Most restrictive verdict; the earliest in rule order wins a tie.
     */
    static RuleVerdict mostRestrictive(List<RuleVerdict> breaches) {
        RuleVerdict winner = breaches.get(0);
        for (RuleVerdict candidate : breaches) {
            if (candidate.getAction().isMoreRestrictiveThan(winner.getAction())) {
                winner = candidate;
            }
        }
        return winner;
    }

    private CompletableFuture<EnforcementResult> dispatch(Lane lane, RuleVerdict verdict) {
        String accountId = lane.accountId;
        CompletableFuture<EnforcementResult> future =
                CompletableFuture.supplyAsync(() -> enforcementExecutor.enforce(accountId, verdict), enforcementWorker);
        lane.inFlight = future;
        future.whenComplete((result, error) -> {
            if (error != null) {
                log.error("stage=enforcement.crashed account={} action={}: {}", accountId, verdict.getAction(), error.getMessage(), error);
            }
            inbound.add(Work.drain(accountId));
        });
        return future;
    }

    // ==============================
    // BACKGROUND TICK
    // ==============================

    /**
     * Fires expired timers, sweeps expired hard lockouts and retries stalled lanes.
     */
    @Scheduled(fixedRateString = "${riskguard.engine.tick-interval-ms:1000}")
    public void tick() {
        try {
            int fired = context.getTimerManager().tick(this::onTimerExpired);
            int swept = context.getLockoutManager().sweepExpired();
            if (fired > 0 || swept > 0) {
                log.debug("stage=tick timersFired={} lockoutsSwept={}", fired, swept);
            }
        } catch (PersistenceException e) {
            log.error("stage=tick.failed: {}", e.getMessage());
        }
        lanes.values().forEach(lane -> {
            if (lane.stalled) {
                lane.stalled = false;
                inbound.add(Work.drain(lane.accountId));
            }
        });
    }

    void onTimerExpired(Timer timer) {
        TimerAction action = timer.getAction();
        if (action instanceof TimerAction.ClearLockout) {
            TimerAction.ClearLockout clear = (TimerAction.ClearLockout) action;
            Lockout lockout = context.getLockoutManager().info(clear.accountId(), clear.symbol());
            if (lockout != null && lockout.getKind() == LockoutKind.COOLDOWN) {
                context.getLockoutManager().clear(clear.accountId(), clear.symbol(), "cooldown expired");
            }
        } else if (action instanceof TimerAction.CheckStopLoss) {
            TimerAction.CheckStopLoss check = (TimerAction.CheckStopLoss) action;
            ruleSet.find(NoStopLossGraceRule.class).ifPresent(rule -> {
                RuleVerdict verdict = rule.onGraceExpired(check, context);
                if (verdict.isBreached()) {
                    log.warn("stage=rule.breach rule={} account={} action={} reason={}",
                            rule.kind().getConfigName(), check.accountId(), verdict.getAction(), verdict.getReason());
                    eventPublisherHelper.publishRuleBreach(this, check.accountId(), verdict, true);
                    inbound.add(Work.verdict(check.accountId(), verdict));
                }
            });
        } else {
            log.warn("Unknown timer action {} on timer {}", action.type(), timer.getName());
        }
    }

    // ==============================
    // SHUTDOWN AND STATS
    // ==============================

    /**
     * Stops accepting events, stops the loop and waits for in-flight enforcement.
     *
     * @return true if all enforcement finished within the timeout
     */
    public boolean shutdown(Duration timeout) {
        accepting.set(false);
        running = false;
        Thread thread = loopThread;
        if (thread != null) {
            try {
                thread.join(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        CompletableFuture<?>[] inFlight = lanes.values().stream()
                .map(lane -> lane.inFlight)
                .filter(future -> future != null && !future.isDone())
                .toArray(CompletableFuture[]::new);
        boolean completed = true;
        if (inFlight.length > 0) {
            log.info("Waiting for {} in-flight enforcement actions", inFlight.length);
            try {
                CompletableFuture.allOf(inFlight).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                completed = false;
                log.warn("stage=shutdown.timeout {} enforcement actions still running after {}ms", inFlight.length, timeout.toMillis());
            } catch (ExecutionException e) {
                log.error("Enforcement failed during shutdown: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                completed = false;
            }
        }

        int unprocessed = inbound.size() + lanes.values().stream().mapToInt(lane -> lane.backlog.size()).sum();
        if (unprocessed > 0) {
            log.warn("stage=shutdown.dropped {} queued work items were not processed", unprocessed);
        }
        return completed;
    }

    public long getProcessedEvents() {
        return processedEvents.get();
    }

    public int getQueueDepth() {
        return inbound.size();
    }

    public int inFlightCount() {
        return (int) lanes.values().stream().filter(Lane::isBusy).count();
    }

    private Lane lane(String accountId) {
        return lanes.computeIfAbsent(accountId, Lane::new);
    }

    // ==============================
    // INTERNALS
    // ==============================

    private enum WorkType {
        EVENT,
        VERDICT,
        DRAIN
    }

    private record Work(WorkType type, String accountId, RiskEvent event, RuleVerdict verdict) {

        static Work event(RiskEvent event) {
            return new Work(WorkType.EVENT, event.getAccountId(), event, null);
        }

        static Work verdict(String accountId, RuleVerdict verdict) {
            return new Work(WorkType.VERDICT, accountId, null, verdict);
        }

        static Work drain(String accountId) {
            return new Work(WorkType.DRAIN, accountId, null, null);
        }
    }

    /** Per-account ordering state. Only touched from the thread running {@link #handle}. */
    private static final class Lane {

        private final String accountId;
        private final Deque<Work> backlog = new ArrayDeque<>();
        private volatile CompletableFuture<EnforcementResult> inFlight;
        private volatile boolean stalled;

        private Lane(String accountId) {
            this.accountId = accountId;
        }

        private boolean isBusy() {
            return stalled || (inFlight != null && !inFlight.isDone());
        }
    }
}
