package dao.sol.bundler.scheduler;

import dao.sol.bundler.config.VolumeProperties;
import dao.sol.bundler.exception.AlreadyRunningException;
import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.exception.DispatchFailedException;
import dao.sol.bundler.model.AmountSpec;
import dao.sol.bundler.model.BundleMode;
import dao.sol.bundler.model.DispatchResult;
import dao.sol.bundler.model.SessionSummary;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.TradeSide;
import dao.sol.bundler.model.VolumeSession;
import dao.sol.bundler.model.VolumeSessionConfig;
import dao.sol.bundler.model.VolumeStats;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.repository.SessionRepository;
import dao.sol.bundler.service.BundleRelayClient;
import dao.sol.bundler.service.DispatchOrchestrator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs one volume trading session at a time: a randomized buy/sell loop over a wallet pool.
 *
 * Each cycle picks a direction, a wallet and an amount, dispatches a single-wallet trade through the retry
 * policy, records the outcome and re-arms itself with a freshly drawn delay. State is guarded by this object's
 * monitor; the dispatch itself runs outside the lock. Every attempt first checks that its session is still the
 * current one, so a stop during backoff ends the retries, and a result that arrives after a stop is dropped.
 */
@Slf4j
@Component
public class VolumeTradingScheduler {

    private final DispatchOrchestrator orchestrator;
    private final BundleRelayClient relayClient;
    private final RetryExecutor retryExecutor;
    private final TradePlanner planner;
    private final SessionRepository sessionRepository;
    private final VolumeProperties props;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    private VolumeSession session;
    private VolumeStats lastStats;

    public VolumeTradingScheduler(DispatchOrchestrator orchestrator,
                                  BundleRelayClient relayClient,
                                  RetryExecutor retryExecutor,
                                  TradePlanner planner,
                                  SessionRepository sessionRepository,
                                  VolumeProperties props,
                                  @Qualifier("volumeTaskScheduler") TaskScheduler taskScheduler,
                                  Clock clock) {
        this.orchestrator = orchestrator;
        this.relayClient = relayClient;
        this.retryExecutor = retryExecutor;
        this.planner = planner;
        this.sessionRepository = sessionRepository;
        this.props = props;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    /**
     * @return the new session id
     * @throws AlreadyRunningException if a session is active
     * @throws ConfigurationException if the relay is not configured or the session config is invalid
     */
    public synchronized String start(VolumeSessionConfig config) {
        if (session != null) {
            throw new AlreadyRunningException(session.getSessionId());
        }
        relayClient.checkConfigured();
        validate(config);

        VolumeSession s = new VolumeSession(UUID.randomUUID().toString(), config);
        s.setRunning(true);
        s.getStats().setStartTime(clock.millis());
        s.getStats().setRunning(true);
        session = s;

        scheduleCycle(s, props.getWarmupMs());
        if (config.getDurationMinutes() > 0) {
            ScheduledFuture<?> expiry = taskScheduler.schedule(() -> expire(s),
                    clock.instant().plus(Duration.ofMinutes(config.getDurationMinutes())));
            s.getTimers().add(expiry);
        }

        log.info("Volume session {} started: token={}, wallets={}, amount=[{}, {}] SOL, interval=[{}, {}] s, duration={} min",
                s.getSessionId(), config.getTokenAddress(), config.getWallets().size(),
                config.getMinAmount(), config.getMaxAmount(), config.getIntervalMin(), config.getIntervalMax(),
                config.getDurationMinutes());
        return s.getSessionId();
    }

    /**
     * Cancels pending cycles without waiting for an in-flight trade. No-op when idle.
     *
     * @return final stats of the stopped session, or the last known stats when idle
     */
    public synchronized VolumeStats stop() {
        if (session == null) {
            return getStats();
        }
        VolumeSession s = session;
        session = null;
        s.setRunning(false);
        s.getStats().setRunning(false);
        for (ScheduledFuture<?> timer : s.getTimers()) {
            timer.cancel(false);
        }
        s.getTimers().clear();

        lastStats = s.getStats().copy();
        sessionRepository.save(new SessionSummary(s.getSessionId(), s.getConfig().getTokenAddress(),
                lastStats.getStartTime(), clock.millis(), lastStats));
        log.info("Volume session {} stopped: trades={}, ok={}, failed={}, volume={} SOL",
                s.getSessionId(), lastStats.getTotalTrades(), lastStats.getSuccessfulTrades(),
                lastStats.getFailedTrades(), lastStats.getTotalVolume());
        return lastStats.copy();
    }

    public synchronized VolumeStats getStats() {
        if (session != null) return session.getStats().copy();
        return lastStats != null ? lastStats.copy() : new VolumeStats();
    }

    public synchronized boolean isActive() {
        return session != null;
    }

    public synchronized Optional<String> currentSessionId() {
        return session != null ? Optional.of(session.getSessionId()) : Optional.empty();
    }

    /**
     * Live summary for the running session, otherwise the stored summary of a finished one.
     */
    public synchronized Optional<SessionSummary> getSession(String sessionId) {
        if (session != null && session.getSessionId().equals(sessionId)) {
            VolumeStats stats = session.getStats().copy();
            return Optional.of(new SessionSummary(sessionId, session.getConfig().getTokenAddress(),
                    stats.getStartTime(), 0L, stats));
        }
        return sessionRepository.findBySessionId(sessionId);
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    void runCycle(VolumeSession s) {
        try {
            executeTrade(s);
        } catch (RuntimeException e) {
            log.error("Volume cycle of session {} failed unexpectedly", s.getSessionId(), e);
        } finally {
            rearm(s);
        }
    }

    private void executeTrade(VolumeSession s) {
        TradePlan plan;
        synchronized (this) {
            if (session != s || !s.isRunning()) return;
            plan = plan(s);
        }

        boolean ok;
        try {
            retryExecutor.withRetry(() -> {
                if (!isCurrent(s)) {
                    throw new CancellationException("Session " + s.getSessionId() + " was stopped");
                }
                return dispatchOnce(s.getConfig(), plan);
            });
            ok = true;
            log.info("Session {}: {} with wallet #{} succeeded", s.getSessionId(), plan.describe(), plan.walletIndex());
        } catch (CancellationException e) {
            log.info("Session {}: {} abandoned, {}", s.getSessionId(), plan.describe(), e.getMessage());
            return;
        } catch (Exception e) {
            ok = false;
            log.warn("Session {}: {} with wallet #{} failed: {}", s.getSessionId(), plan.describe(), plan.walletIndex(), e.getMessage());
        }

        synchronized (this) {
            if (session != s) {
                log.debug("Discarding result of stopped session {}", s.getSessionId());
                return;
            }
            record(s.getStats(), plan, ok);
        }
    }

    private synchronized boolean isCurrent(VolumeSession s) {
        return session == s && s.isRunning();
    }

    private synchronized void rearm(VolumeSession s) {
        if (session != s || !s.isRunning()) return;
        s.getTimers().removeIf(ScheduledFuture::isDone);
        scheduleCycle(s, planner.nextDelayMs(s.getConfig()));
    }

    private void scheduleCycle(VolumeSession s, long delayMs) {
        ScheduledFuture<?> next = taskScheduler.schedule(() -> runCycle(s), clock.instant().plusMillis(delayMs));
        s.getTimers().add(next);
        log.debug("Session {}: next trade in {} ms", s.getSessionId(), delayMs);
    }

    private synchronized void expire(VolumeSession s) {
        if (session != s) return;
        log.info("Volume session {} reached its configured duration", s.getSessionId());
        stop();
    }

    /**
     * Direction and wallet are recorded as soon as they are chosen so the next cycle's rotation and bias
     * apply even if this trade fails.
     */
    private TradePlan plan(VolumeSession s) {
        VolumeSessionConfig config = s.getConfig();
        TradeSide side = planner.nextSide(s.getLastTradeDirection());
        int walletIndex = planner.nextWalletIndex(config.getWallets().size(), s.getLastUsedWalletIndex());
        s.setLastTradeDirection(side);
        s.setLastUsedWalletIndex(walletIndex);

        if (side == TradeSide.BUY) {
            BigDecimal amount = planner.nextBuyAmount(config.getMinAmount(), config.getMaxAmount());
            return new TradePlan(walletIndex, config.getWallets().get(walletIndex), side, amount, null);
        }
        return new TradePlan(walletIndex, config.getWallets().get(walletIndex), side, null, planner.nextSellPercent(config));
    }

    private DispatchResult dispatchOnce(VolumeSessionConfig config, TradePlan plan) {
        AmountSpec amount = plan.side() == TradeSide.BUY
                ? AmountSpec.buy(plan.amount())
                : AmountSpec.sell(BigDecimal.valueOf(plan.sellPercent()));
        TradeIntent intent = TradeIntent.builder()
                .tokenAddress(config.getTokenAddress())
                .protocol(config.getProtocol())
                .amountSpec(amount)
                .slippageBps(config.getSlippageBps())
                .bundleMode(BundleMode.SINGLE)
                .singleDelayMs(0L)
                .build();
        DispatchResult result = orchestrator.dispatch(List.of(plan.wallet()), intent);
        if (!result.success()) {
            throw new DispatchFailedException(result);
        }
        return result;
    }

    private static void record(VolumeStats stats, TradePlan plan, boolean ok) {
        stats.setTotalTrades(stats.getTotalTrades() + 1);
        if (!ok) {
            stats.setFailedTrades(stats.getFailedTrades() + 1);
            return;
        }
        stats.setSuccessfulTrades(stats.getSuccessfulTrades() + 1);
        if (plan.side() == TradeSide.BUY) {
            stats.setTotalBuys(stats.getTotalBuys() + 1);
            stats.setTotalVolume(stats.getTotalVolume().add(plan.amount()));
        } else {
            stats.setTotalSells(stats.getTotalSells() + 1);
        }
    }

    private static void validate(VolumeSessionConfig config) {
        if (config == null) {
            throw new ConfigurationException("Session config is required");
        }
        if (config.getTokenAddress() == null || config.getTokenAddress().isBlank()) {
            throw new ConfigurationException("Invalid token address");
        }
        if (config.getWallets() == null || config.getWallets().isEmpty()) {
            throw new ConfigurationException("No wallets provided");
        }
        for (WalletCredential w : config.getWallets()) {
            if (w == null || w.address() == null || w.address().isBlank()) {
                throw new ConfigurationException("Invalid wallet data");
            }
        }
        if (config.getMinAmount() == null || config.getMaxAmount() == null
                || config.getMinAmount().signum() <= 0 || config.getMaxAmount().compareTo(config.getMinAmount()) < 0) {
            throw new ConfigurationException("Amount range must satisfy 0 < minAmount <= maxAmount");
        }
        if (config.getIntervalMin() < 0 || config.getIntervalMax() < config.getIntervalMin()) {
            throw new ConfigurationException("Interval range must satisfy 0 <= intervalMin <= intervalMax");
        }
        if (config.getDurationMinutes() < 0) {
            throw new ConfigurationException("Duration must not be negative");
        }
        if (config.getSellPercent() != null && (config.getSellPercent() <= 0 || config.getSellPercent() > 100)) {
            throw new ConfigurationException("Sell percent must be between 1 and 100");
        }
    }

    private record TradePlan(int walletIndex, WalletCredential wallet, TradeSide side, BigDecimal amount, Integer sellPercent) {
        String describe() {
            return side == TradeSide.BUY ? "buy " + amount + " SOL" : "sell " + sellPercent + "%";
        }
    }
}
