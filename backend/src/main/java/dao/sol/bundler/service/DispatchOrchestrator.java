package dao.sol.bundler.service;

import dao.sol.bundler.config.DispatchProperties;
import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.model.AmountSpec;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.DispatchResult;
import dao.sol.bundler.model.DispatchUnitResult;
import dao.sol.bundler.model.RelayAck;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.util.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Prepares, signs and relays bundles for a set of wallets in one of three topologies.
 *
 * <ul>
 *   <li>single: one wallet at a time, {@code singleDelayMs} between wallets</li>
 *   <li>batch: consecutive groups of {@code batchSize} wallets, {@code batchDelayMs} between groups</li>
 *   <li>all-in-one: one preparation call for all wallets, sub-bundle k handed to the dispatch pool at
 *   {@code k * staggerMs} after the start, independent of the pool size</li>
 * </ul>
 *
 * A failing unit (wallet, group or sub-bundle) is counted and never stops its siblings. Units an interrupt
 * keeps from running are counted as failed. Only configuration errors are thrown, and always before any
 * network call.
 */
@Slf4j
@Service
public class DispatchOrchestrator {

    private static final String INTERRUPTED = "Interrupted before dispatch";

    private final BundlePreparationClient preparationClient;
    private final BundleSigner signer;
    private final BundleSplitter splitter;
    private final BundleRelayClient relayClient;
    private final RateLimiter rateLimiter;
    private final DispatchProperties props;
    private final ExecutorService executor;
    private final TaskScheduler staggerScheduler;
    private final Clock clock;
    private final Sleeper sleeper;

    public DispatchOrchestrator(BundlePreparationClient preparationClient,
                                BundleSigner signer,
                                BundleSplitter splitter,
                                BundleRelayClient relayClient,
                                RateLimiter rateLimiter,
                                DispatchProperties props,
                                @Qualifier("dispatchExecutor") ExecutorService executor,
                                @Qualifier("staggerTaskScheduler") TaskScheduler staggerScheduler,
                                Clock clock,
                                Sleeper sleeper) {
        this.preparationClient = preparationClient;
        this.signer = signer;
        this.splitter = splitter;
        this.relayClient = relayClient;
        this.rateLimiter = rateLimiter;
        this.props = props;
        this.executor = executor;
        this.staggerScheduler = staggerScheduler;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public DispatchResult dispatch(List<WalletCredential> wallets, TradeIntent intent) {
        validate(wallets, intent);
        relayClient.checkConfigured();

        log.info("Dispatching {} {} for {} wallet(s) in {} mode (protocol={})",
                intent.side(), intent.getTokenAddress(), wallets.size(), intent.getBundleMode().value(), intent.getProtocol());

        DispatchResult result = switch (intent.getBundleMode()) {
            case SINGLE -> dispatchSingle(wallets, intent);
            case BATCH -> dispatchBatch(wallets, intent);
            case ALL_IN_ONE -> dispatchAllInOne(wallets, intent);
        };

        if (result.error() != null) {
            log.warn("Dispatch finished: success={}, {}", result.success(), result.error());
        } else {
            log.info("Dispatch finished: {} unit(s) succeeded", result.succeededUnits());
        }
        return result;
    }

    private DispatchResult dispatchSingle(List<WalletCredential> wallets, TradeIntent intent) {
        long delay = intent.getSingleDelayMs() != null ? intent.getSingleDelayMs() : props.getSingleDelayMs();
        List<DispatchUnitResult> units = new ArrayList<>();

        for (int i = 0; i < wallets.size(); i++) {
            String label = walletLabel(wallets, i);
            log.info("Processing {}", label);

            units.add(runUnit(label, List.of(wallets.get(i)), intent.slice(i, i + 1)));

            if (i < wallets.size() - 1 && !sleeper.sleepQuietly(delay)) {
                log.warn("Dispatch interrupted after {}, {} wallet(s) not sent", label, wallets.size() - i - 1);
                for (int j = i + 1; j < wallets.size(); j++) {
                    units.add(DispatchUnitResult.failed(walletLabel(wallets, j), INTERRUPTED));
                }
                break;
            }
        }
        return DispatchResult.aggregate(units);
    }

    private DispatchResult dispatchBatch(List<WalletCredential> wallets, TradeIntent intent) {
        int batchSize = Math.max(1, props.getBatchSize());
        long delay = intent.getBatchDelayMs() != null ? intent.getBatchDelayMs() : props.getBatchDelayMs();
        int groups = (wallets.size() + batchSize - 1) / batchSize;
        log.info("Processing {} batch(es) of up to {} wallets each", groups, batchSize);

        List<DispatchUnitResult> units = new ArrayList<>();
        for (int g = 0; g < groups; g++) {
            int from = g * batchSize;
            int to = Math.min(from + batchSize, wallets.size());
            String label = "batch " + (g + 1) + "/" + groups;
            log.info("Processing {} with {} wallet(s)", label, to - from);

            units.add(runUnit(label, wallets.subList(from, to), intent.slice(from, to)));

            if (g < groups - 1 && !sleeper.sleepQuietly(delay)) {
                log.warn("Dispatch interrupted after {}, {} batch(es) not sent", label, groups - g - 1);
                for (int h = g + 1; h < groups; h++) {
                    units.add(DispatchUnitResult.failed("batch " + (h + 1) + "/" + groups, INTERRUPTED));
                }
                break;
            }
        }
        return DispatchResult.aggregate(units);
    }

    private DispatchResult dispatchAllInOne(List<WalletCredential> wallets, TradeIntent intent) {
        List<Bundle> prepared;
        try {
            prepared = preparationClient.prepare(addresses(wallets), intent);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Preparing bundles for {} wallets failed: {}", wallets.size(), e.getMessage());
            return DispatchResult.failure(e.getMessage(), e);
        }
        if (prepared.stream().allMatch(Bundle::isEmpty)) {
            return DispatchResult.failure("No transactions generated.", null);
        }

        List<Bundle> split = splitter.split(prepared);
        List<DispatchUnitResult> units = new ArrayList<>();
        List<Bundle> ready = new ArrayList<>();
        for (int i = 0; i < split.size(); i++) {
            Bundle bundle = split.get(i);
            if (bundle.isEmpty()) continue;
            try {
                Bundle signed = signer.sign(bundle, wallets, intent);
                if (!signed.isEmpty()) {
                    ready.addAll(splitter.split(List.of(signed)));
                }
            } catch (RuntimeException e) {
                log.error("Signing bundle {} failed: {}", i + 1, e.getMessage());
                units.add(DispatchUnitResult.failed("bundle " + (i + 1) + " (signing)", e));
            }
        }
        if (ready.isEmpty() && units.isEmpty()) {
            return DispatchResult.failure("Failed to sign any transactions", null);
        }

        log.info("Sending {} bundle(s) concurrently, staggered by {} ms", ready.size(), props.getStaggerMs());
        Instant start = clock.instant();
        List<CompletableFuture<DispatchUnitResult>> futures = new ArrayList<>(ready.size());
        for (int i = 0; i < ready.size(); i++) {
            futures.add(submitAt(i, ready.get(i), start.plusMillis(props.getStaggerMs() * i)));
        }

        for (int i = 0; i < futures.size(); i++) {
            String label = "bundle " + (i + 1);
            try {
                units.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("{} task failed: {}", label, cause.getMessage());
                units.add(DispatchUnitResult.failed(label, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                units.add(DispatchUnitResult.failed(label, "Interrupted while waiting for submission"));
            }
        }
        return DispatchResult.aggregate(units);
    }

    /**
     * The scheduler thread only hands the send over to the dispatch pool, so a busy pool delays a send but never
     * shifts the start of the ones after it.
     */
    private CompletableFuture<DispatchUnitResult> submitAt(int index, Bundle bundle, Instant at) {
        CompletableFuture<DispatchUnitResult> future = new CompletableFuture<>();
        Runnable send = () -> future.complete(submit(index, bundle));
        try {
            staggerScheduler.schedule(() -> {
                try {
                    executor.execute(send);
                } catch (RejectedExecutionException e) {
                    future.completeExceptionally(e);
                }
            }, at);
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private DispatchUnitResult submit(int index, Bundle bundle) {
        String label = "bundle " + (index + 1);
        try {
            rateLimiter.acquire();
            RelayAck ack = relayClient.send(bundle);
            log.info("{} sent successfully", label);
            return DispatchUnitResult.succeeded(label, List.of(ack));
        } catch (RuntimeException e) {
            log.error("Error sending {}: {}", label, e.getMessage());
            return DispatchUnitResult.failed(label, e);
        }
    }

    /**
     * Prepare, sign and relay for one wallet or group. Any failure other than configuration becomes a failed unit.
     */
    private DispatchUnitResult runUnit(String label, List<WalletCredential> unitWallets, TradeIntent unitIntent) {
        try {
            List<Bundle> prepared = preparationClient.prepare(addresses(unitWallets), unitIntent);

            List<Bundle> signed = new ArrayList<>();
            for (Bundle bundle : splitter.split(prepared)) {
                if (bundle.isEmpty()) continue;
                Bundle s = signer.sign(bundle, unitWallets, unitIntent);
                if (!s.isEmpty()) signed.add(s);
            }
            // a prepended side-payment may push a bundle past the limit
            signed = splitter.split(signed);
            if (signed.isEmpty()) {
                log.warn("No transactions for {}", label);
                return DispatchUnitResult.failed(label, "No transactions for " + label);
            }

            List<RelayAck> acks = new ArrayList<>(signed.size());
            for (Bundle bundle : signed) {
                rateLimiter.acquire();
                acks.add(relayClient.send(bundle));
            }
            return DispatchUnitResult.succeeded(label, acks);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error processing {}: {}", label, e.getMessage());
            return DispatchUnitResult.failed(label, e);
        }
    }

    private static void validate(List<WalletCredential> wallets, TradeIntent intent) {
        if (intent == null) {
            throw new ConfigurationException("Trade intent is required");
        }
        if (intent.getBundleMode() == null) {
            throw new ConfigurationException("Bundle mode is required. Must be 'single', 'batch', or 'all-in-one'");
        }
        if (wallets == null || wallets.isEmpty()) {
            throw new ConfigurationException("No wallets provided");
        }
        for (WalletCredential w : wallets) {
            if (w == null || isBlank(w.address()) || isBlank(w.privateKey())) {
                throw new ConfigurationException("Invalid wallet data");
            }
        }
        if (isBlank(intent.getTokenAddress())) {
            throw new ConfigurationException("Invalid token address");
        }
        AmountSpec amount = intent.getAmountSpec();
        if (amount == null) {
            throw new ConfigurationException("Trade amount is required");
        }
        if (amount.hasOverrides() && amount.amounts().size() != wallets.size()) {
            throw new ConfigurationException("Custom amounts array length must match wallets array length");
        }
    }

    private static List<String> addresses(List<WalletCredential> wallets) {
        return wallets.stream().map(WalletCredential::address).toList();
    }

    private static String walletLabel(List<WalletCredential> wallets, int i) {
        return "wallet " + (i + 1) + "/" + wallets.size() + " (" + shortAddress(wallets.get(i).address()) + ")";
    }

    private static String shortAddress(String address) {
        return address.length() > 8 ? address.substring(0, 8) + "..." : address;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
