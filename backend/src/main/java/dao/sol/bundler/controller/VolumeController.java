package dao.sol.bundler.controller;

import dao.sol.bundler.exception.AlreadyRunningException;
import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.model.SessionSummary;
import dao.sol.bundler.model.VolumeSessionConfig;
import dao.sol.bundler.model.VolumeStartRequest;
import dao.sol.bundler.model.VolumeStats;
import dao.sol.bundler.model.WalletBalance;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.model.WalletListRequest;
import dao.sol.bundler.model.WalletValidation;
import dao.sol.bundler.repository.SessionRepository;
import dao.sol.bundler.scheduler.VolumeTradingScheduler;
import dao.sol.bundler.service.WalletService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Session control for the volume trading loop, plus wallet checks used before starting one.
 */
@Slf4j
@RestController
@RequestMapping("/api/volume")
public class VolumeController {

    private final VolumeTradingScheduler scheduler;
    private final WalletService walletService;
    private final SessionRepository sessionRepository;

    public VolumeController(VolumeTradingScheduler scheduler,
                            WalletService walletService,
                            SessionRepository sessionRepository) {
        this.scheduler = scheduler;
        this.walletService = walletService;
        this.sessionRepository = sessionRepository;
    }

    /**
     * POST /api/volume/start
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@Valid @RequestBody VolumeStartRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            String sessionId = scheduler.start(toConfig(req));
            response.put("success", true);
            response.put("sessionId", sessionId);
            response.put("message", "Volume session started");
            return ResponseEntity.ok(response);
        } catch (AlreadyRunningException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            response.put("sessionId", e.getSessionId());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        } catch (ConfigurationException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("Error starting volume session", e);
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    /**
     * POST /api/volume/stop
     * Idempotent; returns the final stats of the stopped session.
     */
    @PostMapping("/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        Map<String, Object> response = new LinkedHashMap<>();
        VolumeStats stats = scheduler.stop();
        response.put("success", true);
        response.put("stats", stats);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/volume/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("isRunning", scheduler.isActive());
        scheduler.currentSessionId().ifPresent(id -> response.put("sessionId", id));
        response.put("stats", scheduler.getStats());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/volume/status/{sessionId}
     */
    @GetMapping("/status/{sessionId}")
    public ResponseEntity<Map<String, Object>> sessionStatus(@PathVariable String sessionId) {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<SessionSummary> summary = scheduler.getSession(sessionId);
        if (summary.isEmpty()) {
            response.put("success", false);
            response.put("error", "Session not found: " + sessionId);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("success", true);
        response.put("sessionId", sessionId);
        response.put("isRunning", summary.get().stoppedAt() == 0L);
        response.put("startedAt", summary.get().startedAt());
        response.put("stoppedAt", summary.get().stoppedAt());
        response.put("stats", summary.get().stats());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/volume/sessions
     * Finished sessions, oldest first.
     */
    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> sessions() {
        Map<String, Object> response = new LinkedHashMap<>();
        List<SessionSummary> all = sessionRepository.findAll();
        response.put("success", true);
        response.put("totalSessions", all.size());
        response.put("sessions", all);
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/volume/validate-wallets
     */
    @PostMapping("/validate-wallets")
    public ResponseEntity<Map<String, Object>> validateWallets(@Valid @RequestBody WalletListRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        WalletValidation validation = walletService.validateWallets(req.getWallets());
        response.put("success", true);
        response.put("validWallets", validation.valid());
        response.put("invalidWallets", validation.invalid());
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/volume/wallet-balances
     */
    @PostMapping("/wallet-balances")
    public ResponseEntity<Map<String, Object>> walletBalances(@Valid @RequestBody WalletListRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        List<WalletBalance> balances = walletService.getWalletBalances(req.getWallets());
        response.put("success", true);
        response.put("balances", balances);
        return ResponseEntity.ok(response);
    }

    private static VolumeSessionConfig toConfig(VolumeStartRequest req) {
        List<WalletCredential> wallets = new ArrayList<>(req.getWallets().size());
        for (int i = 0; i < req.getWallets().size(); i++) {
            try {
                wallets.add(WalletCredential.fromPrivateKey(req.getWallets().get(i)));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid private key for wallet #" + i + ": " + e.getMessage());
            }
        }
        return VolumeSessionConfig.builder()
                .tokenAddress(req.getTokenAddress())
                .protocol(req.getProtocol() != null && !req.getProtocol().isBlank() ? req.getProtocol() : "auto")
                .wallets(wallets)
                .minAmount(req.getMinAmount())
                .maxAmount(req.getMaxAmount())
                .intervalMin(req.getIntervalMin())
                .intervalMax(req.getIntervalMax())
                .durationMinutes(req.getDuration())
                .slippageBps(req.getSlippageBps())
                .sellPercent(req.getSellPercent())
                .build();
    }
}
