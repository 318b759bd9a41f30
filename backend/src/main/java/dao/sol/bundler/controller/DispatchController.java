package dao.sol.bundler.controller;

import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.model.AmountSpec;
import dao.sol.bundler.model.BundleMode;
import dao.sol.bundler.model.DispatchRequest;
import dao.sol.bundler.model.DispatchResult;
import dao.sol.bundler.model.DispatchUnitResult;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.TradeSide;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.service.DispatchOrchestrator;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/dispatch")
public class DispatchController {

    private final DispatchOrchestrator orchestrator;

    public DispatchController(DispatchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * POST /api/dispatch
     * Prepares, signs and relays a buy or sell for every wallet in the request.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> dispatch(@Valid @RequestBody DispatchRequest req) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            DispatchResult result = orchestrator.dispatch(toCredentials(req), toIntent(req));
            response.put("success", result.success());
            if (result.error() != null) {
                response.put("error", result.error());
            }
            response.put("succeeded", result.succeededUnits());
            response.put("failed", result.failedUnits());
            response.put("units", describe(result.units()));
            return ResponseEntity.ok(response);
        } catch (ConfigurationException e) {
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (Exception e) {
            log.error("Dispatch failed", e);
            response.put("success", false);
            response.put("error", e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    static TradeIntent toIntent(DispatchRequest req) {
        TradeSide side = req.getSide() != null ? req.getSide() : TradeSide.BUY;
        AmountSpec amount;
        if (side == TradeSide.SELL) {
            if (req.getSellPercent() == null || req.getSellPercent().signum() <= 0) {
                throw new ConfigurationException("Invalid sell percent");
            }
            amount = AmountSpec.sell(req.getSellPercent());
        } else {
            if (req.getSolAmount() == null || req.getSolAmount().signum() <= 0) {
                throw new ConfigurationException("Invalid SOL amount");
            }
            if (req.getAmounts() != null && req.getAmounts().stream().anyMatch(a -> a == null || a.signum() <= 0)) {
                throw new ConfigurationException("All custom amounts must be positive numbers");
            }
            amount = AmountSpec.buy(req.getSolAmount(), req.getAmounts());
        }
        if (req.getSlippageBps() != null && req.getSlippageBps() < 0) {
            throw new ConfigurationException("Invalid slippage value");
        }
        return TradeIntent.builder()
                .tokenAddress(req.getTokenAddress())
                .protocol(req.getProtocol() != null && !req.getProtocol().isBlank() ? req.getProtocol() : "auto")
                .amountSpec(amount)
                .slippageBps(req.getSlippageBps())
                .tipLamports(req.getTipLamports())
                .bundleMode(BundleMode.fromValue(req.getBundleMode()))
                .batchDelayMs(req.getBatchDelayMs())
                .singleDelayMs(req.getSingleDelayMs())
                .build();
    }

    private static List<WalletCredential> toCredentials(DispatchRequest req) {
        List<WalletCredential> out = new ArrayList<>(req.getWallets().size());
        for (DispatchRequest.Wallet w : req.getWallets()) {
            if (w.getAddress() != null && !w.getAddress().isBlank()) {
                out.add(new WalletCredential(w.getAddress(), w.getPrivateKey()));
                continue;
            }
            try {
                out.add(WalletCredential.fromPrivateKey(w.getPrivateKey()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid wallet data: " + e.getMessage());
            }
        }
        return out;
    }

    private static List<Map<String, Object>> describe(List<DispatchUnitResult> units) {
        List<Map<String, Object>> out = new ArrayList<>(units.size());
        for (DispatchUnitResult u : units) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("unit", u.unit());
            info.put("success", u.success());
            if (u.error() != null) info.put("error", u.error());
            info.put("results", u.acks().stream().map(a -> a.result()).toList());
            out.add(info);
        }
        return out;
    }
}
