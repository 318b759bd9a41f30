package dao.sol.bundler.service;

import com.fasterxml.jackson.databind.JsonNode;
import dao.sol.bundler.config.TradingServerProperties;
import dao.sol.bundler.model.WalletBalance;
import dao.sol.bundler.model.WalletValidation;
import dao.sol.bundler.util.SolanaKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Wallet key validation and balance lookup.
 *
 * Uses the remote wallet service when one is configured; otherwise, or when that call fails, keys are checked
 * locally and balances come back without a live SOL amount.
 */
@Slf4j
@Service
public class WalletService {

    static final String INVALID = "Invalid";

    private final TradingServerProperties props;
    private final RestClient restClient;

    public WalletService(TradingServerProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.build();
    }

    public WalletValidation validateWallets(List<String> privateKeys) {
        JsonNode remote = callRemote("/api/volume/validate-wallets", privateKeys);
        if (remote != null && remote.path("validWallets").isArray()) {
            return new WalletValidation(toStrings(remote.path("validWallets")), toStrings(remote.path("invalidWallets")));
        }
        return validateLocally(privateKeys);
    }

    public List<WalletBalance> getWalletBalances(List<String> privateKeys) {
        JsonNode remote = callRemote("/api/volume/wallet-balances", privateKeys);
        if (remote != null && remote.path("balances").isArray()) {
            List<WalletBalance> out = new ArrayList<>();
            for (JsonNode b : remote.path("balances")) {
                Double sol = b.hasNonNull("solBalance") ? b.path("solBalance").asDouble() : null;
                out.add(new WalletBalance(b.path("wallet").asText(), sol, b.path("publicKey").asText(null)));
            }
            return out;
        }
        return balancesLocally(privateKeys);
    }

    /**
     * Valid means the key decodes to 32 or 64 bytes and, for 64 bytes, carries its own public key.
     */
    public static WalletValidation validateLocally(List<String> privateKeys) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String key : privateKeys) {
            if (SolanaKeys.isConsistent(key)) {
                valid.add(key);
            } else {
                invalid.add(key);
            }
        }
        return new WalletValidation(valid, invalid);
    }

    static List<WalletBalance> balancesLocally(List<String> privateKeys) {
        List<WalletBalance> out = new ArrayList<>(privateKeys.size());
        for (String key : privateKeys) {
            String publicKey = SolanaKeys.isConsistent(key) ? SolanaKeys.addressOf(key) : INVALID;
            out.add(new WalletBalance(maskKey(key), null, publicKey));
        }
        return out;
    }

    private JsonNode callRemote(String path, List<String> privateKeys) {
        String baseUrl = HttpBundlePreparationClient.stripTrailingSlashes(props.getWalletServiceUrl());
        if (baseUrl.isEmpty()) return null;
        try {
            JsonNode response = restClient.post()
                    .uri(baseUrl + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("wallets", privateKeys))
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null || !response.path("success").asBoolean(false)) {
                log.warn("Wallet service {} reported failure, using local fallback", path);
                return null;
            }
            return response;
        } catch (RestClientException e) {
            log.warn("Wallet service {} unavailable, using local fallback: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Display label for a private key: its first 8 characters.
     */
    static String maskKey(String key) {
        if (key == null) return "";
        return key.length() > 8 ? key.substring(0, 8) + "..." : key;
    }

    private static List<String> toStrings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(n -> out.add(n.asText()));
        }
        return out;
    }
}
