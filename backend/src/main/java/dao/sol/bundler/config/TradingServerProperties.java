package dao.sol.bundler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "trading-server")
@Data
public class TradingServerProperties {

    /**
     * Base URL of the transaction builder (serves /api/tokens/buy and /api/tokens/sell).
     * Trailing slashes are ignored.
     */
    private String builderBaseUrl;

    /**
     * Base URL of the bundle relay (serves /api/transactions/send)
     */
    private String relayBaseUrl;

    /**
     * Optional wallet service for balances and key validation.
     * When empty, wallets are validated locally.
     */
    private String walletServiceUrl;

    /**
     * Slippage tolerance sent to the builder when a trade does not carry one
     * Default: 100 (1%)
     */
    private int defaultSlippageBps = 100;

    /**
     * Relay tip sent to the builder when a trade does not carry one
     * Default: 5,000,000 lamports (0.005 SOL)
     */
    private long defaultTipLamports = 5_000_000L;

    /**
     * HTTP timeouts for all outbound calls
     */
    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;
}
