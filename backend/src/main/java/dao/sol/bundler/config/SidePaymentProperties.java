package dao.sol.bundler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "side-payment")
@Data
public class SidePaymentProperties {

    /**
     * Enable/disable the platform fee transfer on buy bundles
     * Default: true
     */
    private boolean enabled = true;

    /**
     * Recipient of the fee transfer (base58 address)
     */
    private String feeWallet = "7R3TvRRf6m88tJRNQ8nr9kiZq2q224scucBjXxVb26do";

    /**
     * Fee amount
     * Default: 30,000,000 lamports (0.03 SOL)
     */
    private long lamports = 30_000_000L;

    /**
     * Protocols whose buy bundles carry the fee
     */
    private List<String> protocols = new ArrayList<>(List.of("pumpfun", "bonk"));

    /**
     * Solana JSON-RPC endpoint used to fetch a recent blockhash
     */
    private String rpcEndpoint = "https://api.mainnet-beta.solana.com";
}
