package dao.sol.bundler.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class VolumeSessionConfig {

    String tokenAddress;

    @Builder.Default
    String protocol = "auto";

    List<WalletCredential> wallets;

    /** Buy range in SOL. */
    BigDecimal minAmount;
    BigDecimal maxAmount;

    /** Seconds between trades, re-drawn every cycle. */
    double intervalMin;
    double intervalMax;

    /** 0 runs until stopped. */
    long durationMinutes;

    Integer slippageBps;

    /** Fixed sell percentage; null draws one per sell. */
    Integer sellPercent;
}
