package dao.sol.bundler.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class TradeIntent {

    String tokenAddress;

    /** Builder-side protocol key, e.g. pumpfun, raydium, auto. */
    @Builder.Default
    String protocol = "auto";

    AmountSpec amountSpec;

    /** Null means the configured default. */
    Integer slippageBps;

    /** Null means the configured default. */
    Long tipLamports;

    BundleMode bundleMode;

    Long batchDelayMs;
    Long singleDelayMs;

    public TradeSide side() {
        return amountSpec != null ? amountSpec.side() : TradeSide.BUY;
    }

    public TradeIntent slice(int from, int to) {
        if (amountSpec == null || !amountSpec.hasOverrides()) return this;
        return toBuilder().amountSpec(amountSpec.slice(from, to)).build();
    }
}
