package dao.sol.bundler.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * How much to trade: a SOL amount to spend (buy, optionally overridden per wallet) or a percentage of
 * the token balance to liquidate (sell).
 */
public record AmountSpec(
        TradeSide side,
        BigDecimal solAmount,
        List<BigDecimal> amounts,
        BigDecimal sellPercent
) {

    public AmountSpec {
        amounts = amounts == null ? null : List.copyOf(amounts);
    }

    public static AmountSpec buy(BigDecimal solAmount) {
        return new AmountSpec(TradeSide.BUY, solAmount, null, null);
    }

    public static AmountSpec buy(BigDecimal solAmount, List<BigDecimal> perWallet) {
        return new AmountSpec(TradeSide.BUY, solAmount, perWallet, null);
    }

    public static AmountSpec sell(BigDecimal sellPercent) {
        return new AmountSpec(TradeSide.SELL, null, null, sellPercent);
    }

    public boolean hasOverrides() {
        return amounts != null && !amounts.isEmpty();
    }

    /**
     * Restrict per-wallet overrides to the wallets [from, to) of the full wallet list.
     */
    public AmountSpec slice(int from, int to) {
        if (!hasOverrides()) return this;
        return new AmountSpec(side, solAmount, amounts.subList(from, to), sellPercent);
    }
}
