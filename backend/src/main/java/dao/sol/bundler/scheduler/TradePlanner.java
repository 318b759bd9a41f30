package dao.sol.bundler.scheduler;

import dao.sol.bundler.config.VolumeProperties;
import dao.sol.bundler.model.TradeSide;
import dao.sol.bundler.model.VolumeSessionConfig;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random choices of a volume session: direction, wallet, amount and the delay to the next cycle.
 */
public class TradePlanner {

    private final VolumeProperties props;
    private final Random random;

    public TradePlanner(VolumeProperties props) {
        this(props, null);
    }

    public TradePlanner(VolumeProperties props, Random random) {
        this.props = props;
        this.random = random;
    }

    /**
     * Always buys after anything but a buy; after a buy, buys with {@code volume.buy-probability}.
     */
    public TradeSide nextSide(TradeSide previous) {
        if (previous != TradeSide.BUY) {
            return TradeSide.BUY;
        }
        return rng().nextDouble() < props.getBuyProbability() ? TradeSide.BUY : TradeSide.SELL;
    }

    /**
     * Uniform over the pool, excluding {@code lastIndex} when the pool has more than one wallet.
     */
    public int nextWalletIndex(int poolSize, int lastIndex) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Wallet pool is empty");
        }
        if (poolSize == 1) return 0;
        if (lastIndex < 0 || lastIndex >= poolSize) {
            return rng().nextInt(poolSize);
        }
        int pick = rng().nextInt(poolSize - 1);
        return pick >= lastIndex ? pick + 1 : pick;
    }

    /**
     * Uniform in [min, max], 4 decimal places.
     */
    public BigDecimal nextBuyAmount(BigDecimal min, BigDecimal max) {
        BigDecimal span = max.subtract(min);
        BigDecimal amount = min.add(span.multiply(BigDecimal.valueOf(rng().nextDouble())));
        amount = amount.setScale(4, RoundingMode.HALF_UP);
        if (amount.compareTo(max) > 0) return max.setScale(4, RoundingMode.HALF_UP);
        if (amount.compareTo(min) < 0) return min.setScale(4, RoundingMode.HALF_UP);
        return amount;
    }

    public int nextSellPercent(VolumeSessionConfig config) {
        if (config.getSellPercent() != null) {
            return config.getSellPercent();
        }
        int lo = props.getSellPercentMin();
        int hi = Math.max(lo, props.getSellPercentMax());
        return lo + rng().nextInt(hi - lo + 1);
    }

    /**
     * Delay to the next cycle, drawn fresh each time from [intervalMin, intervalMax] seconds.
     */
    public long nextDelayMs(VolumeSessionConfig config) {
        double lo = Math.min(config.getIntervalMin(), config.getIntervalMax());
        double hi = Math.max(config.getIntervalMin(), config.getIntervalMax());
        double seconds = lo + (hi - lo) * rng().nextDouble();
        return Math.round(seconds * 1000);
    }

    private Random rng() {
        return random != null ? random : ThreadLocalRandom.current();
    }
}
