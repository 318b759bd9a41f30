package dao.sol.bundler.model;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Running counters of a volume session. Only ever increase while the session runs.
 */
@Data
public class VolumeStats {

    private long totalTrades;
    private long successfulTrades;
    private long failedTrades;
    /** SOL spent by successful buys. */
    private BigDecimal totalVolume = BigDecimal.ZERO;
    private long totalBuys;
    private long totalSells;
    private long startTime; // epoch millis
    private boolean running;

    public VolumeStats copy() {
        VolumeStats c = new VolumeStats();
        c.setTotalTrades(totalTrades);
        c.setSuccessfulTrades(successfulTrades);
        c.setFailedTrades(failedTrades);
        c.setTotalVolume(totalVolume);
        c.setTotalBuys(totalBuys);
        c.setTotalSells(totalSells);
        c.setStartTime(startTime);
        c.setRunning(running);
        return c;
    }
}
