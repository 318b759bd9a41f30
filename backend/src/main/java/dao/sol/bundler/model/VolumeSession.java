package dao.sol.bundler.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * State of one scheduler run. Mutated only by the owning scheduler under its lock.
 */
@Getter
@Setter
public class VolumeSession {

    private final String sessionId;
    private final VolumeSessionConfig config;
    private final VolumeStats stats = new VolumeStats();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    private boolean running;
    private int lastUsedWalletIndex = -1;
    private TradeSide lastTradeDirection;

    public VolumeSession(String sessionId, VolumeSessionConfig config) {
        this.sessionId = sessionId;
        this.config = config;
    }

    public List<WalletCredential> getWalletPool() {
        return config.getWallets();
    }
}
