package dao.sol.bundler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "dispatch")
@Data
public class DispatchProperties {

    /**
     * Maximum number of transactions the relay accepts in one bundle
     * Default: 5
     */
    private int maxTxPerBundle = 5;

    /**
     * Process-wide cap on bundle submissions
     * Default: 10 per second
     */
    private int maxBundlesPerSecond = 10;

    /**
     * Wallets per group in batch mode
     * Default: 5
     */
    private int batchSize = 5;

    /**
     * Pause between groups in batch mode (ms)
     */
    private long batchDelayMs = 1000;

    /**
     * Pause between wallets in single mode (ms)
     */
    private long singleDelayMs = 200;

    /**
     * All-in-one mode: sub-bundle i waits i * staggerMs before submitting
     */
    private long staggerMs = 100;

    /**
     * Threads used for concurrent all-in-one submissions
     * Default: 8
     */
    private int maxParallel = 8;
}
