package dao.sol.bundler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "volume")
@Data
public class VolumeProperties {

    /**
     * Delay before the first trade of a session (ms)
     */
    private long warmupMs = 500;

    /**
     * Chance of buying when the previous trade was a buy
     * Default: 0.6
     */
    private double buyProbability = 0.6;

    /**
     * Sell percentage range used when a session has no fixed sell percent
     */
    private int sellPercentMin = 10;
    private int sellPercentMax = 50;

    private RetryConfig retry = new RetryConfig();

    @Data
    public static class RetryConfig {
        /**
         * Attempts per trade, including the first
         * Default: 3
         */
        private int maxAttempts = 3;

        /**
         * Backoff before attempt k+1 is min(baseDelayMs * 2^(k-1), maxDelayMs)
         */
        private long baseDelayMs = 1000;
        private long maxDelayMs = 5000;
    }
}
