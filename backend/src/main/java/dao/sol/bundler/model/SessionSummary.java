package dao.sol.bundler.model;

public record SessionSummary(
        String sessionId,
        String tokenAddress,
        long startedAt,
        long stoppedAt,
        VolumeStats stats
) {}
