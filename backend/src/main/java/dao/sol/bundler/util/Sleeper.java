package dao.sol.bundler.util;

/**
 * Deliberate pauses such as inter-unit delays and retry backoff go through this so tests can observe them
 * instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper system() {
        return millis -> {
            if (millis > 0) Thread.sleep(millis);
        };
    }

    /**
     * Sleep, restoring the interrupt flag instead of throwing.
     *
     * @return false if the thread was interrupted
     */
    default boolean sleepQuietly(long millis) {
        try {
            sleep(millis);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
