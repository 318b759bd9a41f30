package dao.sol.bundler.exception;

/**
 * Root of the dispatch engine's failures.
 */
public class BundlerException extends RuntimeException {

    public BundlerException(String message) {
        super(message);
    }

    public BundlerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether retrying the same call may succeed (network-layer conditions only).
     */
    public boolean isTransient() {
        return false;
    }
}
