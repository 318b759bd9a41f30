package dao.sol.bundler.exception;

/**
 * Transaction builder could not be reached. Transient, unless the endpoint was never configured.
 */
public class UpstreamUnavailableException extends BundlerException {

    private final boolean retryable;

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.retryable = true;
    }

    private UpstreamUnavailableException(String message) {
        super(message);
        this.retryable = false;
    }

    public static UpstreamUnavailableException notConfigured() {
        return new UpstreamUnavailableException("Transaction builder URL not configured");
    }

    @Override
    public boolean isTransient() {
        return retryable;
    }
}
