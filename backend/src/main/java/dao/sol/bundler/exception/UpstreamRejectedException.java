package dao.sol.bundler.exception;

/**
 * Builder answered but reported a logical failure (unsupported protocol, bad token, ...).
 */
public class UpstreamRejectedException extends BundlerException {

    public UpstreamRejectedException(String message) {
        super(message);
    }

    public UpstreamRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
