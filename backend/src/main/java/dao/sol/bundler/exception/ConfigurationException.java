package dao.sol.bundler.exception;

/**
 * Missing endpoint, unsupported bundle mode or otherwise unusable input. Never retried.
 */
public class ConfigurationException extends BundlerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
