package dao.sol.bundler.exception;

/**
 * Local and deterministic; retrying would reproduce it.
 */
public class SigningException extends BundlerException {

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
