package dao.sol.bundler.exception;

public class RelayUnreachableException extends BundlerException {

    public RelayUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
