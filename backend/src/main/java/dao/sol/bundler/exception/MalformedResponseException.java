package dao.sol.bundler.exception;

/**
 * Builder reply matched none of the accepted shapes. Handled like a rejection.
 */
public class MalformedResponseException extends UpstreamRejectedException {

    public MalformedResponseException(String message) {
        super(message);
    }
}
