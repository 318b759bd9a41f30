package dao.sol.bundler.exception;

/**
 * Relay accepted the request but refused the bundle. Carries the relay's own error code when it sent one.
 */
public class RelayRejectedException extends BundlerException {

    private final Integer code;
    private final String details;

    public RelayRejectedException(Integer code, String message, String details) {
        super(format(code, message, details));
        this.code = code;
        this.details = details;
    }

    public Integer getCode() {
        return code;
    }

    public String getDetails() {
        return details;
    }

    private static String format(Integer code, String message, String details) {
        StringBuilder sb = new StringBuilder();
        if (code != null) sb.append('[').append(code).append("] ");
        sb.append(message == null || message.isBlank() ? "Unknown error sending bundle" : message);
        if (details != null && !details.isBlank()) sb.append(": ").append(details);
        return sb.toString();
    }
}
