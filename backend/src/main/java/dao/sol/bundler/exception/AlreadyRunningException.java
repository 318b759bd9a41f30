package dao.sol.bundler.exception;

public class AlreadyRunningException extends BundlerException {

    private final String sessionId;

    public AlreadyRunningException(String sessionId) {
        super("Volume session " + sessionId + " is already running");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
