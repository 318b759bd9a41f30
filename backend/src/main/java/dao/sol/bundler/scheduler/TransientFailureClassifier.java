package dao.sol.bundler.scheduler;

import dao.sol.bundler.exception.BundlerException;
import dao.sol.bundler.exception.DispatchFailedException;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failure is a transient network condition worth retrying.
 */
public final class TransientFailureClassifier {
    private TransientFailureClassifier() {}

    private static final List<String> NETWORK_KEYWORDS = List.of("timeout", "timed out", "econnrefused", "connection refused", "network");

    public static boolean isTransient(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 16) {
            if (t instanceof DispatchFailedException) {
                t = t.getCause();
                continue;
            }
            if (t instanceof CancellationException) {
                return false;
            }
            if (t instanceof BundlerException be) {
                return be.isTransient();
            }
            if (t instanceof ConnectException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof TimeoutException
                    || t instanceof ResourceAccessException) {
                return true;
            }
            if (mentionsNetwork(t.getMessage())) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static boolean mentionsNetwork(String message) {
        if (message == null) return false;
        String m = message.toLowerCase(Locale.ROOT);
        return NETWORK_KEYWORDS.stream().anyMatch(m::contains);
    }
}
