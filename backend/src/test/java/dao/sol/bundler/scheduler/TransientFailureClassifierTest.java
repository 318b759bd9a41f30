package dao.sol.bundler.scheduler;

import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.exception.DispatchFailedException;
import dao.sol.bundler.exception.MalformedResponseException;
import dao.sol.bundler.exception.RelayRejectedException;
import dao.sol.bundler.exception.RelayUnreachableException;
import dao.sol.bundler.exception.UpstreamUnavailableException;
import dao.sol.bundler.model.DispatchResult;
import dao.sol.bundler.model.DispatchUnitResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class TransientFailureClassifierTest {

    @Test
    void testNetworkFailuresAreTransient() {
        assertTrue(TransientFailureClassifier.isTransient(new ConnectException("Connection refused")));
        assertTrue(TransientFailureClassifier.isTransient(new SocketTimeoutException("Read timed out")));
        assertTrue(TransientFailureClassifier.isTransient(new ResourceAccessException("I/O error")));
        assertTrue(TransientFailureClassifier.isTransient(new RuntimeException("connect ECONNREFUSED 127.0.0.1:3000")));
        assertTrue(TransientFailureClassifier.isTransient(new RuntimeException("Network request failed")));
        assertTrue(TransientFailureClassifier.isTransient(new RelayUnreachableException("down", new ConnectException())));
        assertTrue(TransientFailureClassifier.isTransient(new UpstreamUnavailableException("down", new ConnectException())));
    }

    @Test
    void testLogicalFailuresAreNot() {
        assertFalse(TransientFailureClassifier.isTransient(new RelayRejectedException(null, "request timeout in simulation", null)));
        assertFalse(TransientFailureClassifier.isTransient(new MalformedResponseException("No transactions")));
        assertFalse(TransientFailureClassifier.isTransient(new ConfigurationException("Relay URL not configured")));
        assertFalse(TransientFailureClassifier.isTransient(UpstreamUnavailableException.notConfigured()));
        assertFalse(TransientFailureClassifier.isTransient(new IllegalStateException("boom")));
    }

    @Test
    @DisplayName("Cancellation is final even when its message mentions a timeout")
    void testCancellationIsNotTransient() {
        assertFalse(TransientFailureClassifier.isTransient(new CancellationException("Session stopped while waiting for timeout")));
    }

    @Test
    @DisplayName("A failed dispatch is classified by the unit failure that caused it")
    void testDispatchFailureUsesCause() {
        DispatchResult unreachable = DispatchResult.aggregate(List.of(
                DispatchUnitResult.failed("wallet 1/1", new RelayUnreachableException("down", new ConnectException()))));
        DispatchResult rejected = DispatchResult.aggregate(List.of(
                DispatchUnitResult.failed("wallet 1/1", new RelayRejectedException(null, "Bundle dropped", null))));

        assertTrue(TransientFailureClassifier.isTransient(new DispatchFailedException(unreachable)));
        assertFalse(TransientFailureClassifier.isTransient(new DispatchFailedException(rejected)));
    }
}
