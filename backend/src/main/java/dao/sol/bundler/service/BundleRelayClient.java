package dao.sol.bundler.service;

import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.RelayAck;

/**
 * Submits finalized bundles. Callers take a {@link RateLimiter} slot before each call.
 */
public interface BundleRelayClient {

    /**
     * @throws dao.sol.bundler.exception.RelayUnreachableException network-level failure
     * @throws dao.sol.bundler.exception.RelayRejectedException the relay refused the bundle
     */
    RelayAck send(Bundle bundle);

    /**
     * @throws dao.sol.bundler.exception.ConfigurationException if no relay endpoint is configured
     */
    default void checkConfigured() {
    }
}
