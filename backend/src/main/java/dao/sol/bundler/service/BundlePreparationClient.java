package dao.sol.bundler.service;

import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.TradeIntent;

import java.util.List;

/**
 * Requests unsigned (or partially signed) transaction templates from the remote builder.
 */
public interface BundlePreparationClient {

    /**
     * @param walletAddresses non-empty, in the order per-wallet amounts refer to
     * @return zero or more bundles of template blobs
     * @throws dao.sol.bundler.exception.UpstreamUnavailableException builder unreachable or not configured
     * @throws dao.sol.bundler.exception.UpstreamRejectedException builder reported a logical failure
     * @throws dao.sol.bundler.exception.MalformedResponseException reply matched no known shape
     */
    List<Bundle> prepare(List<String> walletAddresses, TradeIntent intent);
}
