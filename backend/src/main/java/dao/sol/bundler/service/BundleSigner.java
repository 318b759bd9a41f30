package dao.sol.bundler.service;

import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.WalletCredential;

import java.util.List;

public interface BundleSigner {

    /**
     * Sign every template of {@code bundle} with the matching credentials.
     *
     * @return the fully signed bundle, base58 encoded, in template order
     * @throws dao.sol.bundler.exception.SigningException if any template cannot be decoded or signed
     */
    Bundle sign(Bundle bundle, List<WalletCredential> credentials, TradeIntent intent);
}
