package dao.sol.bundler.service;

import dao.sol.bundler.config.DispatchProperties;
import dao.sol.bundler.model.Bundle;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cuts bundles down to the relay's per-bundle transaction limit, preserving transaction order.
 */
@Component
public class BundleSplitter {

    private final int maxTxPerBundle;

    @Autowired
    public BundleSplitter(DispatchProperties props) {
        this(props.getMaxTxPerBundle());
    }

    public BundleSplitter(int maxTxPerBundle) {
        if (maxTxPerBundle <= 0) {
            throw new IllegalArgumentException("maxTxPerBundle must be positive: " + maxTxPerBundle);
        }
        this.maxTxPerBundle = maxTxPerBundle;
    }

    public List<Bundle> split(List<Bundle> bundles) {
        List<Bundle> result = new ArrayList<>();
        for (Bundle bundle : bundles) {
            if (bundle == null) continue;
            if (bundle.size() <= maxTxPerBundle) {
                result.add(bundle);
                continue;
            }
            List<String> txs = bundle.transactions();
            for (int i = 0; i < txs.size(); i += maxTxPerBundle) {
                result.add(new Bundle(txs.subList(i, Math.min(i + maxTxPerBundle, txs.size()))));
            }
        }
        return result;
    }

    public int getMaxTxPerBundle() {
        return maxTxPerBundle;
    }
}
