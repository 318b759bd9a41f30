package dao.sol.bundler.model;

import java.util.List;

/**
 * Ordered transaction blobs submitted together. Order matters: a prepended side-payment stays first.
 */
public record Bundle(List<String> transactions) {

    public Bundle {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    public static Bundle of(String... transactions) {
        return new Bundle(List.of(transactions));
    }

    public int size() {
        return transactions.size();
    }

    public boolean isEmpty() {
        return transactions.isEmpty();
    }
}
