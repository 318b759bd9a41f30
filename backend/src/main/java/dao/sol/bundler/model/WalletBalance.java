package dao.sol.bundler.model;

/**
 * {@code solBalance} is null when no live balance could be fetched.
 */
public record WalletBalance(String wallet, Double solBalance, String publicKey) {}
