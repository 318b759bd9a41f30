package dao.sol.bundler.model;

import dao.sol.bundler.util.SolanaKeys;

/**
 * A wallet the caller lends to one dispatch call. The address is assumed to be derived from the key.
 */
public record WalletCredential(String address, String privateKey) {

    public static WalletCredential fromPrivateKey(String privateKey) {
        return new WalletCredential(SolanaKeys.addressOf(privateKey), privateKey);
    }

    @Override
    public String toString() {
        return "WalletCredential[address=" + address + "]";
    }
}
