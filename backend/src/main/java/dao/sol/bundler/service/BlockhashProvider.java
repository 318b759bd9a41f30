package dao.sol.bundler.service;

public interface BlockhashProvider {

    /**
     * @return a recent blockhash, base58 encoded
     */
    String getLatestBlockhash();
}
