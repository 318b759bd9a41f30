package dao.sol.bundler.service;

import dao.sol.bundler.exception.SigningException;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.util.SolanaKeys;
import lombok.extern.slf4j.Slf4j;
import org.sol4k.Base58;
import org.sol4k.Keypair;
import org.sol4k.PublicKey;
import org.sol4k.VersionedTransaction;

import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Signs builder templates in-process with the caller's keys. Keys never leave this class.
 */
@Slf4j
public class LocalBundleSigner implements BundleSigner {

    @Override
    public Bundle sign(Bundle bundle, List<WalletCredential> credentials, TradeIntent intent) {
        Map<String, Keypair> keysByAddress = indexKeys(credentials);

        List<String> signed = new ArrayList<>(bundle.size());
        for (int i = 0; i < bundle.size(); i++) {
            VersionedTransaction tx = decodeTemplate(bundle.transactions().get(i), i);
            try {
                int count = signOwnedSlots(tx, keysByAddress);
                log.debug("Template {}: signed {} of {} required slot(s)", i, count, tx.getSignatures().size());
                signed.add(Base58.encode(tx.serialize()));
            } catch (RuntimeException e) {
                throw new SigningException("Signing transaction " + i + " failed: " + e.getMessage(), e);
            }
        }
        return new Bundle(signed);
    }

    /**
     * Signs each required-signer slot whose key we own. A credential signs at most once per transaction.
     */
    static int signOwnedSlots(VersionedTransaction tx, Map<String, Keypair> keysByAddress) {
        Map<String, Keypair> unused = new LinkedHashMap<>(keysByAddress);
        List<PublicKey> accounts = tx.getMessage().getAccounts();
        int required = Math.min(tx.getSignatures().size(), accounts.size());
        int count = 0;
        for (int slot = 0; slot < required; slot++) {
            Keypair keypair = unused.remove(accounts.get(slot).toBase58());
            if (keypair != null) {
                tx.sign(keypair);
                count++;
            }
        }
        return count;
    }

    static VersionedTransaction decodeTemplate(String template, int index) {
        if (template == null || template.isBlank()) {
            throw new SigningException("Transaction " + index + " is empty");
        }
        VersionedTransaction tx;
        try {
            tx = VersionedTransaction.from(Base64.getEncoder().encodeToString(Base58.decode(template)));
        } catch (RuntimeException base58Failure) {
            try {
                tx = VersionedTransaction.from(template);
            } catch (RuntimeException base64Failure) {
                base64Failure.addSuppressed(base58Failure);
                throw new SigningException("Transaction " + index + " is neither base58 nor base64: "
                        + base64Failure.getMessage(), base64Failure);
            }
        }
        // builders may omit the signature section entirely
        return tx.getSignatures().isEmpty() ? new VersionedTransaction(tx.getMessage()) : tx;
    }

    private static Map<String, Keypair> indexKeys(List<WalletCredential> credentials) {
        Map<String, Keypair> keys = new LinkedHashMap<>();
        for (WalletCredential c : credentials) {
            Keypair keypair;
            try {
                keypair = SolanaKeys.keypairOf(c.privateKey());
            } catch (IllegalArgumentException e) {
                throw new SigningException("Invalid private key for wallet " + c.address() + ": " + e.getMessage(), e);
            }
            keys.putIfAbsent(keypair.getPublicKey().toBase58(), keypair);
        }
        return keys;
    }
}
