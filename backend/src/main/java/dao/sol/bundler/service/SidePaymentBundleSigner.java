package dao.sol.bundler.service;

import dao.sol.bundler.config.SidePaymentProperties;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.TradeSide;
import dao.sol.bundler.model.WalletCredential;
import dao.sol.bundler.util.SolanaKeys;
import lombok.extern.slf4j.Slf4j;
import org.sol4k.Base58;
import org.sol4k.Keypair;
import org.sol4k.PublicKey;
import org.sol4k.TransactionMessage;
import org.sol4k.VersionedTransaction;
import org.sol4k.instruction.TransferInstruction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prepends a platform fee transfer, paid by the first credential, to buy bundles of the configured protocols.
 * Best effort: if the fee transaction cannot be built the signed bundle is returned as is.
 */
@Slf4j
public class SidePaymentBundleSigner implements BundleSigner {

    private final BundleSigner delegate;
    private final SidePaymentProperties props;
    private final BlockhashProvider blockhashProvider;

    public SidePaymentBundleSigner(BundleSigner delegate, SidePaymentProperties props, BlockhashProvider blockhashProvider) {
        this.delegate = delegate;
        this.props = props;
        this.blockhashProvider = blockhashProvider;
    }

    @Override
    public Bundle sign(Bundle bundle, List<WalletCredential> credentials, TradeIntent intent) {
        Bundle signed = delegate.sign(bundle, credentials, intent);
        if (!appliesTo(intent) || credentials.isEmpty() || signed.isEmpty()) {
            return signed;
        }
        try {
            String fee = buildFeeTransaction(credentials.get(0));
            List<String> txs = new ArrayList<>(signed.size() + 1);
            txs.add(fee);
            txs.addAll(signed.transactions());
            log.info("Added {} lamport fee transaction to {} buy bundle", props.getLamports(), intent.getProtocol());
            return new Bundle(txs);
        } catch (RuntimeException e) {
            log.warn("Could not add fee transaction, sending bundle without it: {}", e.getMessage());
            return signed;
        }
    }

    boolean appliesTo(TradeIntent intent) {
        if (!props.isEnabled() || intent.side() != TradeSide.BUY || intent.getProtocol() == null) {
            return false;
        }
        String protocol = intent.getProtocol().toLowerCase(Locale.ROOT);
        return props.getProtocols().stream().anyMatch(p -> p.equalsIgnoreCase(protocol));
    }

    private String buildFeeTransaction(WalletCredential payer) {
        Keypair keypair = SolanaKeys.keypairOf(payer.privateKey());
        PublicKey from = keypair.getPublicKey();
        TransferInstruction transfer = new TransferInstruction(from, new PublicKey(props.getFeeWallet()), props.getLamports());

        VersionedTransaction tx = new VersionedTransaction(
                TransactionMessage.newMessage(from, blockhashProvider.getLatestBlockhash(), transfer));
        tx.sign(keypair);
        return Base58.encode(tx.serialize());
    }
}
