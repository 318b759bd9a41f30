package dao.sol.bundler.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.sol4k.Base58;
import org.sol4k.Keypair;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Solana wallet key helpers on top of sol4k.
 *
 * A Solana secret key is 64 bytes: the 32-byte seed followed by the 32-byte public key. Wallet exports
 * carry it either as base58 or as a JSON byte array ("[12,34,...]").
 */
public final class SolanaKeys {
    private SolanaKeys() {}

    public static final int SEED_LENGTH = 32;
    public static final int SECRET_KEY_LENGTH = 64;

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final byte[] CHECK_MESSAGE = "solana-bundler key check".getBytes(StandardCharsets.UTF_8);

    /**
     * Decode a secret key in either supported textual form.
     *
     * @throws IllegalArgumentException if the text is not a 64-byte key
     */
    public static byte[] decodeSecretKey(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Private key is empty");
        }
        String t = text.trim();
        byte[] raw = t.startsWith("[") ? parseJsonBytes(t) : decodeBase58(t);
        if (raw.length != SECRET_KEY_LENGTH) {
            throw new IllegalArgumentException("Private key must be 64 bytes, got " + raw.length);
        }
        return raw;
    }

    public static Keypair keypairOf(String privateKey) {
        byte[] secret = decodeSecretKey(privateKey);
        try {
            return Keypair.fromSecretKey(secret);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid private key: " + e.getMessage(), e);
        }
    }

    public static String addressOf(String privateKey) {
        return keypairOf(privateKey).getPublicKey().toBase58();
    }

    /**
     * True when the key decodes, its embedded public half is the wallet address, and it produces signatures
     * that verify against that address.
     */
    public static boolean isConsistent(String privateKey) {
        try {
            byte[] secret = decodeSecretKey(privateKey);
            Keypair keypair = Keypair.fromSecretKey(secret);
            String embedded = Base58.encode(Arrays.copyOfRange(secret, SEED_LENGTH, SECRET_KEY_LENGTH));
            if (!embedded.equals(keypair.getPublicKey().toBase58())) return false;
            return keypair.getPublicKey().verify(keypair.sign(CHECK_MESSAGE), CHECK_MESSAGE);
        } catch (RuntimeException e) {
            return false;
        }
    }

    /**
     * Fresh random keypair encoded as a base58 64-byte secret key.
     */
    public static String generatePrivateKey() {
        Keypair keypair = Keypair.generate();
        byte[] pub = keypair.getPublicKey().bytes();
        byte[] secret = Arrays.copyOf(keypair.getSecret(), SECRET_KEY_LENGTH);
        System.arraycopy(pub, 0, secret, SEED_LENGTH, pub.length);
        return Base58.encode(secret);
    }

    private static byte[] decodeBase58(String text) {
        try {
            return Base58.decode(text);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Private key is not valid base58", e);
        }
    }

    private static byte[] parseJsonBytes(String json) {
        int[] values;
        try {
            values = JSON.readValue(json, int[].class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Private key is not a valid JSON byte array", e);
        }
        byte[] out = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0 || values[i] > 255) {
                throw new IllegalArgumentException("Byte value out of range in key array: " + values[i]);
            }
            out[i] = (byte) values[i];
        }
        return out;
    }
}
