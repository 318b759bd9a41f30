package dao.sol.bundler.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.sol4k.Base58;
import org.sol4k.Keypair;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.StringJoiner;

import static org.junit.jupiter.api.Assertions.*;

class SolanaKeysTest {

    @Test
    @DisplayName("Generated key is a 64-byte secret whose second half is the address")
    void testGeneratedKeyLayout() {
        String privateKey = SolanaKeys.generatePrivateKey();
        byte[] secret = SolanaKeys.decodeSecretKey(privateKey);

        assertEquals(SolanaKeys.SECRET_KEY_LENGTH, secret.length);
        assertEquals(Base58.encode(Arrays.copyOfRange(secret, 32, 64)), SolanaKeys.addressOf(privateKey));
        assertTrue(SolanaKeys.isConsistent(privateKey));
        assertEquals(32, Base58.decode(SolanaKeys.addressOf(privateKey)).length);
    }

    @Test
    @DisplayName("JSON byte-array export decodes to the same key as base58")
    void testJsonArrayForm() {
        String privateKey = SolanaKeys.generatePrivateKey();
        byte[] secret = SolanaKeys.decodeSecretKey(privateKey);

        StringJoiner json = new StringJoiner(", ", "[", "]");
        for (byte b : secret) json.add(Integer.toString(b & 0xFF));

        assertArrayEquals(secret, SolanaKeys.decodeSecretKey(json.toString()));
        assertEquals(SolanaKeys.addressOf(privateKey), SolanaKeys.addressOf(json.toString()));
    }

    @Test
    @DisplayName("Unterminated or non-byte JSON arrays are rejected")
    void testMalformedJsonArray() {
        byte[] secret = SolanaKeys.decodeSecretKey(SolanaKeys.generatePrivateKey());
        StringJoiner open = new StringJoiner(",", "[", "");
        for (byte b : secret) open.add(Integer.toString(b & 0xFF));

        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey(open.toString()));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey("[1,2,3"));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey("[1,2,300]"));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey("[1,-2,3]"));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey("[\"a\",\"b\"]"));
    }

    @Test
    @DisplayName("A bare 32-byte seed is not a wallet key")
    void testSeedRejected() {
        byte[] seed = Arrays.copyOf(SolanaKeys.decodeSecretKey(SolanaKeys.generatePrivateKey()), 32);

        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey(Base58.encode(seed)));
        assertFalse(SolanaKeys.isConsistent(Base58.encode(seed)));
    }

    @Test
    @DisplayName("Secret key with a foreign public half is inconsistent")
    void testTamperedKey() {
        byte[] secret = SolanaKeys.decodeSecretKey(SolanaKeys.generatePrivateKey());
        secret[40] ^= 0x01;
        assertFalse(SolanaKeys.isConsistent(Base58.encode(secret)));
    }

    @Test
    void testRejectsGarbage() {
        assertFalse(SolanaKeys.isConsistent("not-a-key"));
        assertFalse(SolanaKeys.isConsistent(""));
        assertFalse(SolanaKeys.isConsistent("[1,2,3]"));
        assertFalse(SolanaKeys.isConsistent("[1,2,300]"));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.decodeSecretKey(Base58.encode(new byte[16])));
        assertThrows(IllegalArgumentException.class, () -> SolanaKeys.addressOf("not-a-key"));
    }

    @Test
    @DisplayName("The keypair signs messages that verify against the wallet address only")
    void testKeypairSigns() {
        String privateKey = SolanaKeys.generatePrivateKey();
        Keypair keypair = SolanaKeys.keypairOf(privateKey);
        byte[] message = "bundle".getBytes(StandardCharsets.UTF_8);

        byte[] sig = keypair.sign(message);

        assertEquals(64, sig.length);
        assertTrue(keypair.getPublicKey().verify(sig, message));
        Keypair other = SolanaKeys.keypairOf(SolanaKeys.generatePrivateKey());
        assertFalse(other.getPublicKey().verify(sig, message));
    }
}
