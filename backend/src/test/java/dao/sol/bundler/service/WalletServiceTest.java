package dao.sol.bundler.service;

import dao.sol.bundler.config.TradingServerProperties;
import dao.sol.bundler.model.WalletBalance;
import dao.sol.bundler.model.WalletValidation;
import dao.sol.bundler.util.SolanaKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WalletServiceTest {

    private TradingServerProperties props;
    private MockRestServiceServer server;
    private WalletService walletService;
    private String goodKey;

    @BeforeEach
    void setUp() {
        props = new TradingServerProperties();
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        walletService = new WalletService(props, builder);
        goodKey = SolanaKeys.generatePrivateKey();
    }

    @Test
    @DisplayName("Without a wallet service, keys are validated locally")
    void testLocalValidation() {
        WalletValidation result = walletService.validateWallets(List.of(goodKey, "garbage"));

        assertEquals(List.of(goodKey), result.valid());
        assertEquals(List.of("garbage"), result.invalid());
        server.verify();
    }

    @Test
    @DisplayName("Local balances carry the derived address and no live SOL amount")
    void testLocalBalances() {
        List<WalletBalance> balances = walletService.getWalletBalances(List.of(goodKey, "garbage"));

        assertEquals(2, balances.size());
        assertNull(balances.get(0).solBalance());
        assertEquals(SolanaKeys.addressOf(goodKey), balances.get(0).publicKey());
        assertEquals(goodKey.substring(0, 8) + "...", balances.get(0).wallet());
        assertEquals(WalletService.INVALID, balances.get(1).publicKey());
    }

    @Test
    @DisplayName("Remote validation result is used when the service answers")
    void testRemoteValidation() {
        props.setWalletServiceUrl("http://wallets.test");
        server.expect(requestTo("http://wallets.test/api/volume/validate-wallets"))
                .andExpect(jsonPath("$.wallets[0]").value(goodKey))
                .andRespond(withSuccess("{\"success\":true,\"validWallets\":[\"k1\"],\"invalidWallets\":[\"k2\"]}",
                        MediaType.APPLICATION_JSON));

        WalletValidation result = walletService.validateWallets(List.of(goodKey));

        assertEquals(List.of("k1"), result.valid());
        assertEquals(List.of("k2"), result.invalid());
        server.verify();
    }

    @Test
    void testRemoteBalances() {
        props.setWalletServiceUrl("http://wallets.test");
        server.expect(requestTo("http://wallets.test/api/volume/wallet-balances"))
                .andRespond(withSuccess("{\"success\":true,\"balances\":[{\"wallet\":\"abc...\",\"solBalance\":1.25,\"publicKey\":\"Pk1\"}]}",
                        MediaType.APPLICATION_JSON));

        List<WalletBalance> balances = walletService.getWalletBalances(List.of(goodKey));

        assertEquals(List.of(new WalletBalance("abc...", 1.25, "Pk1")), balances);
    }

    @Test
    @DisplayName("Failing wallet service falls back to local validation")
    void testFallbackOnFailure() {
        props.setWalletServiceUrl("http://wallets.test");
        server.expect(requestTo("http://wallets.test/api/volume/validate-wallets")).andRespond(withServerError());

        WalletValidation result = walletService.validateWallets(List.of(goodKey));

        assertEquals(List.of(goodKey), result.valid());
        assertTrue(result.invalid().isEmpty());
    }
}
