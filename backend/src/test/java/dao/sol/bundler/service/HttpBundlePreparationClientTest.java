package dao.sol.bundler.service;

import dao.sol.bundler.config.TradingServerProperties;
import dao.sol.bundler.exception.MalformedResponseException;
import dao.sol.bundler.exception.UpstreamRejectedException;
import dao.sol.bundler.exception.UpstreamUnavailableException;
import dao.sol.bundler.model.AmountSpec;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.BundleMode;
import dao.sol.bundler.model.TradeIntent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpBundlePreparationClientTest {

    private static final List<String> WALLETS = List.of("WalletA", "WalletB");

    private TradingServerProperties props;
    private MockRestServiceServer server;
    private HttpBundlePreparationClient client;

    @BeforeEach
    void setUp() {
        props = new TradingServerProperties();
        props.setBuilderBaseUrl("http://builder.test//");
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpBundlePreparationClient(props, builder);
    }

    @Test
    @DisplayName("Buy request carries wallets, amounts and configured defaults")
    void testBuyRequestBody() {
        server.expect(requestTo("http://builder.test/api/tokens/buy"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.walletAddresses[1]").value("WalletB"))
                .andExpect(jsonPath("$.tokenAddress").value("Mint111"))
                .andExpect(jsonPath("$.protocol").value("pumpfun"))
                .andExpect(jsonPath("$.solAmount").value(0.5))
                .andExpect(jsonPath("$.amounts[1]").value(0.2))
                .andExpect(jsonPath("$.slippageBps").value(100))
                .andExpect(jsonPath("$.jitoTipLamports").value(5_000_000))
                .andRespond(withSuccess("{\"success\":true,\"transactions\":[\"tx1\"]}", MediaType.APPLICATION_JSON));

        TradeIntent intent = buy().toBuilder()
                .amountSpec(AmountSpec.buy(new BigDecimal("0.5"), List.of(new BigDecimal("0.1"), new BigDecimal("0.2"))))
                .build();
        client.prepare(WALLETS, intent);

        server.verify();
    }

    @Test
    @DisplayName("Sell request goes to /api/tokens/sell with sellPercent and explicit overrides")
    void testSellRequestBody() {
        server.expect(requestTo("http://builder.test/api/tokens/sell"))
                .andExpect(jsonPath("$.sellPercent").value(25))
                .andExpect(jsonPath("$.solAmount").doesNotExist())
                .andExpect(jsonPath("$.slippageBps").value(300))
                .andExpect(jsonPath("$.jitoTipLamports").value(1000))
                .andRespond(withSuccess("{\"success\":true,\"transactions\":[\"tx1\"]}", MediaType.APPLICATION_JSON));

        TradeIntent intent = buy().toBuilder()
                .amountSpec(AmountSpec.sell(new BigDecimal("25")))
                .slippageBps(300)
                .tipLamports(1000L)
                .build();
        client.prepare(WALLETS, intent);

        server.verify();
    }

    @Test
    @DisplayName("bundles array: object entries and bare-array entries are both accepted")
    void testBundlesArrayShape() {
        respond("{\"success\":true,\"bundles\":[{\"transactions\":[\"a\",\"b\"]},[\"c\"]]}");

        List<Bundle> bundles = client.prepare(WALLETS, buy());

        assertEquals(List.of(Bundle.of("a", "b"), Bundle.of("c")), bundles);
    }

    @Test
    @DisplayName("flat transactions array becomes one bundle")
    void testFlatTransactionsShape() {
        respond("{\"success\":true,\"transactions\":[\"a\",\"b\"]}");
        assertEquals(List.of(Bundle.of("a", "b")), client.prepare(WALLETS, buy()));
    }

    @Test
    @DisplayName("data.transactions becomes one bundle")
    void testNestedDataShape() {
        respond("{\"success\":true,\"data\":{\"transactions\":[\"a\"]}}");
        assertEquals(List.of(Bundle.of("a")), client.prepare(WALLETS, buy()));
    }

    @Test
    @DisplayName("bare array becomes one bundle")
    void testBareArrayShape() {
        respond("[\"a\",\"b\",\"c\"]");
        assertEquals(List.of(Bundle.of("a", "b", "c")), client.prepare(WALLETS, buy()));
    }

    @Test
    void testUnknownShapeIsMalformed() {
        respond("{\"success\":true,\"result\":\"nothing here\"}");
        MalformedResponseException e = assertThrows(MalformedResponseException.class, () -> client.prepare(WALLETS, buy()));
        assertFalse(e.isTransient());
    }

    @Test
    void testNonStringTransactionIsMalformed() {
        respond("{\"success\":true,\"transactions\":[1,2]}");
        assertThrows(MalformedResponseException.class, () -> client.prepare(WALLETS, buy()));
    }

    @Test
    @DisplayName("success:false is a logical rejection carrying the builder's message")
    void testLogicalRejection() {
        respond("{\"success\":false,\"error\":\"Unsupported protocol\"}");
        UpstreamRejectedException e = assertThrows(UpstreamRejectedException.class, () -> client.prepare(WALLETS, buy()));
        assertEquals("Unsupported protocol", e.getMessage());
    }

    @Test
    void testClientErrorIsRejection() {
        server.expect(requestTo("http://builder.test/api/tokens/buy")).andRespond(withBadRequest());
        UpstreamRejectedException e = assertThrows(UpstreamRejectedException.class, () -> client.prepare(WALLETS, buy()));
        assertFalse(e instanceof MalformedResponseException);
    }

    @Test
    @DisplayName("5xx and I/O failures are transient unavailability")
    void testServerAndNetworkErrors() {
        server.expect(requestTo("http://builder.test/api/tokens/buy")).andRespond(withServerError());
        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.prepare(WALLETS, buy()));
        assertTrue(e.isTransient());

        server.reset();
        server.expect(requestTo("http://builder.test/api/tokens/buy")).andRespond(request -> {
            throw new IOException("Connection refused");
        });
        e = assertThrows(UpstreamUnavailableException.class, () -> client.prepare(WALLETS, buy()));
        assertTrue(e.isTransient());
    }

    @Test
    @DisplayName("Missing builder URL fails without a request and is not retryable")
    void testNotConfigured() {
        props.setBuilderBaseUrl("  ");
        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.prepare(WALLETS, buy()));
        assertFalse(e.isTransient());
        server.verify();
    }

    private void respond(String json) {
        server.expect(requestTo("http://builder.test/api/tokens/buy"))
                .andRespond(withSuccess(json, MediaType.APPLICATION_JSON));
    }

    private static TradeIntent buy() {
        return TradeIntent.builder()
                .tokenAddress("Mint111")
                .protocol("pumpfun")
                .amountSpec(AmountSpec.buy(new BigDecimal("0.5")))
                .bundleMode(BundleMode.BATCH)
                .build();
    }
}
