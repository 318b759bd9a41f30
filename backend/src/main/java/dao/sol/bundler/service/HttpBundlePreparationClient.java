package dao.sol.bundler.service;

import com.fasterxml.jackson.databind.JsonNode;
import dao.sol.bundler.config.TradingServerProperties;
import dao.sol.bundler.exception.MalformedResponseException;
import dao.sol.bundler.exception.UpstreamRejectedException;
import dao.sol.bundler.exception.UpstreamUnavailableException;
import dao.sol.bundler.model.AmountSpec;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.TradeIntent;
import dao.sol.bundler.model.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class HttpBundlePreparationClient implements BundlePreparationClient {

    /**
     * Reply shapes the builder has used over time, tried in this order.
     */
    enum ResponseShape {
        /** {bundles: [{transactions: [...]}, [...], ...]} */
        BUNDLES_ARRAY {
            @Override
            List<Bundle> decode(JsonNode body) {
                JsonNode bundles = body.path("bundles");
                if (!bundles.isArray()) return null;
                List<Bundle> out = new ArrayList<>();
                for (JsonNode b : bundles) {
                    JsonNode txs = b.isArray() ? b : b.path("transactions");
                    out.add(new Bundle(toStrings(txs)));
                }
                return out;
            }
        },
        /** {transactions: [...]} */
        FLAT_TRANSACTIONS {
            @Override
            List<Bundle> decode(JsonNode body) {
                JsonNode txs = body.path("transactions");
                return txs.isArray() ? List.of(new Bundle(toStrings(txs))) : null;
            }
        },
        /** {data: {transactions: [...]}} */
        NESTED_DATA_TRANSACTIONS {
            @Override
            List<Bundle> decode(JsonNode body) {
                JsonNode txs = body.path("data").path("transactions");
                return txs.isArray() ? List.of(new Bundle(toStrings(txs))) : null;
            }
        },
        /** [...] */
        BARE_ARRAY {
            @Override
            List<Bundle> decode(JsonNode body) {
                return body.isArray() ? List.of(new Bundle(toStrings(body))) : null;
            }
        };

        /**
         * @return the normalized bundles, or null when the body is not of this shape
         */
        abstract List<Bundle> decode(JsonNode body);

        static List<Bundle> normalize(JsonNode body) {
            for (ResponseShape shape : values()) {
                List<Bundle> bundles = shape.decode(body);
                if (bundles != null) return bundles;
            }
            throw new MalformedResponseException("No transactions returned from builder");
        }

        private static List<String> toStrings(JsonNode array) {
            if (!array.isArray()) {
                throw new MalformedResponseException("Bundle entry has no transactions array");
            }
            List<String> out = new ArrayList<>(array.size());
            for (JsonNode tx : array) {
                if (!tx.isTextual()) {
                    throw new MalformedResponseException("Transaction entry is not a string: " + tx.getNodeType());
                }
                out.add(tx.asText());
            }
            return out;
        }
    }

    private final TradingServerProperties props;
    private final RestClient restClient;

    public HttpBundlePreparationClient(TradingServerProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public List<Bundle> prepare(List<String> walletAddresses, TradeIntent intent) {
        String baseUrl = stripTrailingSlashes(props.getBuilderBaseUrl());
        if (baseUrl.isEmpty()) {
            throw UpstreamUnavailableException.notConfigured();
        }
        String path = intent.side() == TradeSide.SELL ? "/api/tokens/sell" : "/api/tokens/buy";
        Map<String, Object> body = buildRequestBody(walletAddresses, intent);

        log.debug("Requesting {} templates for {} wallets (protocol={})", intent.side(), walletAddresses.size(), intent.getProtocol());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(baseUrl + path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new UpstreamUnavailableException("Builder unreachable: " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new UpstreamUnavailableException("Builder HTTP error! Status: " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new UpstreamRejectedException("Builder HTTP error! Status: " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new MalformedResponseException("Unreadable builder response: " + e.getMessage());
        }

        if (response == null || response.isNull() || response.isMissingNode()) {
            throw new MalformedResponseException("Empty builder response");
        }
        if (response.isObject() && !response.path("success").asBoolean(false)) {
            String error = response.path("error").asText("");
            throw new UpstreamRejectedException(error.isBlank() ? "Failed to get partially prepared transactions" : error);
        }

        List<Bundle> bundles = ResponseShape.normalize(response);
        log.debug("Builder returned {} bundle(s)", bundles.size());
        return bundles;
    }

    Map<String, Object> buildRequestBody(List<String> walletAddresses, TradeIntent intent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("walletAddresses", walletAddresses);
        body.put("tokenAddress", intent.getTokenAddress());
        body.put("protocol", intent.getProtocol());

        AmountSpec amount = intent.getAmountSpec();
        if (amount != null && amount.side() == TradeSide.SELL) {
            body.put("sellPercent", amount.sellPercent());
        } else if (amount != null) {
            body.put("solAmount", amount.solAmount());
            if (amount.hasOverrides()) {
                body.put("amounts", amount.amounts());
            }
        }

        body.put("slippageBps", intent.getSlippageBps() != null ? intent.getSlippageBps() : props.getDefaultSlippageBps());
        body.put("jitoTipLamports", intent.getTipLamports() != null ? intent.getTipLamports() : props.getDefaultTipLamports());
        return body;
    }

    static String stripTrailingSlashes(String url) {
        if (url == null) return "";
        String u = url.trim();
        while (u.endsWith("/")) {
            u = u.substring(0, u.length() - 1);
        }
        return u;
    }
}
