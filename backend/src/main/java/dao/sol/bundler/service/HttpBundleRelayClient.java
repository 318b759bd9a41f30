package dao.sol.bundler.service;

import com.fasterxml.jackson.databind.JsonNode;
import dao.sol.bundler.config.TradingServerProperties;
import dao.sol.bundler.exception.ConfigurationException;
import dao.sol.bundler.exception.RelayRejectedException;
import dao.sol.bundler.exception.RelayUnreachableException;
import dao.sol.bundler.model.Bundle;
import dao.sol.bundler.model.RelayAck;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * Posts bundles to the relay's {@code /api/transactions/send}.
 */
@Slf4j
@Service
public class HttpBundleRelayClient implements BundleRelayClient {

    private final TradingServerProperties props;
    private final RestClient restClient;

    public HttpBundleRelayClient(TradingServerProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public void checkConfigured() {
        if (HttpBundlePreparationClient.stripTrailingSlashes(props.getRelayBaseUrl()).isEmpty()) {
            throw new ConfigurationException("Relay URL not configured");
        }
    }

    @Override
    public RelayAck send(Bundle bundle) {
        checkConfigured();
        String url = HttpBundlePreparationClient.stripTrailingSlashes(props.getRelayBaseUrl()) + "/api/transactions/send";

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("transactions", bundle.transactions()))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new RelayUnreachableException("Relay unreachable: " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new RelayUnreachableException("Relay HTTP error! Status: " + e.getStatusCode().value(), e);
        } catch (HttpClientErrorException e) {
            throw new RelayRejectedException(e.getStatusCode().value(), "Relay HTTP error", e.getResponseBodyAsString());
        } catch (RestClientException e) {
            throw new RelayRejectedException(null, "Unreadable relay response: " + e.getMessage(), null);
        }

        if (response == null || !response.path("success").asBoolean(false)) {
            String error = response != null ? response.path("error").asText(null) : null;
            String details = response != null ? response.path("details").asText(null) : null;
            throw new RelayRejectedException(null, error, details);
        }

        JsonNode result = response.path("result");
        JsonNode rpcError = result.path("error");
        if (rpcError.isObject()) {
            Integer code = rpcError.hasNonNull("code") ? rpcError.path("code").asInt() : null;
            throw new RelayRejectedException(code, rpcError.path("message").asText(null), null);
        }

        log.info("Bundle of {} transaction(s) accepted by relay: {}", bundle.size(), result.isTextual() ? result.asText() : result);
        return new RelayAck(true, result.isMissingNode() ? null : result, null, null);
    }
}
