package dao.sol.bundler.service;

import com.fasterxml.jackson.databind.JsonNode;
import dao.sol.bundler.config.SidePaymentProperties;
import dao.sol.bundler.exception.UpstreamRejectedException;
import dao.sol.bundler.exception.UpstreamUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solana JSON-RPC {@code getLatestBlockhash}.
 */
@Slf4j
@Service
public class RpcBlockhashProvider implements BlockhashProvider {

    private final SidePaymentProperties props;
    private final RestClient restClient;

    public RpcBlockhashProvider(SidePaymentProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder.build();
    }

    @Override
    public String getLatestBlockhash() {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", 1);
        request.put("method", "getLatestBlockhash");
        request.put("params", List.of(Map.of("commitment", "confirmed")));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(props.getRpcEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new UpstreamUnavailableException("getLatestBlockhash failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new UpstreamRejectedException("getLatestBlockhash returned no body");
        }
        if (response.hasNonNull("error")) {
            throw new UpstreamRejectedException("getLatestBlockhash failed: " + response.path("error").path("message").asText());
        }
        String blockhash = response.path("result").path("value").path("blockhash").asText("");
        if (blockhash.isEmpty()) {
            throw new UpstreamRejectedException("getLatestBlockhash returned no blockhash");
        }
        log.debug("Latest blockhash: {}", blockhash);
        return blockhash;
    }
}
