package dao.ore.bmine.chain;

import com.fasterxml.jackson.databind.JsonNode;
import dao.ore.bmine.model.Bundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Block-engine relay: JSON-RPC {@code sendBundle} with base58-encoded transactions.
 */
@Slf4j
@Service
public class JitoRelayClient implements RelayClient {

    private static final Duration TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;

    public JitoRelayClient(@Qualifier("relayWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    public String sendBundle(Bundle bundle) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", 1);
        body.put("method", "sendBundle");
        body.put("params", List.of(bundle.encodedTransactions()));

        JsonNode response;
        try {
            response = webClient.post()
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(TIMEOUT);
        } catch (WebClientResponseException e) {
            throw new RelayException("status code: " + e.getStatusCode() + ", response: " + e.getResponseBodyAsString(), e);
        } catch (RuntimeException e) {
            throw new RelayException("fail to send request: " + e.getMessage(), e);
        }

        if (response == null || !response.hasNonNull("result")) {
            throw new RelayException("fail to deserialize response: " + response);
        }
        String bundleId = response.get("result").asText();
        log.debug("bundle accepted: id={}, txs={}, signature={}", bundleId, bundle.transactions().size(),
                bundle.trackingSignature());
        return bundleId;
    }
}
