package dao.ore.bmine.chain;

import dao.ore.bmine.model.Bundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JitoRelayClientTest {

    private final StubExchange stub = new StubExchange();
    private Bundle bundle;

    @BeforeEach
    void setUp() {
        bundle = mock(Bundle.class);
        when(bundle.encodedTransactions()).thenReturn(List.of("3Bxs4h24hBtQy9rw"));
    }

    @Test
    void sendBundle_returnsBundleId() {
        stub.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"2id3YC2jK9G5Wo2phDx4gJVAew8DcY5NAojnVuao8rkxwPYPe8cSwE5GzhEgJA2y8fVjDEo6iR6ykBvDxrTQrtpb\"}");

        String id = new JitoRelayClient(stub.webClient()).sendBundle(bundle);

        assertTrue(id.startsWith("2id3YC2jK9G5"));
    }

    @Test
    void sendBundle_httpErrorCarriesStatusAndBody() {
        stub.respond(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"rate limited\"}");

        RelayException e = assertThrows(RelayException.class,
                () -> new JitoRelayClient(stub.webClient()).sendBundle(bundle));
        assertTrue(e.getMessage().contains("429"));
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    void sendBundle_missingResultFails() {
        stub.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"bundle contains an expired blockhash\"}}");

        assertThrows(RelayException.class, () -> new JitoRelayClient(stub.webClient()).sendBundle(bundle));
    }
}
