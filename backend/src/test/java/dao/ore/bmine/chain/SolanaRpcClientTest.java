package dao.ore.bmine.chain;

import dao.ore.bmine.TestFixtures;
import dao.ore.bmine.config.ChainProperties;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SignatureStatuses;
import org.bitcoinj.core.Base58;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SolanaRpcClientTest {

    private final StubExchange stub = new StubExchange();

    private SolanaRpcClient client() {
        return new SolanaRpcClient(stub.webClient(), TestFixtures.oreProgram(), new ChainProperties());
    }

    @Test
    void fetchBalances_omitsMissingAccounts() {
        stub.respond("""
                {"jsonrpc":"2.0","id":1,"result":{"context":{"slot":10},
                 "value":[{"lamports":5000,"data":["","base64"]},null]}}
                """);
        PublicKey a = TestFixtures.identity(0).publicKey();
        PublicKey b = TestFixtures.identity(1).publicKey();

        Map<PublicKey, Long> balances = client().fetchBalances(List.of(a, b));

        assertEquals(Map.of(a, 5000L), balances);
    }

    @Test
    void fetchProofs_splitsRequestsAtNodeLimit() {
        stub.respond(nulls(100)).respond(nulls(50));
        List<PublicKey> addresses = TestFixtures.identities(0, 150).stream()
                .map(i -> i.proofAddress()).toList();

        List<Optional<Proof>> proofs = client().fetchProofs(addresses);

        assertEquals(150, proofs.size());
        assertTrue(proofs.stream().allMatch(Optional::isEmpty));
        assertEquals(2, stub.calls());
    }

    @Test
    void fetchBalances_wrongAccountCountFails() {
        stub.respond(nulls(1));

        assertThrows(ChainRpcException.class,
                () -> client().fetchBalances(TestFixtures.identities(0, 2).stream().map(i -> i.publicKey()).toList()));
    }

    @Test
    void fetchLatestBlockhash_decodesHashAndContextSlot() {
        byte[] hash = new byte[32];
        hash[31] = 9;
        stub.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":321},"
                + "\"value\":{\"blockhash\":\"" + Base58.encode(hash) + "\",\"lastValidBlockHeight\":400}}}");

        LatestBlockhash latest = client().fetchLatestBlockhash();

        assertArrayEquals(hash, latest.blockhash());
        assertEquals(321, latest.slot());
    }

    @Test
    void fetchSignatureStatuses_keepsRequestOrder() {
        stub.respond("""
                {"jsonrpc":"2.0","id":1,"result":{"context":{"slot":77},"value":[
                  null,
                  {"slot":70,"confirmations":3,"err":null,"confirmationStatus":"confirmed"},
                  {"slot":70,"confirmations":null,"err":{"InstructionError":[0,"Custom"]},"confirmationStatus":"finalized"}
                ]}}
                """);

        SignatureStatuses statuses = client().fetchSignatureStatuses(List.of("a", "b", "c"));

        assertEquals(77, statuses.slot());
        assertTrue(statuses.statuses().get(0).isEmpty());
        assertTrue(statuses.statuses().get(1).orElseThrow().isLanded());
        assertFalse(statuses.statuses().get(2).orElseThrow().isLanded());
    }

    @Test
    void call_rpcErrorBecomesChainRpcException() {
        stub.respond("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"Node is behind\"}}");

        ChainRpcException e = assertThrows(ChainRpcException.class, () -> client().fetchLatestBlockhash());
        assertTrue(e.getMessage().contains("Node is behind"));
    }

    private static String nulls(int count) {
        String values = IntStream.range(0, count).mapToObj(i -> "null").collect(Collectors.joining(","));
        return "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"context\":{\"slot\":1},\"value\":[" + values + "]}}";
    }
}
