package dao.ore.bmine.chain;

import com.fasterxml.jackson.databind.JsonNode;
import dao.ore.bmine.config.ChainProperties;
import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.ChainClock;
import dao.ore.bmine.model.ChainSnapshot;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SignatureStatus;
import dao.ore.bmine.model.SignatureStatuses;
import dao.ore.bmine.model.SimulationResult;
import dao.ore.bmine.model.Treasury;
import lombok.extern.slf4j.Slf4j;
import org.bitcoinj.core.Base58;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * JSON-RPC client of the ledger node over {@link WebClient}. Calls block the worker thread that issues them.
 */
@Slf4j
@Service
public class SolanaRpcClient implements ChainRpcClient {

    /** Node limit for getMultipleAccounts. */
    public static final int FETCH_ACCOUNT_LIMIT = 100;

    private final WebClient webClient;
    private final OreProgram ore;
    private final Duration timeout;
    private final AtomicLong requestId = new AtomicLong();

    public SolanaRpcClient(@Qualifier("ledgerWebClient") WebClient webClient,
                           OreProgram ore,
                           ChainProperties chainProps) {
        this.webClient = webClient;
        this.ore = ore;
        this.timeout = Duration.ofMillis(chainProps.getRequestTimeoutMs());
        log.info("SolanaRpcClient initialized: rpc={}", chainProps.getRpcUrl());
    }

    @Override
    public ChainSnapshot fetchSnapshot() {
        List<PublicKey> keys = new ArrayList<>();
        keys.add(ore.treasury());
        keys.add(OreProgram.CLOCK_SYSVAR);
        keys.addAll(ore.busAddresses());

        List<JsonNode> accounts = getMultipleAccounts(keys, "processed");
        try {
            Treasury treasury = AccountDecoder.decodeTreasury(requireData("treasury", accounts.get(0)));
            ChainClock clock = AccountDecoder.decodeClock(requireData("clock", accounts.get(1)));
            List<Bus> buses = new ArrayList<>(keys.size() - 2);
            for (int i = 2; i < accounts.size(); i++) {
                buses.add(AccountDecoder.decodeBus(requireData("bus", accounts.get(i))));
            }
            return new ChainSnapshot(treasury, clock, buses);
        } catch (IllegalArgumentException e) {
            throw new ChainRpcException("failed to decode system accounts: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Optional<Proof>> fetchProofs(List<PublicKey> proofAddresses) {
        List<Optional<Proof>> proofs = new ArrayList<>(proofAddresses.size());
        for (int from = 0; from < proofAddresses.size(); from += FETCH_ACCOUNT_LIMIT) {
            List<PublicKey> chunk = proofAddresses.subList(from, Math.min(from + FETCH_ACCOUNT_LIMIT, proofAddresses.size()));
            List<JsonNode> accounts = getMultipleAccounts(chunk, "processed");
            for (int i = 0; i < accounts.size(); i++) {
                JsonNode account = accounts.get(i);
                if (account == null || account.isNull()) {
                    proofs.add(Optional.empty());
                    continue;
                }
                try {
                    proofs.add(Optional.of(AccountDecoder.decodeProof(decodeData(account))));
                } catch (IllegalArgumentException e) {
                    throw new ChainRpcException("failed to deserialize proof account " + chunk.get(i) + ": " + e.getMessage(), e);
                }
            }
        }
        return proofs;
    }

    @Override
    public Map<PublicKey, Long> fetchBalances(List<PublicKey> accounts) {
        Map<PublicKey, Long> balances = new HashMap<>();
        for (int from = 0; from < accounts.size(); from += FETCH_ACCOUNT_LIMIT) {
            List<PublicKey> chunk = accounts.subList(from, Math.min(from + FETCH_ACCOUNT_LIMIT, accounts.size()));
            List<JsonNode> values = getMultipleAccounts(chunk, "confirmed");
            for (int i = 0; i < values.size(); i++) {
                JsonNode account = values.get(i);
                if (account != null && !account.isNull()) {
                    balances.put(chunk.get(i), account.path("lamports").asLong());
                }
            }
        }
        return balances;
    }

    @Override
    public LatestBlockhash fetchLatestBlockhash() {
        JsonNode result = call("getLatestBlockhash", List.of(Map.of("commitment", "confirmed")));
        String blockhash = result.path("value").path("blockhash").asText(null);
        if (blockhash == null) {
            throw new ChainRpcException("getLatestBlockhash returned no blockhash");
        }
        byte[] decoded;
        try {
            decoded = Base58.decode(blockhash);
        } catch (RuntimeException e) {
            throw new ChainRpcException("fail to parse blockhash " + blockhash, e);
        }
        return new LatestBlockhash(decoded, result.path("context").path("slot").asLong());
    }

    @Override
    public SignatureStatuses fetchSignatureStatuses(List<String> signatures) {
        JsonNode result = call("getSignatureStatuses", List.of(signatures));
        long slot = result.path("context").path("slot").asLong();
        List<Optional<SignatureStatus>> statuses = new ArrayList<>(signatures.size());
        for (JsonNode s : result.path("value")) {
            if (s == null || s.isNull()) {
                statuses.add(Optional.empty());
                continue;
            }
            JsonNode confirmations = s.get("confirmations");
            statuses.add(Optional.of(new SignatureStatus(
                    s.hasNonNull("confirmationStatus") ? s.get("confirmationStatus").asText() : null,
                    confirmations == null || confirmations.isNull() ? null : confirmations.asLong(),
                    s.hasNonNull("err")
            )));
        }
        return new SignatureStatuses(statuses, slot);
    }

    @Override
    public SimulationResult simulate(Transaction transaction) {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("encoding", "base64");
        config.put("sigVerify", false);
        config.put("replaceRecentBlockhash", true);
        config.put("commitment", "processed");

        JsonNode value = call("simulateTransaction", List.of(transaction.toBase64(), config)).path("value");
        List<String> logs = new ArrayList<>();
        value.path("logs").forEach(l -> logs.add(l.asText()));
        String error = value.hasNonNull("err") ? value.get("err").toString() : null;
        return new SimulationResult(error, logs);
    }

    private List<JsonNode> getMultipleAccounts(List<PublicKey> keys, String commitment) {
        List<String> encoded = keys.stream().map(PublicKey::toBase58).toList();
        JsonNode result = call("getMultipleAccounts",
                List.of(encoded, Map.of("encoding", "base64", "commitment", commitment)));
        JsonNode value = result.path("value");
        if (!value.isArray() || value.size() != keys.size()) {
            throw new ChainRpcException("getMultipleAccounts returned " + value.size() + " accounts, expected " + keys.size());
        }
        List<JsonNode> out = new ArrayList<>(keys.size());
        value.forEach(out::add);
        return out;
    }

    private JsonNode call(String method, List<?> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestId.incrementAndGet());
        body.put("method", method);
        body.put("params", params);

        JsonNode response;
        try {
            response = webClient.post()
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
        } catch (RuntimeException e) {
            throw new ChainRpcException(method + " failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ChainRpcException(method + " returned an empty response");
        }
        if (response.hasNonNull("error")) {
            throw new ChainRpcException(method + " returned error: " + response.get("error"));
        }
        JsonNode result = response.get("result");
        if (result == null) {
            throw new ChainRpcException(method + " returned no result");
        }
        return result;
    }

    private static byte[] requireData(String name, JsonNode account) {
        if (account == null || account.isNull()) {
            throw new ChainRpcException(name + " account doesn't exist");
        }
        return decodeData(account);
    }

    private static byte[] decodeData(JsonNode account) {
        JsonNode data = account.path("data");
        String b64 = data.isArray() ? data.path(0).asText("") : data.asText("");
        return Base64.getDecoder().decode(b64);
    }
}
