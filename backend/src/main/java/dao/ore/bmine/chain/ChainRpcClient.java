package dao.ore.bmine.chain;

import dao.ore.bmine.model.ChainSnapshot;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SignatureStatuses;
import dao.ore.bmine.model.SimulationResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ledger queries used by the miner. Every method throws {@link ChainRpcException} on transient failure.
 */
public interface ChainRpcClient {

    ChainSnapshot fetchSnapshot();

    /**
     * Proof accounts in request order; empty where the account does not exist.
     */
    List<Optional<Proof>> fetchProofs(List<PublicKey> proofAddresses);

    /**
     * Lamport balances of existing accounts. Accounts that do not exist are absent from the map.
     */
    Map<PublicKey, Long> fetchBalances(List<PublicKey> accounts);

    LatestBlockhash fetchLatestBlockhash();

    SignatureStatuses fetchSignatureStatuses(List<String> signatures);

    SimulationResult simulate(Transaction transaction);

    /**
     * Proofs of all addresses; fails if any is missing (identity not registered).
     */
    default List<Proof> fetchRequiredProofs(List<PublicKey> proofAddresses) {
        List<Optional<Proof>> proofs = fetchProofs(proofAddresses);
        for (int i = 0; i < proofs.size(); i++) {
            if (proofs.get(i).isEmpty()) {
                throw new ChainRpcException("account " + proofAddresses.get(i) + " not registered");
            }
        }
        return proofs.stream().map(Optional::get).toList();
    }
}
