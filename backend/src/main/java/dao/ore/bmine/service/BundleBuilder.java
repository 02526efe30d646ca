package dao.ore.bmine.service;

import dao.ore.bmine.chain.Instruction;
import dao.ore.bmine.chain.OreProgram;
import dao.ore.bmine.chain.Transaction;
import dao.ore.bmine.config.OreProperties;
import dao.ore.bmine.config.RelayProperties;
import dao.ore.bmine.model.Bundle;
import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SolveResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Turns solved proofs into signed bundles.
 * <p>
 * Pairs are chunked into transactions of at most {@value #MAX_PROOFS_PER_TX} proofs and transactions into bundles
 * of at most {@value Bundle#MAX_TRANSACTIONS}. Each transaction is paid by the richest identity of its own chunk;
 * each bundle is tipped once by the richest identity of the whole bundle, with the bribe placed right after that
 * identity's own proof instruction.
 */
@Slf4j
@Service
public class BundleBuilder {

    public static final int MAX_PROOFS_PER_TX = 5;

    private final OreProgram ore;
    private final FeePayerPicker feePayerPicker;
    private final List<PublicKey> tipRecipients;
    private final long feePerSigner;

    public BundleBuilder(OreProgram ore, FeePayerPicker feePayerPicker, RelayProperties relayProps,
                         OreProperties oreProps) {
        this.ore = ore;
        this.feePayerPicker = feePayerPicker;
        this.tipRecipients = relayProps.getTipRecipients().stream().map(PublicKey::fromBase58).toList();
        this.feePerSigner = oreProps.getFeePerSigner();
        if (tipRecipients.isEmpty()) {
            throw new IllegalStateException("relay.tip-recipients must not be empty");
        }
    }

    /**
     * @throws MissingBalanceException when a fee payer or tipper candidate has no known balance
     */
    public List<Bundle> build(List<Identity> identities, List<SolveResult> results, Map<PublicKey, Long> balances,
                              byte[] blockhash, Bus bus, long tip) {
        if (identities.size() != results.size()) {
            throw new IllegalArgumentException("identities (" + identities.size()
                    + ") and solve results (" + results.size() + ") differ in size");
        }
        int perBundle = MAX_PROOFS_PER_TX * Bundle.MAX_TRANSACTIONS;
        List<Bundle> bundles = new ArrayList<>();
        for (int from = 0; from < identities.size(); from += perBundle) {
            int to = Math.min(from + perBundle, identities.size());
            bundles.add(buildOne(identities.subList(from, to), results.subList(from, to), balances, blockhash, bus, tip));
        }
        return bundles;
    }

    private Bundle buildOne(List<Identity> identities, List<SolveResult> results, Map<PublicKey, Long> balances,
                            byte[] blockhash, Bus bus, long tip) {
        PublicKey busAddress = ore.busAddress(bus.id());
        Identity tipper = feePayerPicker.pick(balances, identities);
        PublicKey recipient = pickTipRecipient();

        List<Transaction> transactions = new ArrayList<>(Bundle.MAX_TRANSACTIONS);
        Map<PublicKey, Long> feeCosts = new LinkedHashMap<>();

        for (int from = 0; from < identities.size(); from += MAX_PROOFS_PER_TX) {
            int to = Math.min(from + MAX_PROOFS_PER_TX, identities.size());
            List<Identity> group = identities.subList(from, to);
            Identity feePayer = feePayerPicker.pick(balances, group);

            List<Instruction> ixs = new ArrayList<>(group.size() + 1);
            boolean tipped = false;
            for (int i = from; i < to; i++) {
                Identity signer = identities.get(i);
                SolveResult result = results.get(i);
                ixs.add(ore.mine(signer.publicKey(), busAddress, result.hash(), result.nonce()));
                if (signer.publicKey().equals(tipper.publicKey())) {
                    ixs.add(OreProgram.transfer(tipper.publicKey(), recipient, tip));
                    tipped = true;
                }
            }

            transactions.add(new Transaction(ixs, feePayer.publicKey(), blockhash).sign(group));
            long cost = feePerSigner * group.size() + (tipped ? tip : 0);
            feeCosts.merge(feePayer.publicKey(), cost, Long::sum);
        }

        log.debug("bundle built: bus={}, txs={}, tipper={}, tip={}", bus.id(), transactions.size(), tipper, tip);
        return new Bundle(transactions, tipper.publicKey(), recipient, tip, feeCosts);
    }

    private PublicKey pickTipRecipient() {
        return tipRecipients.get(ThreadLocalRandom.current().nextInt(tipRecipients.size()));
    }
}
