package dao.ore.bmine.service;

import dao.ore.bmine.chain.ChainRpcClient;
import dao.ore.bmine.chain.Instruction;
import dao.ore.bmine.chain.OreProgram;
import dao.ore.bmine.chain.RelayClient;
import dao.ore.bmine.chain.Transaction;
import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.config.RelayProperties;
import dao.ore.bmine.model.Bundle;
import dao.ore.bmine.model.ClaimReport;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SimulationResult;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.WatchResult;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Moves claimable rewards of every identity to a beneficiary token account, in bundles of up to
 * 5 transactions of 5 claims each.
 * <p>
 * Every transaction of a bundle is simulated first; one rejection discards the whole bundle without sending it.
 * Dropped bundles are re-sent with a fresh blockhash.
 */
@Slf4j
@Service
public class ClaimService {

    private final ChainRpcClient rpc;
    private final RelayClient relay;
    private final OreProgram ore;
    private final SubmissionWatcher watcher;
    private final IdentityLoader identityLoader;
    private final MinerProperties minerProps;
    private final List<PublicKey> tipRecipients;

    public ClaimService(ChainRpcClient rpc, RelayClient relay, OreProgram ore, SubmissionWatcher watcher,
                        IdentityLoader identityLoader, MinerProperties minerProps, RelayProperties relayProps) {
        this.rpc = rpc;
        this.relay = relay;
        this.ore = ore;
        this.watcher = watcher;
        this.identityLoader = identityLoader;
        this.minerProps = minerProps;
        this.tipRecipients = relayProps.getTipRecipients().stream().map(PublicKey::fromBase58).toList();
    }

    private record Claimable(Identity identity, long amount) {}

    private record PendingTx(List<Instruction> instructions, PublicKey feePayer, List<Identity> signers) {}

    public ClaimReport claimOnce(PublicKey beneficiary, long threshold) throws InterruptedException {
        return claimOnce(identityLoader.identities(), beneficiary, threshold);
    }

    ClaimReport claimOnce(List<Identity> identities, PublicKey beneficiary, long threshold)
            throws InterruptedException {
        PublicKey beneficiaryTokens = ore.associatedTokenAddress(beneficiary);
        if (!rpc.fetchBalances(List.of(beneficiaryTokens)).containsKey(beneficiaryTokens)) {
            log.error("Token account does not exist: {}", beneficiaryTokens);
            return ClaimReport.EMPTY;
        }

        List<Claimable> claimable = fetchClaimable(identities);
        long remaining = claimable.stream().mapToLong(Claimable::amount).sum();
        log.info("claimable: accounts={}, total={}", claimable.size(), OreUnits.format(remaining));

        long claimed = 0;
        long rejected = 0;
        int landed = 0;
        int next = 0;
        long tip = minerProps.requirePriorityFee();

        while (next < claimable.size()) {
            List<List<Claimable>> groups = new ArrayList<>(Bundle.MAX_TRANSACTIONS);
            long bundleAmount = 0;
            while (groups.size() < Bundle.MAX_TRANSACTIONS && next < claimable.size()) {
                List<Claimable> group = claimable.subList(next,
                        Math.min(next + BundleBuilder.MAX_PROOFS_PER_TX, claimable.size()));
                next += group.size();
                groups.add(group);
                bundleAmount += group.stream().mapToLong(Claimable::amount).sum();
            }

            if (bundleAmount < threshold) {
                log.info("bundle reward {} is below threshold, will not claim (remaining={})",
                        OreUnits.format(bundleAmount), OreUnits.format(remaining));
                break;
            }

            List<PendingTx> pending = prepare(groups, beneficiaryTokens, tip);
            PublicKey recipient = tipRecipients.get(ThreadLocalRandom.current().nextInt(tipRecipients.size()));
            boolean resolved = false;
            while (!resolved) {
                LatestBlockhash blockhash;
                try {
                    blockhash = rpc.fetchLatestBlockhash();
                } catch (RuntimeException e) {
                    log.error("fetch latest blockhash failed: {}", e.getMessage());
                    Thread.sleep(minerProps.getRetryBackoffMs());
                    continue;
                }

                Bundle bundle = sign(pending, blockhash.blockhash(), recipient, tip);
                if (!simulateAll(bundle)) {
                    rejected += bundleAmount;
                    remaining -= bundleAmount;
                    log.warn("claim bundle rejected by simulation: amount={}, remaining={}",
                            OreUnits.format(bundleAmount), OreUnits.format(remaining));
                    resolved = true;
                    continue;
                }

                String bundleId;
                try {
                    bundleId = relay.sendBundle(bundle);
                } catch (RuntimeException e) {
                    log.error("send claim bundle failed: {}", e.getMessage());
                    Thread.sleep(minerProps.getRetryBackoffMs());
                    continue;
                }
                log.info("claim bundle sent: bundle={}, sig={}, amount={}, slot={}", bundleId,
                        bundle.trackingSignature(), OreUnits.format(bundleAmount), blockhash.slot());

                WatchResult result = watcher.awaitOutcome(new SubmissionRecord("claim",
                        List.of(bundle.trackingSignature()), blockhash.slot(), bundleAmount, tip, System.nanoTime()));
                if (result.landed()) {
                    claimed += bundleAmount;
                    remaining -= bundleAmount;
                    landed++;
                    resolved = true;
                    log.info("claim successfully: amount={}, remaining={}", OreUnits.format(bundleAmount),
                            OreUnits.format(remaining));
                } else {
                    log.error("claim bundle dropped, retrying: amount={}, slot={}", OreUnits.format(bundleAmount),
                            result.lastSlot());
                }
            }
        }

        return new ClaimReport(claimed, rejected, remaining, landed);
    }

    private List<Claimable> fetchClaimable(List<Identity> identities) {
        List<Optional<Proof>> proofs = rpc.fetchProofs(identities.stream().map(Identity::proofAddress).toList());
        List<Claimable> claimable = new ArrayList<>();
        for (int i = 0; i < identities.size(); i++) {
            long amount = proofs.get(i).map(Proof::claimableRewards).orElse(0L);
            if (amount > 0) {
                claimable.add(new Claimable(identities.get(i), amount));
            }
        }
        claimable.sort(Comparator.comparingLong(Claimable::amount).reversed());
        return claimable;
    }

    private List<PendingTx> prepare(List<List<Claimable>> groups, PublicKey beneficiaryTokens, long tip) {
        List<PendingTx> pending = new ArrayList<>(groups.size());
        for (List<Claimable> group : groups) {
            List<Identity> signers = group.stream().map(Claimable::identity).toList();
            List<Instruction> ixs = new ArrayList<>(group.size() + 1);
            for (Claimable c : group) {
                ixs.add(ore.claim(c.identity().publicKey(), beneficiaryTokens, c.amount()));
            }
            pending.add(new PendingTx(ixs, richestOrRandom(signers), signers));
        }
        return pending;
    }

    private PublicKey richestOrRandom(List<Identity> signers) {
        try {
            Map<PublicKey, Long> balances = rpc.fetchBalances(signers.stream().map(Identity::publicKey).toList());
            return signers.stream()
                    .map(Identity::publicKey)
                    .max(Comparator.comparingLong(k -> balances.getOrDefault(k, 0L)))
                    .orElseThrow();
        } catch (RuntimeException e) {
            log.error("fetch balances for signers failed: {}", e.getMessage());
            return signers.get(ThreadLocalRandom.current().nextInt(signers.size())).publicKey();
        }
    }

    private Bundle sign(List<PendingTx> pending, byte[] blockhash, PublicKey recipient, long tip) {
        List<Transaction> txs = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            PendingTx tx = pending.get(i);
            List<Instruction> ixs = new ArrayList<>(tx.instructions());
            if (i == 0) {
                ixs.add(OreProgram.transfer(tx.feePayer(), recipient, tip));
            }
            txs.add(new Transaction(ixs, tx.feePayer(), blockhash).sign(tx.signers()));
        }
        return new Bundle(txs, pending.get(0).feePayer(), recipient, tip, Map.of());
    }

    private boolean simulateAll(Bundle bundle) {
        for (Transaction tx : bundle.transactions()) {
            try {
                SimulationResult result = rpc.simulate(tx);
                if (result.isSuccess()) {
                    continue;
                }
                log.error("simulation returns error: {}", result.error());
            } catch (RuntimeException e) {
                log.error("simulate transaction failed: {}", e.getMessage());
            }
            return false;
        }
        return true;
    }
}
