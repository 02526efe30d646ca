package dao.ore.bmine.model;

import dao.ore.bmine.chain.Transaction;

import java.util.List;
import java.util.Map;

/**
 * Signed transactions relayed as one atomic unit, carrying exactly one bribe.
 *
 * @param feeCosts fee payer to lamports it pays for this bundle (signature fees plus tip where it is the tipper)
 */
public record Bundle(List<Transaction> transactions, PublicKey tipper, PublicKey tipRecipient, long tip,
                     Map<PublicKey, Long> feeCosts) {

    public static final int MAX_TRANSACTIONS = 5;

    public Bundle {
        if (transactions.isEmpty() || transactions.size() > MAX_TRANSACTIONS) {
            throw new IllegalArgumentException("Bundle must hold 1.." + MAX_TRANSACTIONS
                    + " transactions, got " + transactions.size());
        }
        transactions = List.copyOf(transactions);
        feeCosts = Map.copyOf(feeCosts);
    }

    /**
     * Signature tracked for landing: first signature of the first transaction. The relay does not return it.
     */
    public String trackingSignature() {
        return transactions.get(0).signature();
    }

    public List<String> encodedTransactions() {
        return transactions.stream().map(Transaction::toBase58).toList();
    }
}
