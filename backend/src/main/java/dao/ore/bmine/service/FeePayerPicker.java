package dao.ore.bmine.service;

import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.PublicKey;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class FeePayerPicker {

    /**
     * Richest candidate by known balance. Ties keep the earliest candidate.
     *
     * @throws IllegalArgumentException when {@code candidates} is empty
     * @throws MissingBalanceException  when a candidate has no known balance
     */
    public Identity pick(Map<PublicKey, Long> balances, List<Identity> candidates) {
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("candidates should not be empty");
        }
        Identity richest = null;
        long best = Long.MIN_VALUE;
        for (Identity candidate : candidates) {
            Long balance = balances.get(candidate.publicKey());
            if (balance == null) {
                throw new MissingBalanceException(candidate.publicKey());
            }
            if (richest == null || balance > best) {
                richest = candidate;
                best = balance;
            }
        }
        return richest;
    }
}
