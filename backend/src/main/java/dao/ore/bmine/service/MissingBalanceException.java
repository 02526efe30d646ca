package dao.ore.bmine.service;

import dao.ore.bmine.model.PublicKey;

/**
 * A balance expected from the cycle's balance fetch is absent. The affected batch is skipped for this cycle.
 */
public class MissingBalanceException extends RuntimeException {

    private final PublicKey account;

    public MissingBalanceException(PublicKey account) {
        super("balance unavailable for " + account);
        this.account = account;
    }

    public PublicKey getAccount() {
        return account;
    }
}
