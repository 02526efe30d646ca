package dao.ore.bmine.chain;

import dao.ore.bmine.model.PublicKey;

public record AccountMeta(PublicKey publicKey, boolean signer, boolean writable) {

    public static AccountMeta writable(PublicKey key, boolean signer) {
        return new AccountMeta(key, signer, true);
    }

    public static AccountMeta readonly(PublicKey key, boolean signer) {
        return new AccountMeta(key, signer, false);
    }
}
