package dao.ore.bmine.model;

import java.util.List;

/**
 * Fixed-size group of identities, the unit of pooled scheduling. Addressed by {@code id} in the batch arena.
 */
public record IdentityBatch(int id, List<Identity> identities) {

    public IdentityBatch {
        identities = List.copyOf(identities);
    }

    public int size() {
        return identities.size();
    }

    public List<PublicKey> publicKeys() {
        return identities.stream().map(Identity::publicKey).toList();
    }

    public List<PublicKey> proofAddresses() {
        return identities.stream().map(Identity::proofAddress).toList();
    }
}
