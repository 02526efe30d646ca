package dao.ore.bmine.model;

import dao.ore.bmine.util.CryptoUtil;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;

/**
 * A signing keypair plus its derived proof-account address. Immutable once loaded.
 */
public final class Identity {

    private final Ed25519PrivateKeyParameters privateKey;
    private final PublicKey publicKey;
    private final PublicKey proofAddress;

    public Identity(Ed25519PrivateKeyParameters privateKey, PublicKey proofAddress) {
        this.privateKey = privateKey;
        this.publicKey = new PublicKey(privateKey.generatePublicKey().getEncoded());
        this.proofAddress = proofAddress;
    }

    public PublicKey publicKey() {
        return publicKey;
    }

    public PublicKey proofAddress() {
        return proofAddress;
    }

    public byte[] sign(byte[] message) {
        return CryptoUtil.sign(privateKey, message);
    }

    @Override
    public String toString() {
        return publicKey.toBase58();
    }
}
