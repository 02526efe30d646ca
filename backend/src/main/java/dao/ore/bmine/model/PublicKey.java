package dao.ore.bmine.model;

import org.bitcoinj.core.Base58;

import java.util.Arrays;

/**
 * 32-byte ledger address, rendered as base58.
 */
public final class PublicKey {

    public static final int LENGTH = 32;

    private final byte[] bytes;

    public PublicKey(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Public key must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static PublicKey fromBase58(String value) {
        return new PublicKey(Base58.decode(value.trim()));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toBase58() {
        return Base58.encode(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PublicKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
