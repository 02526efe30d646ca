package dao.ore.bmine.util;

import dao.ore.bmine.model.PublicKey;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.jcajce.provider.digest.Keccak;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Cryptographic utilities.
 *
 * Program-derived addresses follow the ledger's rule: sha256(seeds || bump || programId || marker)
 * searched from bump 255 downwards until the digest is NOT a valid ed25519 point.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    private static final byte[] PDA_MARKER = "ProgramDerivedAddress".getBytes(StandardCharsets.UTF_8);

    // curve25519: p = 2^255 - 19, d = -121665/121666
    private static final BigInteger P = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.valueOf(19));
    private static final BigInteger D = BigInteger.valueOf(-121665)
            .multiply(BigInteger.valueOf(121666).modInverse(P))
            .mod(P);
    private static final BigInteger LEGENDRE_EXP = P.subtract(BigInteger.ONE).shiftRight(1);

    public record ProgramAddress(PublicKey address, int bump) {}

    public static byte[] sha256(byte[]... parts) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            for (byte[] p : parts) md.update(p);
            return md.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static byte[] keccak256(byte[]... parts) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        for (byte[] p : parts) digest.update(p);
        return digest.digest();
    }

    public static byte[] sign(Ed25519PrivateKeyParameters key, byte[] message) {
        Ed25519Signer signer = new Ed25519Signer();
        signer.init(true, key);
        signer.update(message, 0, message.length);
        return signer.generateSignature();
    }

    public static boolean verify(PublicKey publicKey, byte[] message, byte[] signature) {
        Ed25519Signer verifier = new Ed25519Signer();
        verifier.init(false, new org.bouncycastle.crypto.params.Ed25519PublicKeyParameters(publicKey.toBytes(), 0));
        verifier.update(message, 0, message.length);
        return verifier.verifySignature(signature);
    }

    public static ProgramAddress findProgramAddress(List<byte[]> seeds, PublicKey programId) {
        for (int bump = 255; bump >= 0; bump--) {
            byte[][] parts = new byte[seeds.size() + 3][];
            for (int i = 0; i < seeds.size(); i++) {
                parts[i] = seeds.get(i);
            }
            parts[seeds.size()] = new byte[]{(byte) bump};
            parts[seeds.size() + 1] = programId.toBytes();
            parts[seeds.size() + 2] = PDA_MARKER;
            byte[] candidate = sha256(parts);
            if (!isOnCurve(candidate)) {
                return new ProgramAddress(new PublicKey(candidate), bump);
            }
        }
        throw new IllegalStateException("Unable to find a viable program address bump seed");
    }

    /**
     * True when the 32 bytes decompress to an ed25519 point, i.e. (y^2 - 1) / (d*y^2 + 1) is a square mod p.
     */
    public static boolean isOnCurve(byte[] compressed) {
        if (compressed.length != 32) {
            throw new IllegalArgumentException("Compressed point must be 32 bytes, got " + compressed.length);
        }
        byte[] be = new byte[32];
        for (int i = 0; i < 32; i++) {
            be[i] = compressed[31 - i];
        }
        be[0] &= 0x7f; // sign bit of x
        BigInteger y = new BigInteger(1, be).mod(P);
        BigInteger y2 = y.multiply(y).mod(P);
        BigInteger u = y2.subtract(BigInteger.ONE).mod(P);
        BigInteger v = D.multiply(y2).add(BigInteger.ONE).mod(P);
        BigInteger x2 = u.multiply(v.modInverse(P)).mod(P);
        return x2.signum() == 0 || x2.modPow(LEGENDRE_EXP, P).equals(BigInteger.ONE);
    }

    public static void putLongLE(byte[] dst, int offset, long value) {
        for (int i = 0; i < 8; i++) {
            dst[offset + i] = (byte) (value >>> (8 * i));
        }
    }

    public static long readLongLE(byte[] src, int offset) {
        long v = 0;
        for (int i = 7; i >= 0; i--) {
            v = (v << 8) | (src[offset + i] & 0xffL);
        }
        return v;
    }
}
