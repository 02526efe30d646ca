package dao.ore.bmine.chain;

import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.PublicKey;
import org.bitcoinj.core.Base58;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Legacy-format ledger transaction.
 * <p>
 * Account keys are ordered fee payer first, then writable signers, readonly signers, writable non-signers and
 * readonly non-signers, each group keeping first-seen order. Signatures follow the order of the signer keys.
 */
public class Transaction {

    public static final int SIGNATURE_LENGTH = 64;

    private final List<Instruction> instructions;
    private final PublicKey feePayer;
    private final byte[] recentBlockhash;
    private final List<PublicKey> accountKeys;
    private final int requiredSignatures;
    private final int readonlySigned;
    private final int readonlyUnsigned;
    private final byte[] message;
    private final byte[][] signatures;

    public Transaction(List<Instruction> instructions, PublicKey feePayer, byte[] recentBlockhash) {
        if (recentBlockhash == null || recentBlockhash.length != 32) {
            throw new IllegalArgumentException("Blockhash must be 32 bytes");
        }
        this.instructions = List.copyOf(instructions);
        this.feePayer = feePayer;
        this.recentBlockhash = recentBlockhash.clone();

        Map<PublicKey, boolean[]> metas = new LinkedHashMap<>();
        metas.put(feePayer, new boolean[]{true, true});
        for (Instruction ix : this.instructions) {
            for (AccountMeta m : ix.accounts()) {
                boolean[] flags = metas.computeIfAbsent(m.publicKey(), k -> new boolean[2]);
                flags[0] |= m.signer();
                flags[1] |= m.writable();
            }
            metas.computeIfAbsent(ix.programId(), k -> new boolean[2]);
        }

        List<PublicKey> ordered = new ArrayList<>(metas.size());
        ordered.add(feePayer);
        int[] counts = new int[4];
        for (int group = 0; group < 4; group++) {
            boolean signer = group < 2;
            boolean writable = group % 2 == 0;
            for (Map.Entry<PublicKey, boolean[]> e : metas.entrySet()) {
                if (e.getKey().equals(feePayer)) continue;
                boolean[] f = e.getValue();
                if (f[0] == signer && f[1] == writable) {
                    ordered.add(e.getKey());
                    counts[group]++;
                }
            }
        }
        this.accountKeys = List.copyOf(ordered);
        this.requiredSignatures = 1 + counts[0] + counts[1];
        this.readonlySigned = counts[1];
        this.readonlyUnsigned = counts[3];
        this.message = compileMessage();
        this.signatures = new byte[requiredSignatures][];
    }

    private byte[] compileMessage() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(1232);
        out.write(requiredSignatures);
        out.write(readonlySigned);
        out.write(readonlyUnsigned);
        writeShortVec(out, accountKeys.size());
        for (PublicKey key : accountKeys) {
            out.writeBytes(key.toBytes());
        }
        out.writeBytes(recentBlockhash);
        writeShortVec(out, instructions.size());
        for (Instruction ix : instructions) {
            out.write(accountKeys.indexOf(ix.programId()));
            writeShortVec(out, ix.accounts().size());
            for (AccountMeta m : ix.accounts()) {
                out.write(accountKeys.indexOf(m.publicKey()));
            }
            writeShortVec(out, ix.data().length);
            out.writeBytes(ix.data());
        }
        return out.toByteArray();
    }

    /**
     * Signs with every required signer. Each key in {@code signers} must be one of the transaction's signer keys
     * and every signer key must be covered.
     */
    public Transaction sign(List<Identity> signers) {
        for (Identity identity : signers) {
            int index = accountKeys.indexOf(identity.publicKey());
            if (index < 0 || index >= requiredSignatures) {
                throw new IllegalArgumentException("Unexpected signer: " + identity.publicKey());
            }
            signatures[index] = identity.sign(message);
        }
        for (int i = 0; i < requiredSignatures; i++) {
            if (signatures[i] == null) {
                throw new IllegalStateException("Missing signature for " + accountKeys.get(i));
            }
        }
        return this;
    }

    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(1232);
        writeShortVec(out, requiredSignatures);
        for (byte[] sig : signatures) {
            out.writeBytes(sig != null ? sig : new byte[SIGNATURE_LENGTH]);
        }
        out.writeBytes(message);
        return out.toByteArray();
    }

    public String toBase58() {
        return Base58.encode(serialize());
    }

    public String toBase64() {
        return Base64.getEncoder().encodeToString(serialize());
    }

    /**
     * Base58 of the first (fee payer) signature, the transaction id.
     */
    public String signature() {
        if (signatures[0] == null) {
            throw new IllegalStateException("Transaction is not signed");
        }
        return Base58.encode(signatures[0]);
    }

    public byte[] message() {
        return message.clone();
    }

    public byte[] signatureOf(PublicKey signer) {
        int index = accountKeys.indexOf(signer);
        if (index < 0 || index >= requiredSignatures || signatures[index] == null) {
            return null;
        }
        return signatures[index].clone();
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public PublicKey getFeePayer() {
        return feePayer;
    }

    public List<PublicKey> getAccountKeys() {
        return accountKeys;
    }

    public int getRequiredSignatures() {
        return requiredSignatures;
    }

    static void writeShortVec(ByteArrayOutputStream out, int value) {
        int rem = value;
        while (true) {
            int b = rem & 0x7f;
            rem >>>= 7;
            if (rem == 0) {
                out.write(b);
                return;
            }
            out.write(b | 0x80);
        }
    }
}
