package dao.ore.bmine.chain;

import dao.ore.bmine.config.OreProperties;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.util.CryptoUtil;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Addresses and instruction builders of the mining program, plus the system transfer used for bribes.
 */
@Component
public class OreProgram {

    public static final PublicKey SYSTEM_PROGRAM = new PublicKey(new byte[32]);
    public static final PublicKey TOKEN_PROGRAM = PublicKey.fromBase58("TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA");
    public static final PublicKey ASSOCIATED_TOKEN_PROGRAM = PublicKey.fromBase58("ATokenGPvbdGVxr1b2hvZbsiqW5xWH25efTNsLJA8knL");
    public static final PublicKey SLOT_HASHES_SYSVAR = PublicKey.fromBase58("SysvarS1otHashes111111111111111111111111111");
    public static final PublicKey CLOCK_SYSVAR = PublicKey.fromBase58("SysvarC1ock11111111111111111111111111111111");

    private static final byte[] PROOF_SEED = "proof".getBytes(StandardCharsets.UTF_8);
    private static final byte[] BUS_SEED = "bus".getBytes(StandardCharsets.UTF_8);

    private static final byte IX_MINE = 2;
    private static final byte IX_CLAIM = 3;
    private static final int SYSTEM_IX_TRANSFER = 2;

    private final PublicKey programId;
    private final PublicKey treasury;
    private final PublicKey mint;
    private final List<PublicKey> buses;
    private final ConcurrentMap<PublicKey, PublicKey> proofCache = new ConcurrentHashMap<>();

    public OreProgram(OreProperties props) {
        this.programId = PublicKey.fromBase58(props.getProgramId());
        this.treasury = PublicKey.fromBase58(props.getTreasuryAddress());
        this.mint = PublicKey.fromBase58(props.getMintAddress());
        this.buses = props.getBusAddresses().isEmpty()
                ? deriveBuses(props.getBusCount(), programId)
                : props.getBusAddresses().stream().map(PublicKey::fromBase58).toList();
        if (buses.isEmpty()) {
            throw new IllegalStateException("ore.bus-count must be greater than 0");
        }
    }

    static List<PublicKey> deriveBuses(int count, PublicKey programId) {
        List<PublicKey> buses = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            buses.add(CryptoUtil.findProgramAddress(List.of(BUS_SEED, new byte[]{(byte) i}), programId).address());
        }
        return buses;
    }

    public PublicKey programId() {
        return programId;
    }

    public PublicKey treasury() {
        return treasury;
    }

    public List<PublicKey> busAddresses() {
        return buses;
    }

    public PublicKey busAddress(int busId) {
        if (busId < 0 || busId >= buses.size()) {
            throw new IllegalArgumentException("Unknown bus id: " + busId);
        }
        return buses.get(busId);
    }

    public PublicKey proofAddress(PublicKey authority) {
        return proofCache.computeIfAbsent(authority,
                a -> CryptoUtil.findProgramAddress(List.of(PROOF_SEED, a.toBytes()), programId).address());
    }

    public PublicKey associatedTokenAddress(PublicKey owner) {
        return CryptoUtil.findProgramAddress(
                List.of(owner.toBytes(), TOKEN_PROGRAM.toBytes(), mint.toBytes()),
                ASSOCIATED_TOKEN_PROGRAM).address();
    }

    public PublicKey treasuryTokens() {
        return associatedTokenAddress(treasury);
    }

    public Instruction mine(PublicKey signer, PublicKey bus, byte[] hash, long nonce) {
        byte[] data = new byte[1 + 32 + 8];
        data[0] = IX_MINE;
        System.arraycopy(hash, 0, data, 1, 32);
        CryptoUtil.putLongLE(data, 33, nonce);
        return new Instruction(programId, List.of(
                AccountMeta.writable(signer, true),
                AccountMeta.writable(bus, false),
                AccountMeta.writable(proofAddress(signer), false),
                AccountMeta.readonly(treasury, false),
                AccountMeta.readonly(SLOT_HASHES_SYSVAR, false)
        ), data);
    }

    public Instruction claim(PublicKey signer, PublicKey beneficiaryTokens, long amount) {
        byte[] data = new byte[1 + 8];
        data[0] = IX_CLAIM;
        CryptoUtil.putLongLE(data, 1, amount);
        return new Instruction(programId, List.of(
                AccountMeta.writable(signer, true),
                AccountMeta.writable(beneficiaryTokens, false),
                AccountMeta.writable(proofAddress(signer), false),
                AccountMeta.writable(treasury, false),
                AccountMeta.writable(treasuryTokens(), false),
                AccountMeta.readonly(TOKEN_PROGRAM, false)
        ), data);
    }

    public static Instruction transfer(PublicKey from, PublicKey to, long lamports) {
        byte[] data = new byte[4 + 8];
        data[0] = SYSTEM_IX_TRANSFER;
        CryptoUtil.putLongLE(data, 4, lamports);
        return new Instruction(SYSTEM_PROGRAM, List.of(
                AccountMeta.writable(from, true),
                AccountMeta.writable(to, false)
        ), data);
    }
}
