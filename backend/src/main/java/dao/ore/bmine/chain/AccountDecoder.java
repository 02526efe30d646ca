package dao.ore.bmine.chain;

import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.ChainClock;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.Treasury;

import java.util.Arrays;

import static dao.ore.bmine.util.CryptoUtil.readLongLE;

/**
 * Fixed little-endian layouts of the program accounts. Program accounts start with an 8-byte discriminator.
 */
public final class AccountDecoder {
    private AccountDecoder() {}

    private static final int DISCRIMINATOR = 8;

    /**
     * bump u64, admin [32], difficulty [32], last_reset_at i64, reward_rate u64, total_claimed_rewards u64
     */
    public static Treasury decodeTreasury(byte[] data) {
        requireLength("treasury", data, DISCRIMINATOR + 8 + 32 + 32 + 8 + 8);
        int o = DISCRIMINATOR + 8 + 32;
        byte[] difficulty = Arrays.copyOfRange(data, o, o + 32);
        long lastResetAt = readLongLE(data, o + 32);
        long rewardRate = readLongLE(data, o + 40);
        return new Treasury(difficulty, lastResetAt, rewardRate);
    }

    /**
     * id u64, rewards u64
     */
    public static Bus decodeBus(byte[] data) {
        requireLength("bus", data, DISCRIMINATOR + 16);
        return new Bus((int) readLongLE(data, DISCRIMINATOR), readLongLE(data, DISCRIMINATOR + 8));
    }

    /**
     * authority [32], claimable_rewards u64, hash [32], total_hashes u64, total_rewards u64
     */
    public static Proof decodeProof(byte[] data) {
        requireLength("proof", data, DISCRIMINATOR + 32 + 8 + 32);
        int o = DISCRIMINATOR;
        PublicKey authority = new PublicKey(Arrays.copyOfRange(data, o, o + 32));
        long claimable = readLongLE(data, o + 32);
        byte[] hash = Arrays.copyOfRange(data, o + 40, o + 72);
        return new Proof(authority, claimable, hash);
    }

    /**
     * Clock sysvar (no discriminator): slot u64, epoch_start_timestamp i64, epoch u64, leader_schedule_epoch u64,
     * unix_timestamp i64
     */
    public static ChainClock decodeClock(byte[] data) {
        requireLength("clock", data, 40);
        return new ChainClock(readLongLE(data, 0), readLongLE(data, 32));
    }

    private static void requireLength(String name, byte[] data, int min) {
        if (data == null || data.length < min) {
            throw new IllegalArgumentException(name + " account data too short: "
                    + (data == null ? 0 : data.length) + " < " + min);
        }
    }
}
