package dao.ore.bmine.chain;

import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.ChainClock;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.Treasury;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static dao.ore.bmine.util.CryptoUtil.putLongLE;
import static org.junit.jupiter.api.Assertions.*;

class AccountDecoderTest {

    @Test
    void decodeTreasury() {
        byte[] data = new byte[8 + 8 + 32 + 32 + 8 + 8 + 8];
        Arrays.fill(data, 48, 80, (byte) 0x3c);
        putLongLE(data, 80, 1_700_000_000L);
        putLongLE(data, 88, 12_345L);

        Treasury treasury = AccountDecoder.decodeTreasury(data);

        assertArrayEquals(Arrays.copyOfRange(data, 48, 80), treasury.difficulty());
        assertEquals(1_700_000_000L, treasury.lastResetAt());
        assertEquals(12_345L, treasury.rewardRate());
    }

    @Test
    void decodeBus() {
        byte[] data = new byte[24];
        putLongLE(data, 8, 5);
        putLongLE(data, 16, 987_654_321L);

        assertEquals(new Bus(5, 987_654_321L), AccountDecoder.decodeBus(data));
    }

    @Test
    void decodeProof() {
        byte[] data = new byte[8 + 32 + 8 + 32 + 16];
        data[8] = 1;
        putLongLE(data, 40, 777L);
        data[48] = (byte) 0xaa;

        Proof proof = AccountDecoder.decodeProof(data);

        assertEquals(1, proof.authority().toBytes()[0]);
        assertEquals(777L, proof.claimableRewards());
        assertEquals((byte) 0xaa, proof.hash()[0]);
        assertEquals(32, proof.hash().length);
    }

    @Test
    void decodeClock() {
        byte[] data = new byte[40];
        putLongLE(data, 0, 250_000_000L);
        putLongLE(data, 32, 1_700_000_123L);

        assertEquals(new ChainClock(250_000_000L, 1_700_000_123L), AccountDecoder.decodeClock(data));
    }

    @Test
    void shortDataFails() {
        assertThrows(IllegalArgumentException.class, () -> AccountDecoder.decodeBus(new byte[10]));
        assertThrows(IllegalArgumentException.class, () -> AccountDecoder.decodeProof(null));
    }
}
