package dao.ore.bmine.service;

import dao.ore.bmine.TestFixtures;
import dao.ore.bmine.chain.ChainRpcClient;
import dao.ore.bmine.chain.ChainRpcException;
import dao.ore.bmine.model.SignatureStatus;
import dao.ore.bmine.model.SignatureStatuses;
import dao.ore.bmine.model.SubmissionOutcome;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.model.WatchResult;
import dao.ore.bmine.tips.TipFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class SubmissionWatcherTest {

    private static final long SENT_AT_SLOT = 1000;

    private ChainRpcClient rpc;
    private MinerStats stats;
    private SubmissionWatcher watcher;

    @BeforeEach
    void setUp() {
        rpc = mock(ChainRpcClient.class);
        TipFeed tipFeed = mock(TipFeed.class);
        when(tipFeed.current()).thenReturn(TipSnapshot.EMPTY);
        stats = new MinerStats();
        watcher = new SubmissionWatcher(rpc, tipFeed, stats, TestFixtures.instantPolling());
    }

    private static SubmissionRecord record(String... signatures) {
        return new SubmissionRecord("test", List.of(signatures), SENT_AT_SLOT, 500, 1000, System.nanoTime());
    }

    private static Optional<SignatureStatus> confirmed() {
        return Optional.of(new SignatureStatus("confirmed", 1L, false));
    }

    @Test
    void watch_landsImmediately() {
        when(rpc.fetchSignatureStatuses(anyList()))
                .thenReturn(new SignatureStatuses(List.of(Optional.empty(), confirmed()), SENT_AT_SLOT + 2));

        WatchResult result = watcher.watch(record("sigA", "sigB"));

        assertEquals(SubmissionOutcome.LANDED, result.outcome());
        assertEquals(List.of("sigB"), result.landedSignatures());
        verify(rpc, times(1)).fetchSignatureStatuses(anyList());
        assertEquals(1, stats.getLanded());
        assertEquals(500, stats.getTotalRewards());
        assertEquals(500, stats.takePendingRewards());
        assertEquals(0, stats.takePendingRewards());
    }

    @Test
    void watch_neverLandsTerminatesAtSlotExpiration() {
        AtomicLong slot = new AtomicLong(SENT_AT_SLOT);
        when(rpc.fetchSignatureStatuses(anyList()))
                .thenAnswer(inv -> new SignatureStatuses(List.of(Optional.empty()), slot.addAndGet(5)));

        WatchResult result = watcher.watch(record("sigA"));

        assertEquals(SubmissionOutcome.DROPPED, result.outcome());
        assertTrue(result.lastSlot() >= SENT_AT_SLOT + 156);
        // 156 slots at 5 slots per poll
        verify(rpc, times(32)).fetchSignatureStatuses(anyList());
        assertEquals(1, stats.getDropped());
        assertEquals(0, stats.getTotalRewards());
    }

    @Test
    void watch_failedTransactionDoesNotLand() {
        AtomicLong slot = new AtomicLong(SENT_AT_SLOT);
        when(rpc.fetchSignatureStatuses(anyList())).thenAnswer(inv -> new SignatureStatuses(
                List.of(Optional.of(new SignatureStatus("finalized", null, true))), slot.addAndGet(50)));

        assertFalse(watcher.watch(record("sigA")).landed());
    }

    @Test
    void watch_transientFailureIsRetried() {
        when(rpc.fetchSignatureStatuses(anyList()))
                .thenThrow(new ChainRpcException("timeout"))
                .thenThrow(new ChainRpcException("timeout"))
                .thenReturn(new SignatureStatuses(List.of(confirmed()), SENT_AT_SLOT + 10));

        WatchResult result = watcher.watch(record("sigA"));

        assertTrue(result.landed());
        verify(rpc, times(3)).fetchSignatureStatuses(anyList());
    }

    @Test
    void awaitOutcome_leavesCountersUntouched() {
        when(rpc.fetchSignatureStatuses(anyList()))
                .thenReturn(new SignatureStatuses(List.of(confirmed()), SENT_AT_SLOT + 1));

        assertTrue(watcher.awaitOutcome(record("sigA")).landed());
        assertEquals(0, stats.getLanded());
    }

    @Test
    void signatureStatus_rootedWithoutConfirmationStatusCountsAsLanded() {
        assertTrue(new SignatureStatus(null, null, false).isLanded());
        assertFalse(new SignatureStatus(null, 3L, false).isLanded());
        assertFalse(new SignatureStatus("processed", 0L, false).isLanded());
    }
}
