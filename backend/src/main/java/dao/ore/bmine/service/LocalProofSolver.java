package dao.ore.bmine.service;

import dao.ore.bmine.model.SolveRequest;
import dao.ore.bmine.model.SolveResult;
import dao.ore.bmine.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process keccak nonce search: {@code keccak(challenge || identity || nonce_le) <= difficulty}.
 * Thread {@code i} of {@code n} starts at {@code u64::MAX / n * i}.
 */
@Slf4j
public class LocalProofSolver implements ProofSolver {

    @Override
    public List<SolveResult> solve(int threads, byte[] difficulty, List<SolveRequest> requests) {
        int n = threads <= 0 ? Runtime.getRuntime().availableProcessors() : threads;
        ExecutorService executor = Executors.newFixedThreadPool(n);
        try {
            List<SolveResult> results = new ArrayList<>(requests.size());
            for (SolveRequest request : requests) {
                results.add(solveOne(executor, n, difficulty, request));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private SolveResult solveOne(ExecutorService executor, int threads, byte[] difficulty, SolveRequest request) {
        AtomicReference<SolveResult> found = new AtomicReference<>();
        long stride = Long.divideUnsigned(-1L, threads);
        List<Future<?>> futures = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++) {
            long start = stride * i;
            futures.add(executor.submit(() -> search(start, difficulty, request, found)));
        }
        try {
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("interrupted during nonce search", e);
        } catch (ExecutionException e) {
            throw new SolverException("nonce search failed: " + e.getCause().getMessage(), e.getCause());
        }
        SolveResult result = found.get();
        if (result == null) {
            throw new SolverException("no nonce found for " + request.identity());
        }
        return result;
    }

    private static void search(long start, byte[] difficulty, SolveRequest request, AtomicReference<SolveResult> found) {
        byte[] identity = request.identity().toBytes();
        byte[] nonceBytes = new byte[Long.BYTES];
        long nonce = start;
        while (found.get() == null && !Thread.currentThread().isInterrupted()) {
            CryptoUtil.putLongLE(nonceBytes, 0, nonce);
            byte[] hash = CryptoUtil.keccak256(request.challenge(), identity, nonceBytes);
            if (meetsDifficulty(hash, difficulty)) {
                found.compareAndSet(null, new SolveResult(hash, nonce));
                return;
            }
            nonce++;
        }
    }

    static boolean meetsDifficulty(byte[] hash, byte[] difficulty) {
        return Arrays.compareUnsigned(hash, difficulty) <= 0;
    }
}
