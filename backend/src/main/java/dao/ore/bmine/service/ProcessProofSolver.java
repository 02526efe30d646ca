package dao.ore.bmine.service;

import dao.ore.bmine.model.SolveRequest;
import dao.ore.bmine.model.SolveResult;
import dao.ore.bmine.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Spawns an external nonce worker per call and talks to it over stdin/stdout.
 * <p>
 * Input: 1 byte thread count, 32 bytes difficulty, then 32-byte challenge + 32-byte identity per request.
 * Output: 32-byte hash + 8-byte little-endian nonce per request, in request order.
 */
@Slf4j
public class ProcessProofSolver implements ProofSolver {

    static final int HASH_LENGTH = 32;
    static final int RECORD_LENGTH = HASH_LENGTH + Long.BYTES;

    private final String workerPath;

    public ProcessProofSolver(String workerPath) {
        this.workerPath = workerPath;
    }

    @Override
    public List<SolveResult> solve(int threads, byte[] difficulty, List<SolveRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        byte[] input = encodeInput(threads, difficulty, requests);
        Process process;
        try {
            process = new ProcessBuilder(workerPath)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new SolverException("failed to start nonce worker " + workerPath, e);
        }

        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(input);
            }
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = stdout.readAllBytes();
            }
            int exit = process.waitFor();
            if (exit != 0) {
                log.warn("nonce worker exited with code {}", exit);
            }
            return decodeOutput(output, requests.size());
        } catch (IOException e) {
            throw new SolverException("nonce worker I/O failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SolverException("interrupted while waiting for nonce worker", e);
        } finally {
            process.destroy();
        }
    }

    static byte[] encodeInput(int threads, byte[] difficulty, List<SolveRequest> requests) {
        if (difficulty.length != HASH_LENGTH) {
            throw new IllegalArgumentException("difficulty must be 32 bytes");
        }
        int threadByte = Math.max(1, Math.min(255, threads <= 0 ? Runtime.getRuntime().availableProcessors() : threads));
        ByteArrayOutputStream out = new ByteArrayOutputStream(1 + HASH_LENGTH + requests.size() * 64);
        out.write(threadByte);
        out.writeBytes(difficulty);
        for (SolveRequest request : requests) {
            out.writeBytes(request.challenge());
            out.writeBytes(request.identity().toBytes());
        }
        return out.toByteArray();
    }

    static List<SolveResult> decodeOutput(byte[] output, int expected) {
        if (output.length < expected * RECORD_LENGTH) {
            throw new SolverException("nonce worker returned " + output.length / RECORD_LENGTH
                    + " results, expected " + expected);
        }
        List<SolveResult> results = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            int offset = i * RECORD_LENGTH;
            byte[] hash = Arrays.copyOfRange(output, offset, offset + HASH_LENGTH);
            long nonce = CryptoUtil.readLongLE(output, offset + HASH_LENGTH);
            results.add(new SolveResult(hash, nonce));
        }
        return results;
    }
}
