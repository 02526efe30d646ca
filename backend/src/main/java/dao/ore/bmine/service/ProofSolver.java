package dao.ore.bmine.service;

import dao.ore.bmine.model.SolveRequest;
import dao.ore.bmine.model.SolveResult;

import java.util.List;

/**
 * Hash search for a set of (challenge, identity) pairs.
 * <p>
 * Results come back in request order; a qualifying hash is one that, read as an unsigned big-endian number,
 * is less than or equal to {@code difficulty}.
 */
public interface ProofSolver {

    /**
     * @param threads    thread budget; {@code <= 0} lets the implementation decide
     * @param difficulty 32-byte target
     * @throws SolverException when the search cannot produce one result per request
     */
    List<SolveResult> solve(int threads, byte[] difficulty, List<SolveRequest> requests);
}
