package dao.ore.bmine.model;

/**
 * Solver output for one (challenge, identity) pair, matched back to its identity by position.
 */
public record SolveResult(byte[] hash, long nonce) {}
