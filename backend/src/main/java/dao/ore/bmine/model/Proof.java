package dao.ore.bmine.model;

/**
 * Per-identity on-chain proof state: current challenge hash and accumulated claimable rewards.
 */
public record Proof(PublicKey authority, long claimableRewards, byte[] hash) {}
