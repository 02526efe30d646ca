package dao.ore.bmine.model;

/**
 * Bounded reward pool. {@code rewardsAvailable} in base units.
 */
public record Bus(int id, long rewardsAvailable) {}
