package dao.ore.bmine.model;

public record Treasury(byte[] difficulty, long lastResetAt, long rewardRate) {}
