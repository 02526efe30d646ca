package dao.ore.bmine.model;

public record ChainClock(long slot, long unixTimestamp) {}
