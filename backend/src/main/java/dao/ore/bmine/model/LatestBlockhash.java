package dao.ore.bmine.model;

public record LatestBlockhash(byte[] blockhash, long slot) {}
