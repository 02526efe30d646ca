package dao.ore.bmine.model;

public record SolveRequest(byte[] challenge, PublicKey identity) {}
