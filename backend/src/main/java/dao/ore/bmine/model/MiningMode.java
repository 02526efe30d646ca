package dao.ore.bmine.model;

public enum MiningMode {
    /** Persistent workers, each owning a static identity batch. */
    FIXED,
    /** Recyclable batches drained from a bounded queue, confirmations watched asynchronously. */
    POOLED
}
