package com.tradegate.engine.model;

/**
 * Permission verdict ordered from most to least permissive.
 */
public enum Permission {
    ALLOW(3, 70),
    ALLOW_REDUCED(2, 62),
    ALLOW_TIGHTENED(1, 65),
    BLOCK(0, 100);

    private final int rank;
    private final int confidenceFloor;

    Permission(int rank, int confidenceFloor) {
        this.rank = rank;
        this.confidenceFloor = confidenceFloor;
    }

    public int rank() {
        return rank;
    }

    /** Minimum setup confidence (0-100) required to keep this verdict. */
    public int confidenceFloor() {
        return confidenceFloor;
    }

    public boolean permitsEntry() {
        return this != BLOCK;
    }

    public static Permission mostRestrictive(Permission a, Permission b) {
        return a.rank <= b.rank ? a : b;
    }
}
