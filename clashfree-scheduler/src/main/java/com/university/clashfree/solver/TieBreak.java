package com.university.clashfree.solver;

/**
 * Seeded, order-independent tie-break keys: the same seed, variable and
 * candidate position always give the same key.
 */
public final class TieBreak {

    private TieBreak() {
    }

    public static long key(long seed, String variableId, int position) {
        long z = seed ^ (31L * variableId.hashCode() + position) * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
