package com.eainde.augury.arbitration;

/**
 * Which side of a severe conflict the arbitrator agreed with.
 */
public enum ArbitrationVerdict {
    SIDE_A,
    SIDE_B,
    /** Both sides match: majority consensus. */
    BOTH,
    /** Neither side matches: inconclusive. */
    NEITHER
}
