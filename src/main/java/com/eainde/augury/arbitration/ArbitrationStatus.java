package com.eainde.augury.arbitration;

public enum ArbitrationStatus {
    NOT_NEEDED,
    COMPLETED,
    INCONCLUSIVE,
    /** A severe conflict existed but no arbitrator could be run. */
    UNAVAILABLE
}
