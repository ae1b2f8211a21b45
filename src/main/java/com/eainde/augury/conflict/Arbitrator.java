package com.eainde.augury.conflict;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.eainde.augury.theory.TheoryResult;

/**
 * Settles a severe conflict by consulting a theory outside the current result set.
 */
@FunctionalInterface
public interface Arbitrator {

    /**
     * @param conflict the severe pair to settle
     * @param sideA    result of {@code conflict.theoryA()}
     * @param sideB    result of {@code conflict.theoryB()}
     * @throws com.eainde.augury.error.ArbitrationUnavailableException when no arbitrator can be run
     */
    ArbitrationOutcome arbitrate(ConflictRecord conflict, TheoryResult sideA, TheoryResult sideB);
}
