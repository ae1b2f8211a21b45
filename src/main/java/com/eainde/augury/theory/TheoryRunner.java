package com.eainde.augury.theory;

/**
 * Boundary to one theory's calculation. Implementations must be side-effect free on shared state,
 * since runs within one analysis pass execute concurrently.
 *
 * <p>Any Spring bean implementing this interface is registered under {@link #theoryName()} and
 * replaces the default estimator for that theory.</p>
 */
public interface TheoryRunner {

    String theoryName();

    /**
     * @throws com.eainde.augury.error.CalculationException when the calculation cannot be completed
     */
    TheoryResult run(TheoryDescriptor descriptor, UserInput input);
}
