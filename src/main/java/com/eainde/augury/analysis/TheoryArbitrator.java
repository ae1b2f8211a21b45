package com.eainde.augury.analysis;

import com.eainde.augury.arbitration.ArbitrationOutcome;
import com.eainde.augury.arbitration.ArbitrationSystem;
import com.eainde.augury.conflict.Arbitrator;
import com.eainde.augury.conflict.ConflictRecord;
import com.eainde.augury.error.ArbitrationUnavailableException;
import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.QuestionCategory;
import com.eainde.augury.theory.TheoryRegistry;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.UserInput;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Arbitrator bound to one analysis pass: runs the next unused, eligible theory from the
 * category's priority list and lets {@link ArbitrationSystem} judge it against the pair.
 */
@Slf4j
public class TheoryArbitrator implements Arbitrator {

    private final ArbitrationSystem arbitrationSystem;
    private final TheoryRegistry registry;
    private final TheoryExecutor executor;
    private final QuestionCategory category;
    private final UserInput input;
    private final Set<String> used;

    public TheoryArbitrator(ArbitrationSystem arbitrationSystem, TheoryRegistry registry, TheoryExecutor executor,
                            QuestionCategory category, UserInput input, Set<String> used) {
        this.arbitrationSystem = arbitrationSystem;
        this.registry = registry;
        this.executor = executor;
        this.category = category;
        this.input = input;
        this.used = new HashSet<>(used);
    }

    @Override
    public ArbitrationOutcome arbitrate(ConflictRecord conflict, TheoryResult sideA, TheoryResult sideB) {
        if (!arbitrationSystem.shouldArbitrate(conflict)) {
            throw new ArbitrationUnavailableException(category.key(), "conflict is not severe: " + conflict.tier());
        }
        while (true) {
            Optional<String> candidate = arbitrationSystem.selectArbitrator(category, used,
                    name -> registry.find(name).map(d -> d.isEligible(input)).orElse(false));
            if (candidate.isEmpty()) {
                throw new ArbitrationUnavailableException(category.key(),
                        "no unused eligible arbitrator for " + conflict.theoryA() + " vs " + conflict.theoryB());
            }
            String name = candidate.get();
            used.add(name);
            try {
                TheoryResult result = executor.runOne(registry.descriptor(name), input);
                return arbitrationSystem.arbitrate(result, sideA, sideB);
            } catch (CalculationException e) {
                log.warn("Arbitrator {} failed, trying the next one: {}", name, e.getMessage());
            }
        }
    }
}
