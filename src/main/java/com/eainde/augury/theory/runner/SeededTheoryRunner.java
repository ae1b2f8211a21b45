package com.eainde.augury.theory.runner;

import com.eainde.augury.error.CalculationException;
import com.eainde.augury.theory.FieldNames;
import com.eainde.augury.theory.Judgment;
import com.eainde.augury.theory.TheoryDescriptor;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.theory.TheoryRunner;
import com.eainde.augury.theory.UserInput;
import com.eainde.augury.verification.RetrospectiveClaim;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Deterministic stand-in for theories that have no dedicated calculator bean.
 *
 * <p>Derives a stable verdict from the theory name and the values of the fields the theory
 * declares, so identical input always yields an identical result. Confidence grows with the
 * information completeness of the input.</p>
 */
public class SeededTheoryRunner implements TheoryRunner {

    private final String theoryName;

    public SeededTheoryRunner(String theoryName) {
        this.theoryName = theoryName;
    }

    @Override
    public String theoryName() {
        return theoryName;
    }

    @Override
    public TheoryResult run(TheoryDescriptor descriptor, UserInput input) {
        List<String> missing = descriptor.missingRequired(input);
        if (!missing.isEmpty()) {
            throw new CalculationException(theoryName, "missing required fields " + missing);
        }

        StringBuilder seedText = new StringBuilder(theoryName);
        for (String field : descriptor.getWeights().keySet()) {
            input.get(field).ifPresent(value -> seedText.append('|').append(field).append('=').append(value));
        }
        SplittableRandom random = new SplittableRandom(seedText.toString().hashCode());

        double level = RunnerSupport.round2(0.05 + 0.9 * random.nextDouble());
        double completeness = descriptor.completeness(input);
        double confidence = RunnerSupport.round2(0.5 + 0.3 * completeness);
        Judgment judgment = Judgment.fromLevel(level);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("estimator", "seeded");
        payload.put("completeness", RunnerSupport.round2(completeness));

        return new TheoryResult(theoryName, judgment, level, confidence, payload,
                descriptor.getDisplayName() + " reads the situation as " + judgment.label() + ".",
                claims(input, random));
    }

    private List<RetrospectiveClaim> claims(UserInput input, SplittableRandom random) {
        List<RetrospectiveClaim> claims = new ArrayList<>();
        input.getInt(FieldNames.BIRTH_YEAR).ifPresent(birthYear -> {
            int currentYear = RunnerSupport.inquiryTime(input).map(LocalDateTime::getYear)
                    .orElse(LocalDateTime.now().getYear());
            int turningPoint = Math.min(currentYear - 1, birthYear + 18 + random.nextInt(12));
            if (turningPoint > birthYear) {
                claims.add(RetrospectiveClaim.year(
                        "a significant turning point in " + turningPoint,
                        "In which year did your life take its most significant turn so far?",
                        turningPoint));
            }
        });
        boolean expectYes = random.nextBoolean();
        claims.add(RetrospectiveClaim.yesNo(
                expectYes ? "a change of direction in the past year" : "a steady past year without major changes",
                "Did you make a major change of direction in the past year?",
                expectYes));
        return claims;
    }
}
