package com.eainde.augury.analysis;

import com.eainde.augury.theory.TheoryResult;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joined outcome of one batch of theory runs.
 *
 * @param results  successful results, in the order the theories were submitted
 * @param failures dropped theories and the reason each was dropped
 */
public record TheoryExecution(List<TheoryResult> results, Map<String, String> failures) implements Serializable {

    public TheoryExecution {
        results = List.copyOf(results);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }
}
