package com.eainde.augury.analysis;

import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.selection.SelectionResult;
import com.eainde.augury.theory.TheoryResult;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one completed analysis pass produced.
 *
 * @param selection  theories chosen and their fitness
 * @param results    results the resolver observed, in execution order
 * @param failures   theories dropped during the pass and why
 * @param resolution blended verdict
 */
public record AnalysisPass(
        SelectionResult selection,
        List<TheoryResult> results,
        Map<String, String> failures,
        ConflictResolution resolution
) implements Serializable {

    public AnalysisPass {
        results = List.copyOf(results);
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
