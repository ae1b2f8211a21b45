package com.eainde.augury.selection;

import com.eainde.augury.theory.TheoryDescriptor;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one selection.
 *
 * @param selected      chosen theories in execution order
 * @param ranking       every registered theory, best fitness first
 * @param missingFields fields that would make more theories eligible; empty when {@code minTheories} was reached
 * @param reasons       one human-readable line per chosen theory
 */
public record SelectionResult(
        List<TheoryDescriptor> selected,
        List<TheoryFitness> ranking,
        List<String> missingFields,
        List<String> reasons
) implements Serializable {

    public SelectionResult {
        selected = List.copyOf(selected);
        ranking = List.copyOf(ranking);
        missingFields = List.copyOf(missingFields);
        reasons = List.copyOf(reasons);
    }

    public boolean isEmpty() {
        return selected.isEmpty();
    }

    public List<String> names() {
        return selected.stream().map(TheoryDescriptor::getName).toList();
    }
}
