package com.eainde.augury.selection;

import com.eainde.augury.theory.TheoryDescriptor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Scoring breakdown of one theory for one selection.
 *
 * @param descriptor   the scored theory
 * @param fitness      combined score; 0 when the theory is ineligible
 * @param completeness information completeness of the input for this theory
 * @param affinity     cosine similarity between question category and theory
 * @param personality  personality acceptance score
 * @param eligible     whether all required fields are present and completeness reaches the minimum
 * @param potential    score the theory would reach with complete input, used to rank suggestions
 */
public record TheoryFitness(
        @JsonIgnore                   TheoryDescriptor descriptor,
        @JsonProperty("fitness")      double fitness,
        @JsonProperty("completeness") double completeness,
        @JsonProperty("affinity")     double affinity,
        @JsonProperty("personality")  double personality,
        @JsonProperty("eligible")     boolean eligible,
        @JsonProperty("potential")    double potential
) implements Serializable {

    @JsonProperty("theory")
    public String theoryName() {
        return descriptor.getName();
    }
}
