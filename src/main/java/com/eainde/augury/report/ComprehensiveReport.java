package com.eainde.augury.report;

import com.eainde.augury.conflict.ConflictResolution;
import com.eainde.augury.selection.TheoryFitness;
import com.eainde.augury.theory.TheoryResult;
import com.eainde.augury.verification.ConfidenceAdjustment;
import com.eainde.augury.verification.VerificationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Read-only aggregate handed to presentation and export layers at the end of a session.
 *
 * @param reportId          unique id of this report
 * @param createdAt         assembly time
 * @param question          the user's question as first asked
 * @param category          question category key
 * @param selected          fitness of the theories that ran, in execution order
 * @param results           final results, confidences already adjusted by verification
 * @param initialResolution verdict before verification
 * @param finalResolution   verdict after verification
 * @param adjustments       confidence changes from verification, in application order
 * @param verification      questions asked and how the answers were classified
 * @param verdict           headline verdict, taken from the final resolution
 * @param skippedFields     fields the user declared unknown
 * @param limitations       caveats for reading the verdict
 */
public record ComprehensiveReport(
        @JsonProperty("report_id")          String reportId,
        @JsonProperty("created_at")         Instant createdAt,
        @JsonProperty("question")           String question,
        @JsonProperty("category")           String category,
        @JsonProperty("selected")           List<TheoryFitness> selected,
        @JsonProperty("results")            List<TheoryResult> results,
        @JsonProperty("initial_resolution") ConflictResolution initialResolution,
        @JsonProperty("final_resolution")   ConflictResolution finalResolution,
        @JsonProperty("adjustments")        List<ConfidenceAdjustment> adjustments,
        @JsonProperty("verification")       List<VerificationRecord> verification,
        @JsonProperty("verdict")            FinalVerdict verdict,
        @JsonProperty("skipped_fields")     List<String> skippedFields,
        @JsonProperty("limitations")        List<String> limitations
) implements Serializable {

    public ComprehensiveReport {
        selected = List.copyOf(selected);
        results = List.copyOf(results);
        adjustments = List.copyOf(adjustments);
        verification = List.copyOf(verification);
        skippedFields = List.copyOf(skippedFields);
        limitations = List.copyOf(limitations);
    }
}
