package com.eainde.augury.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Completion of the current stage's fields.
 *
 * @param stage          stage measured
 * @param requiredTotal  number of required fields
 * @param requiredDone   required fields found or skipped
 * @param optionalTotal  number of optional fields
 * @param optionalDone   optional fields found
 * @param missing        required fields still open
 * @param skipped        fields recorded as unknown
 * @param items          per-field state in stage order
 * @param canProceed     all required fields settled
 */
public record StageProgress(
        @JsonProperty("stage")          ConversationStage stage,
        @JsonProperty("required_total") int requiredTotal,
        @JsonProperty("required_done")  int requiredDone,
        @JsonProperty("optional_total") int optionalTotal,
        @JsonProperty("optional_done")  int optionalDone,
        @JsonProperty("missing")        List<String> missing,
        @JsonProperty("skipped")        List<String> skipped,
        @JsonProperty("items")          List<Item> items,
        @JsonProperty("can_proceed")    boolean canProceed
) implements Serializable {

    public enum ItemState { DONE, OPEN, SKIPPED }

    public record Item(String field, String label, boolean required, ItemState state) implements Serializable {
    }

    public StageProgress {
        missing = List.copyOf(missing);
        skipped = List.copyOf(skipped);
        items = List.copyOf(items);
    }

    @JsonProperty("percent")
    public int percent() {
        return requiredTotal == 0 ? 100 : (int) Math.round(100.0 * requiredDone / requiredTotal);
    }

    /** Checklist shown in follow-up messages. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Progress: ").append(requiredDone).append('/').append(requiredTotal)
                .append(" required (").append(percent()).append("%)");
        if (optionalTotal > 0) {
            sb.append(", ").append(optionalDone).append('/').append(optionalTotal).append(" optional");
        }
        for (Item item : items) {
            sb.append('\n');
            switch (item.state()) {
                case DONE -> sb.append("[x] ");
                case SKIPPED -> sb.append("[-] ");
                default -> sb.append("[ ] ");
            }
            sb.append(item.label());
            if (!item.required()) {
                sb.append(" (optional)");
            }
            if (item.state() == ItemState.SKIPPED) {
                sb.append(" (skipped)");
            }
        }
        return sb.toString();
    }
}
