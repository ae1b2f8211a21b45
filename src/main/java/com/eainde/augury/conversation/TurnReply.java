package com.eainde.augury.conversation;

import com.eainde.augury.report.ComprehensiveReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * What the engine says back after one user turn.
 *
 * @param type          kind of reply
 * @param stage         stage after the turn
 * @param message       text shown to the user
 * @param progress      stage progress, for follow-ups in collecting stages
 * @param missingFields required fields still open, for {@link ReplyType#MISSING_FIELDS}
 * @param report        the report, for {@link ReplyType#FINAL_REPORT}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnReply(
        @JsonProperty("type")           ReplyType type,
        @JsonProperty("stage")          ConversationStage stage,
        @JsonProperty("message")        String message,
        @JsonProperty("progress")       StageProgress progress,
        @JsonProperty("missing_fields") List<String> missingFields,
        @JsonProperty("report")         ComprehensiveReport report
) {

    public enum ReplyType {
        /** Next question or an answer; the conversation goes on. */
        PROMPT,
        /** The stage needs more input before it can be left. */
        MISSING_FIELDS,
        FINAL_REPORT,
        /** The session has ended. */
        CLOSED
    }

    public TurnReply {
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
    }

    public static TurnReply prompt(ConversationStage stage, String message) {
        return new TurnReply(ReplyType.PROMPT, stage, message, null, List.of(), null);
    }

    public static TurnReply missing(ConversationStage stage, String message, StageProgress progress,
                                    List<String> missingFields) {
        return new TurnReply(ReplyType.MISSING_FIELDS, stage, message, progress, missingFields, null);
    }

    public static TurnReply finalReport(ConversationStage stage, String message, ComprehensiveReport report) {
        return new TurnReply(ReplyType.FINAL_REPORT, stage, message, null, List.of(), report);
    }

    public static TurnReply closed(String message) {
        return new TurnReply(ReplyType.CLOSED, ConversationStage.COMPLETED, message, null, List.of(), null);
    }
}
