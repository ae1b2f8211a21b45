package com.eainde.augury.session;

import com.eainde.augury.conversation.TurnReply;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SessionStarted(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("reply")      TurnReply reply
) {
}
