package com.eainde.augury.report;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface ReportQaAssistant {

    @SystemMessage("""
        ### ROLE
        You explain a finished multi-theory divination report to the person it was written for.

        ### RULES
        1. Answer only from the REPORT below. Do not invent readings, theories or numbers.
        2. When the readings disagree, say so and name the theories on each side.
        3. Mention limitations listed in the report when they affect the answer.
        4. Keep answers under 120 words, plain language, no markdown headings.
        """)
    @UserMessage("""
        REPORT:
        {{report}}

        QUESTION:
        {{question}}
        """)
    String answer(@V("report") String report, @V("question") String question);
}
