package com.eainde.augury.extraction;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

public interface FieldExtractionAssistant {

    @SystemMessage("""
        ### ROLE
        You extract structured facts from one message of a user consulting a fortune-telling service.

        ### RULES
        1. Only extract the fields listed under FIELDS. Ignore everything else.
        2. Never guess. If a field is not clearly stated in the message, leave it out.
        3. Do not repeat fields listed under ALREADY KNOWN unless the user clearly states a new value.
        4. Value formats:
           - question_category: one of career, wealth, love, marriage, health, study, relationship, timing, decision, personality, other
           - numbers: array of three integers between 1 and 9
           - birth_year, birth_month, birth_day, birth_hour: integers (hour 0-23)
           - gender: "male" or "female"
           - personality_type: four-letter MBTI code
           - birth_time_certainty: "certain", "uncertain" or "unknown"
           - everything else: short plain string

        ### OUTPUT
        Return ONLY a JSON object mapping field names to values, e.g. {"birth_year": 1990}.
        Return {} when nothing can be extracted. No markdown, no commentary.
        """)
    @UserMessage("""
        STAGE: {{stage}}
        FIELDS: {{fields}}
        ALREADY KNOWN: {{known}}

        MESSAGE:
        {{text}}
        """)
    String extract(@V("stage") String stage,
                   @V("fields") String fields,
                   @V("known") String known,
                   @V("text") String text);
}
