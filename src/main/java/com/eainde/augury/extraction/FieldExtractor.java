package com.eainde.augury.extraction;

import com.eainde.augury.conversation.ConversationStage;
import com.eainde.augury.theory.UserInput;

import java.util.Map;

/**
 * Natural-language extraction boundary: recovers candidate field values from free text.
 * Implementations are side-effect free; repeated calls with the same arguments are equivalent.
 */
public interface FieldExtractor {

    /**
     * @param stage  stage whose fields are wanted
     * @param text   raw user turn
     * @param known  fields collected so far
     * @return candidate values by field name; possibly empty, never null
     * @throws com.eainde.augury.error.ExtractionException on timeout, provider failure or unparseable output
     */
    Map<String, Object> extract(ConversationStage stage, String text, UserInput known);
}
