package com.eainde.augury.conversation;

/**
 * One field a stage asks for.
 *
 * @param field     field name
 * @param level     required or optional
 * @param skippable whether the user may declare it unknown
 * @param label     human-readable name for checklists
 * @param validator deterministic validator
 */
public record StageRequirement(String field, RequirementLevel level, boolean skippable, String label,
                               FieldValidator validator) {

    public static StageRequirement required(String field, String label, FieldValidator validator) {
        return new StageRequirement(field, RequirementLevel.REQUIRED, false, label, validator);
    }

    public static StageRequirement skippable(String field, String label, FieldValidator validator) {
        return new StageRequirement(field, RequirementLevel.REQUIRED, true, label, validator);
    }

    public static StageRequirement optional(String field, String label, FieldValidator validator) {
        return new StageRequirement(field, RequirementLevel.OPTIONAL, true, label, validator);
    }

    public boolean isRequired() {
        return level == RequirementLevel.REQUIRED;
    }
}
