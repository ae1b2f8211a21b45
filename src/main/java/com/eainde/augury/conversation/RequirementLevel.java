package com.eainde.augury.conversation;

public enum RequirementLevel {
    /** Blocks advancement until found or skipped. */
    REQUIRED,
    /** Collected when offered; never blocks. */
    OPTIONAL
}
