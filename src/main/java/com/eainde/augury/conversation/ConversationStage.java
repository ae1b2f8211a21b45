package com.eainde.augury.conversation;

/**
 * Stages of a session, strictly ordered. A session only moves forward, one stage at a time.
 */
public enum ConversationStage {

    INIT,
    ICEBREAK,
    DEEPEN,
    COLLECT,
    VERIFY,
    REPORT,
    QA,
    COMPLETED;

    /**
     * @throws IllegalStateException when called on {@link #COMPLETED}
     */
    public ConversationStage next() {
        if (this == COMPLETED) {
            throw new IllegalStateException("COMPLETED is terminal");
        }
        return values()[ordinal() + 1];
    }

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /** Stages whose fields are collected through {@link FlowGuard#evaluateTurn}. */
    public boolean collectsFields() {
        return this == ICEBREAK || this == DEEPEN || this == COLLECT;
    }
}
