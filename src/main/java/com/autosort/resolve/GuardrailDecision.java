package com.autosort.resolve;

/**
 * Guarded path plus the pin rule that produced it, if any. Pinned paths skip snapping.
 */
public final class GuardrailDecision {

    private final String path;
    private final String pinRule;

    private GuardrailDecision(String path, String pinRule) {
        this.path = path;
        this.pinRule = pinRule;
    }

    static GuardrailDecision pinned(String path, String pinRule) {
        return new GuardrailDecision(path, pinRule);
    }

    static GuardrailDecision guarded(String path) {
        return new GuardrailDecision(path, null);
    }

    public String getPath() {
        return path;
    }

    public boolean isPinned() {
        return pinRule != null;
    }

    public String getPinRule() {
        return pinRule;
    }
}
