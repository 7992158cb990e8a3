package com.scout.executor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much a session may do without asking a human first.
 */
public enum ApprovalMode {

    /** Run every tool without asking ("yolo"). */
    BYPASS("bypassPermissions", "yolo"),
    /** Ask before sensitive tools ("careful"). */
    ASK("default", "careful"),
    /** Plan only, no side effects ("readonly"). */
    PLAN("plan", "readonly");

    private final String wireName;
    private final String label;

    ApprovalMode(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a wire name or a label; unknown or blank values yield null.
     */
    @JsonCreator
    public static ApprovalMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (ApprovalMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value) || mode.label.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        return null;
    }
}
