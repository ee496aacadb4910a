package com.osman.filelog.logging;

/**
 * Importance tag attached to every log entry, ordered from lowest to highest.
 */
public enum Severity {
    VERBOSE("Verbose"),
    DEBUG("Debug"),
    INFO("Info"),
    WARN("Warn"),
    ERROR("Error");

    private final String displayName;

    Severity(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Verbose is part of the vocabulary but is never written to the log file.
     */
    public boolean isPersisted() {
        return this != VERBOSE;
    }
}
