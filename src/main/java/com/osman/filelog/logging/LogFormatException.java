package com.osman.filelog.logging;

/**
 * Thrown when a message template cannot be interpolated with the supplied arguments.
 */
public final class LogFormatException extends IllegalArgumentException {
    private final String template;

    LogFormatException(String template, String reason, Throwable cause) {
        super("Cannot format log template \"" + template + "\": " + reason, cause);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
