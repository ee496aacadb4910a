package com.osman.filelog.logging;

/**
 * Secondary, best-effort destination for rendered lines. Implementations must not
 * block the caller and must never throw; {@link LogWriter} ignores anything they do.
 */
@FunctionalInterface
public interface DiagnosticEcho {

    void echo(String renderedLine);

    static DiagnosticEcho none() {
        return line -> {
        };
    }

    /**
     * Echo that republishes each line on {@link AppLogger} at {@code FINE} from a daemon thread.
     */
    static DiagnosticEcho appLogger() {
        return AppLoggerEcho.INSTANCE;
    }
}
