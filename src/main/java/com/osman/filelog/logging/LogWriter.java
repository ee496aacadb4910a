package com.osman.filelog.logging;

import com.osman.filelog.config.ConfigService;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Buffers rendered log lines in memory and appends them to a single UTF-8 log file.
 * <p>
 * Lines are queued under a lock and written in batches once {@value #FLUSH_THRESHOLD}
 * are pending, or when the writer is closed. Verbose entries are accepted and discarded.
 * <p>
 * The application either owns an instance created with {@link #open(Path)} and closes it,
 * or shares the process-wide one from {@link #getInstance()} and releases it with
 * {@link #shutdown()}.
 */
public final class LogWriter implements AutoCloseable {

    static final int FLUSH_THRESHOLD = 100;

    private static final Logger LOGGER = AppLogger.get();
    private static final ReentrantLock INSTANCE_LOCK = new ReentrantLock();

    private static volatile LogWriter instance;

    private final ReentrantLock lock = new ReentrantLock();
    private final Queue<String> pending = new ArrayDeque<>();
    private final Path logFile;
    private final Writer out;
    private final LogEntryFormatter formatter;
    private final DiagnosticEcho echo;

    private boolean closed;

    LogWriter(Path logFile, Clock clock, DiagnosticEcho echo) {
        this(logFile, openAppend(Objects.requireNonNull(logFile, "logFile")), clock, echo);
        LOGGER.log(Level.CONFIG, "Opened log file {0}", logFile);
    }

    LogWriter(Path logFile, Writer out, Clock clock, DiagnosticEcho echo) {
        this.logFile = Objects.requireNonNull(logFile, "logFile");
        this.out = Objects.requireNonNull(out, "out");
        this.formatter = new LogEntryFormatter(clock);
        this.echo = echo == null ? DiagnosticEcho.none() : echo;
    }

    /**
     * Opens a writer owned by the caller. It is not registered as the process-wide instance.
     *
     * @throws UncheckedIOException if the file cannot be created or opened for appending
     */
    public static LogWriter open(Path logFile) {
        return new LogWriter(logFile, Clock.systemDefaultZone(), DiagnosticEcho.appLogger());
    }

    /**
     * Returns the process-wide writer, opening it on first use at the configured path.
     *
     * @throws UncheckedIOException if the log file cannot be opened
     */
    public static LogWriter getInstance() {
        LogWriter current = instance;
        if (current != null && current.isOpen()) {
            return current;
        }
        INSTANCE_LOCK.lock();
        try {
            if (instance == null || !instance.isOpen()) {
                instance = open(ConfigService.getInstance().getLogFile());
            }
            return instance;
        } finally {
            INSTANCE_LOCK.unlock();
        }
    }

    /**
     * Flushes and closes the process-wide writer. The next {@link #getInstance()} reopens the file.
     *
     * @throws IllegalStateException if there is no live process-wide writer
     */
    public static void shutdown() {
        INSTANCE_LOCK.lock();
        try {
            LogWriter current = instance;
            if (current == null || !current.isOpen()) {
                instance = null;
                throw new IllegalStateException("No live log writer to shut down");
            }
            try {
                current.close();
            } finally {
                instance = null;
            }
        } finally {
            INSTANCE_LOCK.unlock();
        }
    }

    public Path getLogFile() {
        return logFile;
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return !closed;
        } finally {
            lock.unlock();
        }
    }

    public void verbose(String message) {
        log(Severity.VERBOSE, message);
    }

    public void verbose(String template, Object... args) {
        log(Severity.VERBOSE, template, args);
    }

    public void debug(String message) {
        log(Severity.DEBUG, message);
    }

    public void debug(String template, Object... args) {
        log(Severity.DEBUG, template, args);
    }

    public void info(String message) {
        log(Severity.INFO, message);
    }

    public void info(String template, Object... args) {
        log(Severity.INFO, template, args);
    }

    public void warn(String message) {
        log(Severity.WARN, message);
    }

    public void warn(String template, Object... args) {
        log(Severity.WARN, template, args);
    }

    public void error(String message) {
        log(Severity.ERROR, message);
    }

    public void error(String template, Object... args) {
        log(Severity.ERROR, template, args);
    }

    /**
     * Logs {@code message} followed on the next line by the full stack trace of {@code error}.
     */
    public void exception(String message, Throwable error) {
        if (message == null) {
            exception(error);
            return;
        }
        log(Severity.ERROR, message + System.lineSeparator() + LogEntryFormatter.describe(error));
    }

    public void exception(Throwable error) {
        log(Severity.ERROR, LogEntryFormatter.describe(error));
    }

    /**
     * Interpolates {@code template} with {@link java.text.MessageFormat} rules and logs the result.
     *
     * @throws LogFormatException if the template does not match the arguments; nothing is queued
     */
    public void log(Severity severity, String template, Object... args) {
        Objects.requireNonNull(severity, "severity");
        if (!severity.isPersisted()) {
            return;
        }
        log(severity, LogEntryFormatter.interpolate(template, args));
    }

    public void log(Severity severity, String message) {
        Objects.requireNonNull(severity, "severity");
        if (!severity.isPersisted()) {
            return;
        }
        String entry = formatter.render(severity, message);
        lock.lock();
        try {
            ensureOpen();
            pending.add(entry);
            if (pending.size() >= FLUSH_THRESHOLD) {
                flushPending();
            }
        } finally {
            lock.unlock();
        }
        try {
            echo.echo(entry);
        } catch (RuntimeException ignored) {
            // the echo never affects the primary log
        }
    }

    /**
     * Writes every pending line, appends a trailing line separator and releases the file.
     *
     * @throws IllegalStateException if the writer is already closed
     * @throws UncheckedIOException  if the final write fails; the file is released regardless
     */
    @Override
    public void close() {
        lock.lock();
        try {
            ensureOpen();
            closed = true;
            try {
                flushPending();
                out.write(System.lineSeparator());
                out.flush();
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to finish log file " + logFile, ex);
            } finally {
                closeQuietly();
            }
        } finally {
            lock.unlock();
        }
        LOGGER.log(Level.CONFIG, "Closed log file {0}", logFile);
    }

    int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Writes queued lines in order. A failed write may leave part of a line buffered, so the
     * writer is closed at that point rather than risking the line being written twice.
     */
    private void flushPending() {
        try {
            String entry;
            while ((entry = pending.peek()) != null) {
                out.write(entry + System.lineSeparator());
                pending.remove();
            }
            out.flush();
        } catch (IOException ex) {
            closed = true;
            closeQuietly();
            throw new UncheckedIOException("Failed to write log file " + logFile
                + "; " + pending.size() + " entries not written", ex);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Log writer for " + logFile + " is closed");
        }
    }

    private void closeQuietly() {
        try {
            out.close();
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to close log file " + logFile, ex);
        }
    }

    private static BufferedWriter openAppend(Path logFile) {
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new BufferedWriter(new OutputStreamWriter(Files.newOutputStream(
                logFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND,
                StandardOpenOption.WRITE
            ), UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to open log file " + logFile, ex);
        }
    }
}
