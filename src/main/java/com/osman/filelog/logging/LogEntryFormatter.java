package com.osman.filelog.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.text.Format;
import java.text.MessageFormat;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders log entries into the single-line text form written to the log file.
 * All formatting uses {@link Locale#ROOT} so output does not depend on the host locale.
 */
final class LogEntryFormatter {

    static final int SEVERITY_WIDTH = 7;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss", Locale.ROOT);
    private static final DateTimeFormatter DATE_FORMAT =
        DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT);
    private static final Object[] NO_ARGS = new Object[0];

    private final Clock clock;

    LogEntryFormatter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    String render(Severity severity, String message) {
        String timestamp = TIMESTAMP_FORMAT.format(LocalDateTime.now(clock));
        String label = String.format(Locale.ROOT, "%-" + SEVERITY_WIDTH + "s", severity.displayName());
        return timestamp + " " + label + " | " + (message == null ? "" : message);
    }

    /**
     * Interpolates {@code {index}} placeholders. Apostrophes are literal, and arguments without
     * an explicit {@link MessageFormat} sub-format are inserted as plain {@link Locale#ROOT} text:
     * numbers without grouping or rounding, dates and times in the timestamp pattern.
     *
     * @throws LogFormatException if the template is malformed or references a missing argument
     */
    static String interpolate(String template, Object... args) {
        if (template == null) {
            throw new LogFormatException("null", "template is null", null);
        }
        Object[] values = args == null ? NO_ARGS : args;
        MessageFormat format;
        try {
            format = new MessageFormat(template.replace("'", "''"), Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            throw new LogFormatException(template, ex.getMessage(), ex);
        }
        Format[] formats = format.getFormatsByArgumentIndex();
        if (formats.length > values.length) {
            throw new LogFormatException(template,
                "placeholder {" + (formats.length - 1) + "} has no argument (" + values.length + " supplied)", null);
        }
        Object[] rendered = values.clone();
        for (int i = 0; i < rendered.length; i++) {
            if (i >= formats.length || formats[i] == null) {
                rendered[i] = toInvariantText(rendered[i]);
            }
        }
        try {
            return format.format(rendered);
        } catch (IllegalArgumentException ex) {
            throw new LogFormatException(template, ex.getMessage(), ex);
        }
    }

    static String toInvariantText(Object value) {
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return String.valueOf(d);
            }
            return new BigDecimal(value.toString()).stripTrailingZeros().toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Date) {
            return TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneId.systemDefault()));
        }
        if (value instanceof Instant) {
            return TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant((Instant) value, ZoneId.systemDefault()));
        }
        if (value instanceof TemporalAccessor) {
            TemporalAccessor temporal = (TemporalAccessor) value;
            if (temporal.isSupported(ChronoField.HOUR_OF_DAY) && temporal.isSupported(ChronoField.EPOCH_DAY)) {
                return TIMESTAMP_FORMAT.format(temporal);
            }
            if (temporal.isSupported(ChronoField.EPOCH_DAY)) {
                return DATE_FORMAT.format(temporal);
            }
        }
        return Objects.toString(value);
    }

    /**
     * Full description of a throwable: type, message, stack frames and the cause chain.
     */
    static String describe(Throwable error) {
        if (error == null) {
            return "";
        }
        StringWriter buffer = new StringWriter(512);
        try (PrintWriter writer = new PrintWriter(buffer)) {
            error.printStackTrace(writer);
        }
        String text = buffer.toString();
        String separator = System.lineSeparator();
        while (text.endsWith(separator)) {
            text = text.substring(0, text.length() - separator.length());
        }
        return text;
    }
}
