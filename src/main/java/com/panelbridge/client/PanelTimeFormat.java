package com.panelbridge.client;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Date-time conventions of the panel API.
 *
 * <p>The panel stores and returns UTC wall-clock times without an offset
 * ({@code yyyy-MM-dd'T'HH:mm:ss}). Values supplied by callers may carry an offset, a {@code Z}, or
 * nothing; the latter are read in the configured input zone.
 */
public final class PanelTimeFormat {

    private static final DateTimeFormatter WIRE = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private PanelTimeFormat() {}

    /** Formats an instant the way the panel expects it: naive UTC, second precision. */
    public static String toWire(Instant instant) {
        if (instant == null) {
            return null;
        }
        return WIRE.format(LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC));
    }

    /** Parses a time returned by the panel. Naive values are UTC. Null when unparseable. */
    public static Instant fromWire(String value) {
        return parse(value, ZoneOffset.UTC);
    }

    /**
     * Parses a caller-supplied time. Offset or {@code Z} values are honored; naive values are
     * interpreted in {@code inputZone}. Null when blank or unparseable.
     */
    public static Instant parse(String value, ZoneId inputZone) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset, fall through to the naive forms
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException ignored) {
            // not an instant either
        }
        try {
            return LocalDateTime.parse(text).atZone(inputZone).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
