package com.panelbridge.client;

import com.panelbridge.config.PanelConfig;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns "override until T" into the whole minutes the panel's timed override accepts.
 *
 * <p>{@code minutes = ceil((T - now) / 60s)}. A target that is missing, unparseable, or not in the
 * future yields the fallback (caller default, else {@code panel.default-override-minutes}) and a
 * WARN. Zero or negative minutes are never produced.
 */
@Component
public class OverrideMinutesCalculator {

    private static final Logger log = LoggerFactory.getLogger(OverrideMinutesCalculator.class);

    private final PanelConfig panelConfig;
    private final Clock clock;

    public OverrideMinutesCalculator(PanelConfig panelConfig, Clock clock) {
        this.panelConfig = panelConfig;
        this.clock = clock;
    }

    /**
     * Minutes for a timed override.
     *
     * @param minutes explicit minutes from the caller, used when positive
     * @param until explicit end time, used when {@code minutes} is absent
     * @param fallback caller default, may be null
     */
    public int resolve(Integer minutes, Instant until, Integer fallback) {
        if (minutes != null && minutes > 0) {
            return minutes;
        }
        if (minutes != null) {
            log.warn("Override minutes {} is not positive, using {}", minutes, fallbackMinutes(fallback));
            return fallbackMinutes(fallback);
        }
        if (until == null) {
            return fallbackMinutes(fallback);
        }
        return minutesUntil(until, fallback);
    }

    public int minutesUntil(Instant until, Integer fallback) {
        Duration remaining = Duration.between(clock.instant(), until);
        if (remaining.isNegative() || remaining.isZero()) {
            int recovered = fallbackMinutes(fallback);
            log.warn("Override end {} is not in the future, using default {} minutes", until, recovered);
            return recovered;
        }
        long minutes = remaining.toMinutes();
        if (remaining.compareTo(Duration.ofMinutes(minutes)) > 0) {
            minutes++;
        }
        return (int) Math.min(minutes, Integer.MAX_VALUE);
    }

    /** Parses a caller-supplied end time; unparseable text logs a WARN and yields null. */
    public Instant parseUntil(String until) {
        if (until == null || until.isBlank()) {
            return null;
        }
        Instant parsed = PanelTimeFormat.parse(until, panelConfig.resolveInputZone());
        if (parsed == null) {
            log.warn("Unparseable override end '{}', the default duration applies", until);
        }
        return parsed;
    }

    private int fallbackMinutes(Integer fallback) {
        if (fallback != null && fallback > 0) {
            return fallback;
        }
        return Math.max(1, panelConfig.getDefaultOverrideMinutes());
    }
}
