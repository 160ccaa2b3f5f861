package com.panelbridge.normalizer;

import com.panelbridge.domain.enums.DoorEventType;
import com.panelbridge.domain.enums.ReaderMode;
import com.panelbridge.domain.model.DoorStatus;
import com.panelbridge.domain.model.PanelNotification;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads meaning out of notification text: who acted on the door, and any door status the text
 * implies.
 *
 * <p>Stateless. Lock/unlock lines only ever become door messages; only access, action-plan and
 * one-time-run lines name an actor.
 */
final class NotificationInterpreter {

    private static final Set<String> ACCESS_TYPES = Set.of(
            "READER_ACCESS_GRANTED", "READER_ACCESS_DENIED", "USER_ACCESS_GRANTED", "USER_ACCESS_DENIED");
    private static final Set<String> ACTION_PLAN_TYPES = Set.of("ACTIONPLAN_MESSAGE", "ACTIONPLAN_STATE");
    static final String DOOR_LOCK_STATE = "DOOR_LOCK_STATE";

    private static final Pattern READER_LINE =
            Pattern.compile("^(?<name>.+?)\\s+(Granted|Denied)\\s+Access\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern ACTION_LINE =
            Pattern.compile("^(?<name>.+?)\\s+(unlocked|locked)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CURRENT_STATE = Pattern.compile("current state is\\s+([a-z\\s/]+)");

    /** Longest phrases first so "card" never wins inside "card or pin". */
    private static final List<ModePattern> OVERRIDE_MODES = List.of(
            new ModePattern("\\bcard\\s+or\\s+pin\\b", ReaderMode.CARD_OR_PIN),
            new ModePattern("\\bcard\\s+and\\s+pin\\b", ReaderMode.CARD_AND_PIN),
            new ModePattern("\\bfirst\\s+credential\\s+in\\b", ReaderMode.FIRST_CREDENTIAL_IN),
            new ModePattern("\\bdual\\s+credential\\b", ReaderMode.DUAL_CREDENTIAL),
            new ModePattern("\\blockdown\\b", ReaderMode.LOCKDOWN),
            new ModePattern("\\bunlock(?:ed)?\\b", ReaderMode.UNLOCK),
            new ModePattern("\\bpin\\b", ReaderMode.PIN),
            new ModePattern("\\bcard\\b", ReaderMode.CARD));

    private static final List<String> UNLOCK_HOLD_PHRASES =
            List.of("unlock until resume", "unlock until next schedule", "timed override unlock");
    private static final List<String> CARD_OR_PIN_HOLD_PHRASES =
            List.of("cardorpin until resume", "card or pin until resume");
    private static final List<String> RESUME_PHRASES = List.of(
            "resume schedule",
            "schedule resumed",
            "returned to schedule",
            "override cleared",
            "has resumed from an overridden state");

    private NotificationInterpreter() {}

    /** The log-line part of a notification. */
    static final class LogLine {

        final DoorEventType type;
        final String actor;
        final String readerMessage;
        final String doorMessage;

        private LogLine(DoorEventType type, String actor, String readerMessage, String doorMessage) {
            this.type = type;
            this.actor = actor;
            this.readerMessage = readerMessage;
            this.doorMessage = doorMessage;
        }
    }

    /** Classifies the log line, or returns null when the notification is not a door log line. */
    static LogLine logLine(PanelNotification note) {
        String type = note.upperType();
        String message = note.getMessage() != null ? note.getMessage().trim() : "";
        String lower = message.toLowerCase(Locale.ROOT);

        if (ACCESS_TYPES.contains(type)) {
            boolean granted = lower.contains("granted") || (!lower.contains("denied") && type.endsWith("GRANTED"));
            String who = firstNonBlank(extract(READER_LINE, message), note.getSourceName());
            String verb = granted ? "granted access" : "denied access";
            String actor = who != null ? who + " " + verb : verb;
            return new LogLine(
                    granted ? DoorEventType.ACCESS_GRANTED : DoorEventType.ACCESS_DENIED, actor, message, null);
        }

        if (ACTION_PLAN_TYPES.contains(type)) {
            String who = firstNonBlank(extract(ACTION_LINE, message), note.getSourceName());
            String padded = " " + lower + " ";
            String actor = who;
            if (who != null && padded.contains(" unlocked ")) {
                actor = who + " unlocked";
            } else if (who != null && padded.contains(" locked ")) {
                actor = who + " locked";
            }
            String readerMessage = !message.isEmpty() ? message : (who != null ? who + " action" : null);
            return new LogLine(DoorEventType.ACTION_PLAN_EXECUTED, actor, readerMessage, null);
        }

        if (type.startsWith("ONETIMERUN") || lower.contains("one time run")) {
            String actor = !message.isEmpty() ? message : firstNonBlank(note.getSourceName(), "One time run");
            return new LogLine(DoorEventType.OTR_ACTIVATED, actor, message, null);
        }

        if (isDoorLockLine(lower)) {
            return new LogLine(DoorEventType.DOOR_MESSAGE, null, null, message);
        }
        return null;
    }

    /**
     * Door status implied by the text, in application order. Empty when the text implies none.
     */
    static List<DoorStatus> impliedStatuses(PanelNotification note, ReaderMode baselineMode) {
        String lower = note.getMessage() != null ? note.getMessage().toLowerCase(Locale.ROOT) : "";
        List<DoorStatus> statuses = new ArrayList<>(2);

        if (lower.contains("has been overridden") && lower.contains("current state is")) {
            ReaderMode mode = modeFromOverrideText(lower);
            DoorStatus.DoorStatusBuilder status = DoorStatus.builder().overridden(Boolean.TRUE).readerMode(mode);
            if (mode == ReaderMode.UNLOCK) {
                status.strike(Boolean.TRUE).opener(Boolean.TRUE);
            }
            statuses.add(status.build());
        } else if (containsAny(lower, UNLOCK_HOLD_PHRASES)) {
            statuses.add(DoorStatus.builder()
                    .strike(Boolean.TRUE)
                    .opener(Boolean.TRUE)
                    .overridden(Boolean.TRUE)
                    .readerMode(ReaderMode.UNLOCK)
                    .build());
        } else if (containsAny(lower, CARD_OR_PIN_HOLD_PHRASES)) {
            statuses.add(DoorStatus.builder()
                    .overridden(Boolean.TRUE)
                    .readerMode(ReaderMode.CARD_OR_PIN)
                    .build());
        } else if (containsAny(lower, RESUME_PHRASES)) {
            statuses.add(DoorStatus.builder()
                    .overridden(Boolean.FALSE)
                    .readerMode(baselineMode != null ? baselineMode : ReaderMode.CARD)
                    .build());
        }

        if (DOOR_LOCK_STATE.equals(note.upperType())) {
            if (lower.contains("unlocked")) {
                statuses.add(DoorStatus.builder().strike(Boolean.TRUE).opener(Boolean.TRUE).build());
            } else if (lower.contains("locked")) {
                statuses.add(DoorStatus.builder().strike(Boolean.FALSE).opener(Boolean.FALSE).build());
            }
        }
        return statuses;
    }

    /** Mode named after "current state is", or null. */
    static ReaderMode modeFromOverrideText(String lowerMessage) {
        Matcher m = CURRENT_STATE.matcher(lowerMessage);
        String modeText = m.find() ? m.group(1).trim() : "";
        for (ModePattern candidate : OVERRIDE_MODES) {
            if (candidate.pattern.matcher(modeText).find()) {
                return candidate.mode;
            }
        }
        return null;
    }

    // ---- Private helpers ----

    private static boolean isDoorLockLine(String lower) {
        return lower.contains("door ") && (lower.contains(" unlocked") || lower.contains(" locked"));
    }

    private static String extract(Pattern pattern, String message) {
        Matcher m = pattern.matcher(message);
        return m.find() ? m.group("name").trim() : null;
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        return b != null && !b.isBlank() ? b.trim() : null;
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String phrase : phrases) {
            if (text.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static final class ModePattern {

        final Pattern pattern;
        final ReaderMode mode;

        ModePattern(String regex, ReaderMode mode) {
            this.pattern = Pattern.compile(regex);
            this.mode = mode;
        }
    }
}
