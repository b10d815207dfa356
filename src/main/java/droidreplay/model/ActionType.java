package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of step a workflow can contain.
 */
public enum ActionType {

    TAP("tap"),
    LONG_TAP("long_tap"),
    SWIPE("swipe"),
    SCROLL("scroll"),
    INPUT_TEXT("input_text"),
    WAIT("wait"),
    /** Terminal marker: ends the run with the status carried in its payload. */
    COMPLETE("complete");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parses the document form. {@code long_press} and {@code long-press}
     * are accepted for {@link #LONG_TAP}.
     *
     * @throws IllegalArgumentException for an unknown action
     */
    @JsonCreator
    public static ActionType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action must not be null");
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if (v.equals("long_press")) {
            return LONG_TAP;
        }
        for (ActionType a : values()) {
            if (a.wireName.equals(v)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + value);
    }
}
