package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Direction the finger travels during a swipe or scroll gesture. */
public enum SwipeDirection {

    UP, DOWN, LEFT, RIGHT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SwipeDirection fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Swipe direction must not be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
