package droidreplay.player;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Outcome of a single executed step. */
public enum StepResult {

    SUCCESS, FAILED, SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
