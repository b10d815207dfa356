package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Payload for {@code wait} steps. */
public class WaitData {

    public static final int DEFAULT_DURATION_MS = 1000;
    public static final int MAX_DURATION_MS     = 60_000;

    @JsonProperty("duration_ms")
    private int durationMs = DEFAULT_DURATION_MS;

    public WaitData() {}

    public WaitData(int durationMs) {
        this.durationMs = durationMs;
    }

    public int  getDurationMs()               { return durationMs; }
    public void setDurationMs(int durationMs) { this.durationMs = durationMs; }
}
