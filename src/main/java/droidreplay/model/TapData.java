package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload for {@code tap} and {@code long_tap} steps: the literal screen
 * position captured at recording time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TapData {

    public static final int DEFAULT_DURATION_MS = 100;

    @JsonProperty("x")
    private Integer x;

    @JsonProperty("y")
    private Integer y;

    @JsonProperty("duration_ms")
    private int durationMs = DEFAULT_DURATION_MS;

    public TapData() {}

    public TapData(Integer x, Integer y) {
        this.x = x;
        this.y = y;
    }

    public Integer getX()          { return x; }
    public Integer getY()          { return y; }
    public int     getDurationMs() { return durationMs; }

    public void setX(Integer x)                { this.x = x; }
    public void setY(Integer y)                { this.y = y; }
    public void setDurationMs(int durationMs)  { this.durationMs = durationMs; }

    @JsonIgnore
    public boolean hasCoordinates() {
        return x != null && y != null;
    }

    @Override
    public String toString() {
        return String.format("TapData{x=%s, y=%s, durationMs=%d}", x, y, durationMs);
    }
}
