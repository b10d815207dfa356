package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload for {@code swipe} and {@code scroll} steps. Either the explicit
 * start/end points or a direction (or both) may be present.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SwipeData {

    public static final int DEFAULT_DURATION_MS = 300;

    @JsonProperty("direction")
    private SwipeDirection direction;

    @JsonProperty("start_x")
    private Integer startX;

    @JsonProperty("start_y")
    private Integer startY;

    @JsonProperty("end_x")
    private Integer endX;

    @JsonProperty("end_y")
    private Integer endY;

    @JsonProperty("duration_ms")
    private int durationMs = DEFAULT_DURATION_MS;

    public SwipeData() {}

    public SwipeData(SwipeDirection direction) {
        this.direction = direction;
    }

    public static SwipeData between(int startX, int startY, int endX, int endY) {
        SwipeData d = new SwipeData();
        d.startX = startX;
        d.startY = startY;
        d.endX   = endX;
        d.endY   = endY;
        return d;
    }

    public SwipeDirection getDirection()  { return direction; }
    public Integer        getStartX()     { return startX; }
    public Integer        getStartY()     { return startY; }
    public Integer        getEndX()       { return endX; }
    public Integer        getEndY()       { return endY; }
    public int            getDurationMs() { return durationMs; }

    public void setDirection(SwipeDirection direction) { this.direction = direction; }
    public void setStartX(Integer startX)              { this.startX = startX; }
    public void setStartY(Integer startY)              { this.startY = startY; }
    public void setEndX(Integer endX)                  { this.endX = endX; }
    public void setEndY(Integer endY)                  { this.endY = endY; }
    public void setDurationMs(int durationMs)          { this.durationMs = durationMs; }

    @JsonIgnore
    public boolean hasCoordinates() {
        return startX != null && startY != null && endX != null && endY != null;
    }
}
