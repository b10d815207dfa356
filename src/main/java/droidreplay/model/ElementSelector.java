package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * One strategy for locating a UI element plus an optional fallback that is
 * tried when this one matches nothing.
 *
 * <p>The chain is a plain owned reference: {@code primary -> fallback ->
 * fallback ...}. It must be acyclic and at most {@link #MAX_FALLBACK_DEPTH}
 * links deep; {@link WorkflowValidator} enforces both on load.
 *
 * <p>{@code confidence} is what the recorder thought of the strategy. It is
 * clamped to {@code [0, 1]} and never consulted while matching.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementSelector {

    /** Maximum number of fallback links behind the primary selector. */
    public static final int MAX_FALLBACK_DEPTH = 5;

    private static final int    DESCRIBE_VALUE_LIMIT = 50;
    private static final double DEFAULT_CONFIDENCE   = 0.5;

    @JsonProperty("type")
    private SelectorType type;

    @JsonProperty("value")
    private String value;

    @JsonProperty("confidence")
    private double confidence = DEFAULT_CONFIDENCE;

    @JsonProperty("fallback")
    private ElementSelector fallback;

    public ElementSelector() {}

    public ElementSelector(SelectorType type, String value) {
        this(type, value, DEFAULT_CONFIDENCE);
    }

    public ElementSelector(SelectorType type, String value, double confidence) {
        this.type = type;
        setValue(value);
        setConfidence(confidence);
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static ElementSelector byResourceId(String resourceId) {
        return new ElementSelector(SelectorType.RESOURCE_ID, resourceId, 0.95);
    }

    public static ElementSelector byContentDescription(String description) {
        return new ElementSelector(SelectorType.CONTENT_DESC, description, 0.85);
    }

    public static ElementSelector byText(String text) {
        return new ElementSelector(SelectorType.TEXT, text, 0.75);
    }

    public static ElementSelector byBounds(String bounds) {
        return new ElementSelector(SelectorType.BOUNDS, bounds, 0.5);
    }

    // ── Getters / setters ─────────────────────────────────────────────────

    public SelectorType    getType()       { return type; }
    public String          getValue()      { return value; }
    public double          getConfidence() { return confidence; }
    public ElementSelector getFallback()   { return fallback; }

    public void setType(SelectorType type) { this.type = type; }

    public void setValue(String value) {
        this.value = value != null ? value.trim() : null;
    }

    public void setConfidence(double confidence) {
        if (Double.isNaN(confidence)) {
            this.confidence = 0.0;
            return;
        }
        this.confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public void setFallback(ElementSelector fallback) { this.fallback = fallback; }

    /**
     * Appends {@code next} as this selector's fallback and returns
     * {@code this}, so chains read left to right:
     * {@code byResourceId("login").orElse(byText("Log in"))}.
     * Any existing fallback is replaced.
     */
    public ElementSelector orElse(ElementSelector next) {
        this.fallback = next;
        return this;
    }

    // ── Convenience ───────────────────────────────────────────────────────

    @JsonIgnore
    public boolean hasFallback() {
        return fallback != null;
    }

    /**
     * Number of fallback links behind this selector, or {@code -1} if the
     * chain loops back on itself.
     */
    @JsonIgnore
    public int getFallbackDepth() {
        Set<ElementSelector> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(this);
        int depth = 0;
        for (ElementSelector s = fallback; s != null; s = s.fallback) {
            if (!seen.add(s)) {
                return -1;
            }
            depth++;
        }
        return depth;
    }

    /**
     * Short label used in step results and logs, e.g. {@code resource-id:login_btn}.
     * Long values are cut to 50 characters.
     */
    public String describe() {
        String t = type != null ? type.wireName() : "unknown";
        String v = value == null ? "" : value;
        if (v.length() > DESCRIBE_VALUE_LIMIT) {
            v = v.substring(0, DESCRIBE_VALUE_LIMIT);
        }
        return t + ":" + v;
    }

    @Override
    public String toString() {
        return String.format("ElementSelector{%s, confidence=%.2f%s}",
                describe(), confidence, fallback != null ? ", fallback=" + fallback.describe() : "");
    }
}
