package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Strategies for locating an element in the device accessibility tree,
 * listed in the order a recorder ranks them by stability.
 */
public enum SelectorType {

    RESOURCE_ID("resource-id"),
    CONTENT_DESC("content-desc"),
    TEXT("text"),
    XPATH("xpath"),
    BOUNDS("bounds");

    private final String wireName;

    SelectorType(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in workflow documents, e.g. {@code "resource-id"}. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Accepts the document form ({@code "content-desc"}) as well as the
     * enum constant name ({@code "CONTENT_DESC"}).
     *
     * @throws IllegalArgumentException for an unknown selector type
     */
    @JsonCreator
    public static SelectorType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Selector type must not be null");
        }
        String v = value.trim();
        for (SelectorType t : values()) {
            if (t.wireName.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown selector type: " + value);
    }
}
