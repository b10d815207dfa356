package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * A single action in a {@link Workflow}.
 *
 * <p>Besides the {@link ActionType} a step carries an optional
 * {@link ElementSelector} and at most one action-specific payload. Which
 * payload is allowed depends on the action:
 * <ul>
 *   <li>{@code tap}, {@code long_tap} → {@link TapData}</li>
 *   <li>{@code swipe}, {@code scroll} → {@link SwipeData}</li>
 *   <li>{@code input_text} → {@link InputTextData} (required)</li>
 *   <li>{@code wait} → {@link WaitData}</li>
 *   <li>{@code complete} → {@link CompleteData}</li>
 * </ul>
 * {@link WorkflowValidator} rejects steps whose payload does not fit.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowStep {

    @JsonProperty("id")
    private String id = UUID.randomUUID().toString();

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("action")
    private ActionType action;

    @JsonProperty("selector")
    private ElementSelector selector;

    @JsonProperty("tap_data")
    private TapData tapData;

    @JsonProperty("swipe_data")
    private SwipeData swipeData;

    @JsonProperty("input_data")
    private InputTextData inputData;

    @JsonProperty("wait_data")
    private WaitData waitData;

    @JsonProperty("complete_data")
    private CompleteData completeData;

    public WorkflowStep() {}

    public WorkflowStep(ActionType action, String name) {
        this.action = action;
        this.name   = name;
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static WorkflowStep tap(String name, ElementSelector selector) {
        WorkflowStep s = new WorkflowStep(ActionType.TAP, name);
        s.selector = selector;
        return s;
    }

    public static WorkflowStep tapAt(String name, int x, int y) {
        WorkflowStep s = new WorkflowStep(ActionType.TAP, name);
        s.tapData = new TapData(x, y);
        return s;
    }

    public static WorkflowStep longTap(String name, ElementSelector selector) {
        WorkflowStep s = new WorkflowStep(ActionType.LONG_TAP, name);
        s.selector = selector;
        return s;
    }

    public static WorkflowStep swipe(String name, SwipeDirection direction) {
        WorkflowStep s = new WorkflowStep(ActionType.SWIPE, name);
        s.swipeData = new SwipeData(direction);
        return s;
    }

    public static WorkflowStep inputText(String name, String text) {
        WorkflowStep s = new WorkflowStep(ActionType.INPUT_TEXT, name);
        s.inputData = new InputTextData(text);
        return s;
    }

    public static WorkflowStep waitFor(String name, int durationMs) {
        WorkflowStep s = new WorkflowStep(ActionType.WAIT, name);
        s.waitData = new WaitData(durationMs);
        return s;
    }

    public static WorkflowStep complete(String name, boolean success, String message) {
        WorkflowStep s = new WorkflowStep(ActionType.COMPLETE, name);
        s.completeData = new CompleteData(success, message);
        return s;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String          getId()           { return id; }
    public String          getName()         { return name; }
    public String          getDescription()  { return description; }
    public ActionType      getAction()       { return action; }
    public ElementSelector getSelector()     { return selector; }
    public TapData         getTapData()      { return tapData; }
    public SwipeData       getSwipeData()    { return swipeData; }
    public InputTextData   getInputData()    { return inputData; }
    public WaitData        getWaitData()     { return waitData; }
    public CompleteData    getCompleteData() { return completeData; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setId(String id)                          { this.id = id; }
    public void setName(String name)                      { this.name = name; }
    public void setDescription(String description)        { this.description = description; }
    public void setAction(ActionType action)              { this.action = action; }
    public void setSelector(ElementSelector selector)     { this.selector = selector; }
    public void setTapData(TapData tapData)               { this.tapData = tapData; }
    public void setSwipeData(SwipeData swipeData)         { this.swipeData = swipeData; }
    public void setInputData(InputTextData inputData)     { this.inputData = inputData; }
    public void setWaitData(WaitData waitData)            { this.waitData = waitData; }
    public void setCompleteData(CompleteData data)        { this.completeData = data; }

    /** Fluent variant of {@link #setSelector}. */
    public WorkflowStep withSelector(ElementSelector selector) {
        this.selector = selector;
        return this;
    }

    /** Fluent variant of {@link #setTapData}. */
    public WorkflowStep withTapData(TapData tapData) {
        this.tapData = tapData;
        return this;
    }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore public boolean hasSelector()       { return selector != null; }
    @JsonIgnore public boolean hasTapCoordinates() { return tapData != null && tapData.hasCoordinates(); }

    /** Number of action-specific payloads that are set. */
    @JsonIgnore
    public int getPayloadCount() {
        int n = 0;
        if (tapData != null)      n++;
        if (swipeData != null)    n++;
        if (inputData != null)    n++;
        if (waitData != null)     n++;
        if (completeData != null) n++;
        return n;
    }

    @Override
    public String toString() {
        return String.format("WorkflowStep{id='%s', action=%s, name='%s', selector=%s}",
                id, action, name, selector != null ? selector.describe() : null);
    }
}
