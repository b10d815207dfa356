package droidreplay.player;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Immutable record of one executed step.
 *
 * <p>{@code selectorUsed} names whatever actually produced the action: a
 * selector's {@code describe()} text, {@code coordinates(x,y)} or a swipe
 * direction. {@code error} is only set for failed steps.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepExecutionResult {

    @JsonProperty("step_id")       private final String     stepId;
    @JsonProperty("step_name")     private final String     stepName;
    @JsonProperty("result")        private final StepResult result;
    @JsonProperty("message")       private final String     message;
    @JsonProperty("duration_ms")   private final long       durationMs;
    @JsonProperty("selector_used") private final String     selectorUsed;
    @JsonProperty("fallback_used") private final boolean    fallbackUsed;
    @JsonProperty("error")         private final String     error;
    @JsonProperty("timestamp")     private final Instant    timestamp;

    private StepExecutionResult(String stepId, String stepName, StepResult result, String message,
                                long durationMs, String selectorUsed, boolean fallbackUsed, String error) {
        this.stepId       = stepId;
        this.stepName     = stepName;
        this.result       = result;
        this.message      = message;
        this.durationMs   = Math.max(0L, durationMs);
        this.selectorUsed = selectorUsed;
        this.fallbackUsed = fallbackUsed;
        this.error        = result == StepResult.FAILED ? (error != null ? error : message) : null;
        this.timestamp    = Instant.now();
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public static StepExecutionResult success(String stepId, String stepName, String message, long durationMs,
                                              String selectorUsed, boolean fallbackUsed) {
        return new StepExecutionResult(stepId, stepName, StepResult.SUCCESS, message, durationMs,
                selectorUsed, fallbackUsed, null);
    }

    public static StepExecutionResult failed(String stepId, String stepName, String message, long durationMs,
                                             String selectorUsed, boolean fallbackUsed, String error) {
        return new StepExecutionResult(stepId, stepName, StepResult.FAILED, message, durationMs,
                selectorUsed, fallbackUsed, error);
    }

    public static StepExecutionResult skipped(String stepId, String stepName, String message, long durationMs) {
        return new StepExecutionResult(stepId, stepName, StepResult.SKIPPED, message, durationMs,
                null, false, null);
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String     getStepId()       { return stepId; }
    public String     getStepName()     { return stepName; }
    public StepResult getResult()       { return result; }
    public String     getMessage()      { return message; }
    public long       getDurationMs()   { return durationMs; }
    public String     getSelectorUsed() { return selectorUsed; }
    public boolean    isFallbackUsed()  { return fallbackUsed; }
    public String     getError()        { return error; }
    public Instant    getTimestamp()    { return timestamp; }

    @JsonIgnore
    public boolean isSuccess() { return result == StepResult.SUCCESS; }

    @Override
    public String toString() {
        return String.format("StepExecutionResult{step='%s', result=%s, message='%s', selector=%s, fallback=%s, %dms}",
                stepName, result, message, selectorUsed, fallbackUsed, durationMs);
    }
}
