package droidreplay.player;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live state of one replay run.
 *
 * <p>The run loop is the only writer; mutators are package-private. Anyone
 * else (listeners, pollers on other threads) sees a consistent read-only
 * view: scalar fields are volatile and {@link #getStepResults()} is an
 * unmodifiable view over a copy-on-write list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplayProgress {

    private final String workflowId;
    private final String workflowName;
    private final int    totalSteps;

    private volatile ReplayStatus status = ReplayStatus.PENDING;
    private volatile int          completedSteps;
    private volatile String       currentStepId;
    private volatile String       currentStepName;
    private volatile Instant      startedAt;
    private volatile Instant      completedAt;
    private volatile String       error;

    private final List<StepExecutionResult> stepResults = new CopyOnWriteArrayList<>();

    ReplayProgress(String workflowId, String workflowName, int totalSteps) {
        this.workflowId   = workflowId;
        this.workflowName = workflowName;
        this.totalSteps   = Math.max(0, totalSteps);
    }

    // ── Read side ─────────────────────────────────────────────────────────

    @JsonProperty("workflow_id")       public String       getWorkflowId()      { return workflowId; }
    @JsonProperty("workflow_name")     public String       getWorkflowName()    { return workflowName; }
    @JsonProperty("status")            public ReplayStatus getStatus()          { return status; }
    @JsonProperty("total_steps")       public int          getTotalSteps()      { return totalSteps; }
    @JsonProperty("completed_steps")   public int          getCompletedSteps()  { return completedSteps; }
    @JsonProperty("current_step_id")   public String       getCurrentStepId()   { return currentStepId; }
    @JsonProperty("current_step_name") public String       getCurrentStepName() { return currentStepName; }
    @JsonProperty("started_at")        public Instant      getStartedAt()       { return startedAt; }
    @JsonProperty("completed_at")      public Instant      getCompletedAt()     { return completedAt; }
    @JsonProperty("error")             public String       getError()           { return error; }

    @JsonProperty("step_results")
    public List<StepExecutionResult> getStepResults() {
        return Collections.unmodifiableList(stepResults);
    }

    /** {@code completedSteps / totalSteps * 100}, or 0 for an empty workflow. */
    @JsonProperty("progress_percent")
    public double getProgressPercent() {
        int total = totalSteps;
        return total == 0 ? 0.0 : completedSteps * 100.0 / total;
    }

    @JsonProperty("success_count")
    public long getSuccessCount() {
        return stepResults.stream().filter(r -> r.getResult() == StepResult.SUCCESS).count();
    }

    @JsonProperty("failed_count")
    public long getFailedCount() {
        return stepResults.stream().filter(r -> r.getResult() == StepResult.FAILED).count();
    }

    @JsonIgnore
    public boolean isFinished() {
        return status.isTerminal();
    }

    // ── Write side (run loop only) ────────────────────────────────────────

    void setStatus(ReplayStatus status) { this.status = status; }
    void setError(String error)         { this.error = error; }

    void markStarted() {
        this.startedAt = Instant.now();
        this.status    = ReplayStatus.RUNNING;
    }

    void setCurrentStep(String id, String name) {
        this.currentStepId   = id;
        this.currentStepName = name;
    }

    void recordResult(StepExecutionResult result) {
        stepResults.add(result);
        completedSteps++;
    }

    void finish(ReplayStatus terminal, String error) {
        if (error != null) {
            this.error = error;
        }
        this.currentStepId   = null;
        this.currentStepName = null;
        this.completedAt     = Instant.now();
        this.status          = terminal;
    }

    @Override
    public String toString() {
        return String.format("ReplayProgress{workflow='%s', status=%s, %d/%d, error=%s}",
                workflowName, status, completedSteps, totalSteps, error);
    }
}
