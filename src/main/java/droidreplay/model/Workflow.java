package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * A named, ordered list of {@link WorkflowStep}s that can be replayed on a
 * device. List order is execution order.
 *
 * <p>Loaded by {@link WorkflowIO} and consumed by
 * {@code droidreplay.player.ReplayEngine}. The engine takes a copy of the
 * step list when a run starts, so edits made while a run is in progress do
 * not affect it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Workflow {

    @JsonProperty("id")
    private String id = UUID.randomUUID().toString();

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("is_active")
    private boolean active = true;

    @JsonProperty("created_at")
    private Instant createdAt = Instant.now();

    @JsonProperty("updated_at")
    private Instant updatedAt;

    /** Package of the app the workflow was recorded against, if app-specific. */
    @JsonProperty("app_package")
    private String appPackage;

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("version")
    private int version = 1;

    @JsonProperty("steps")
    private List<WorkflowStep> steps = new ArrayList<>();

    public Workflow() {}

    public Workflow(String name) {
        this.name = name;
    }

    // ── Getters ──────────────────────────────────────────────────────────

    public String             getId()          { return id; }
    public String             getName()        { return name; }
    public String             getDescription() { return description; }
    public boolean            isActive()       { return active; }
    public Instant            getCreatedAt()   { return createdAt; }
    public Instant            getUpdatedAt()   { return updatedAt; }
    public String             getAppPackage()  { return appPackage; }
    public List<String>       getTags()        { return tags; }
    public int                getVersion()     { return version; }
    public List<WorkflowStep> getSteps()       { return steps; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setId(String id)                    { this.id = id; }
    public void setName(String name)                { this.name = name; }
    public void setDescription(String description)  { this.description = description; }
    public void setActive(boolean active)           { this.active = active; }
    public void setCreatedAt(Instant createdAt)     { this.createdAt = createdAt; }
    public void setUpdatedAt(Instant updatedAt)     { this.updatedAt = updatedAt; }
    public void setAppPackage(String appPackage)    { this.appPackage = appPackage; }
    public void setVersion(int version)             { this.version = version; }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }

    public void setSteps(List<WorkflowStep> steps) {
        this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
    }

    // ── Convenience ──────────────────────────────────────────────────────

    public Workflow addStep(WorkflowStep step) {
        steps.add(step);
        updatedAt = Instant.now();
        return this;
    }

    /** Returns the step with the given id, or {@code null}. */
    public WorkflowStep getStepById(String stepId) {
        for (WorkflowStep s : steps) {
            if (s != null && s.getId() != null && s.getId().equals(stepId)) {
                return s;
            }
        }
        return null;
    }

    @JsonIgnore
    public int getStepCount() {
        return steps.size();
    }

    @Override
    public String toString() {
        return String.format("Workflow{id='%s', name='%s', steps=%d}", id, name, getStepCount());
    }
}
