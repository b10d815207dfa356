package droidreplay.model;

import java.util.List;

/**
 * Thrown when a {@link Workflow} breaks one or more structural rules.
 * The message lists every problem; {@link #getProblems()} returns them
 * individually.
 */
public class WorkflowValidationException extends RuntimeException {

    private final List<String> problems;

    public WorkflowValidationException(String workflowName, List<String> problems) {
        super("Workflow '" + workflowName + "' is invalid: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() { return problems; }
}
