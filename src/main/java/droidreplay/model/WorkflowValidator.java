package droidreplay.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Structural checks applied to a workflow before it is replayed.
 *
 * <p>{@link #problems(Workflow)} collects every violation so a caller can
 * report them together; {@link #validate(Workflow)} throws if there are any.
 */
public final class WorkflowValidator {

    public static final int MAX_STEP_NAME_LENGTH = 200;

    private WorkflowValidator() {}

    /**
     * @throws WorkflowValidationException if {@link #problems} is not empty
     */
    public static void validate(Workflow workflow) {
        List<String> problems = problems(workflow);
        if (!problems.isEmpty()) {
            throw new WorkflowValidationException(workflow.getName(), problems);
        }
    }

    public static List<String> problems(Workflow workflow) {
        List<String> problems = new ArrayList<>();
        if (workflow == null) {
            problems.add("workflow is null");
            return problems;
        }
        if (workflow.getName() == null || workflow.getName().isBlank()) {
            problems.add("workflow name is required");
        }
        if (workflow.getVersion() < 1) {
            problems.add("workflow version must be at least 1");
        }
        List<WorkflowStep> steps = workflow.getSteps();
        if (steps == null) {
            return problems;
        }
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (step == null) {
                problems.add("step " + i + ": step is null");
                continue;
            }
            checkStep(i, step, problems);
        }
        return problems;
    }

    // ── Step rules ────────────────────────────────────────────────────────

    private static void checkStep(int i, WorkflowStep step, List<String> problems) {
        String at = "step " + i;
        String name = step.getName();
        if (name == null || name.isBlank()) {
            problems.add(at + ": name is required");
        } else if (name.length() > MAX_STEP_NAME_LENGTH) {
            problems.add(at + ": name longer than " + MAX_STEP_NAME_LENGTH + " characters");
        }

        ActionType action = step.getAction();
        if (action == null) {
            problems.add(at + ": action is required");
            return;
        }

        if (step.getPayloadCount() > 1) {
            problems.add(at + ": more than one action payload set");
        }
        if (!payloadFits(step, action)) {
            problems.add(at + ": payload does not match action '" + action.wireName() + "'");
        }

        switch (action) {
            case TAP, LONG_TAP -> {
                if (!step.hasSelector() && !step.hasTapCoordinates()) {
                    problems.add(at + ": " + action.wireName() + " needs a selector or tap coordinates");
                }
            }
            case SWIPE, SCROLL -> {
                SwipeData sd = step.getSwipeData();
                boolean hasTarget = step.hasSelector()
                        || (sd != null && (sd.hasCoordinates() || sd.getDirection() != null));
                if (!hasTarget) {
                    problems.add(at + ": " + action.wireName() + " needs a selector, coordinates or a direction");
                }
            }
            case INPUT_TEXT -> {
                if (step.getInputData() == null || step.getInputData().getText() == null) {
                    problems.add(at + ": input_text needs input_data with text");
                }
            }
            case WAIT -> {
                WaitData wd = step.getWaitData();
                if (wd != null && (wd.getDurationMs() < 0 || wd.getDurationMs() > WaitData.MAX_DURATION_MS)) {
                    problems.add(at + ": wait duration must be between 0 and " + WaitData.MAX_DURATION_MS + " ms");
                }
            }
            case COMPLETE -> { }
        }

        if (step.hasSelector()) {
            checkSelector(at, step.getSelector(), problems);
        }
    }

    private static boolean payloadFits(WorkflowStep step, ActionType action) {
        return switch (action) {
            case TAP, LONG_TAP -> step.getSwipeData() == null && step.getInputData() == null
                    && step.getWaitData() == null && step.getCompleteData() == null;
            case SWIPE, SCROLL -> step.getTapData() == null && step.getInputData() == null
                    && step.getWaitData() == null && step.getCompleteData() == null;
            case INPUT_TEXT -> step.getTapData() == null && step.getSwipeData() == null
                    && step.getWaitData() == null && step.getCompleteData() == null;
            case WAIT -> step.getTapData() == null && step.getSwipeData() == null
                    && step.getInputData() == null && step.getCompleteData() == null;
            case COMPLETE -> step.getTapData() == null && step.getSwipeData() == null
                    && step.getInputData() == null && step.getWaitData() == null;
        };
    }

    // ── Selector chains ───────────────────────────────────────────────────

    private static void checkSelector(String at, ElementSelector head, List<String> problems) {
        Set<ElementSelector> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int depth = 0;
        for (ElementSelector s = head; s != null; s = s.getFallback()) {
            if (!seen.add(s)) {
                problems.add(at + ": selector fallback chain contains a cycle");
                return;
            }
            if (s.getType() == null) {
                problems.add(at + ": selector at depth " + depth + " has no type");
            }
            if (s.getValue() == null || s.getValue().isEmpty()) {
                problems.add(at + ": selector at depth " + depth + " has no value");
            }
            depth++;
        }
        if (depth - 1 > ElementSelector.MAX_FALLBACK_DEPTH) {
            problems.add(at + ": selector fallback chain deeper than " + ElementSelector.MAX_FALLBACK_DEPTH);
        }
    }
}
