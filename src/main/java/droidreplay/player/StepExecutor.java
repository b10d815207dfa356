package droidreplay.player;

import droidreplay.device.ActionResponse;
import droidreplay.device.Bounds;
import droidreplay.device.DeviceClient;
import droidreplay.device.DeviceState;
import droidreplay.device.DeviceTransportException;
import droidreplay.device.UiNode;
import droidreplay.model.ActionType;
import droidreplay.model.CompleteData;
import droidreplay.model.ElementSelector;
import droidreplay.model.SwipeData;
import droidreplay.model.SwipeDirection;
import droidreplay.model.TapData;
import droidreplay.model.WaitData;
import droidreplay.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns one {@link WorkflowStep} into device calls and reports the outcome.
 *
 * <p>Tap, long tap, swipe and scroll try the selector chain first and fall
 * back to the literal coordinates in the step payload when the chain finds
 * nothing. A failed state fetch counts as a miss. When coordinates stand in
 * for a selector the result is marked {@code fallbackUsed}.
 *
 * <p>{@link #execute} never throws: transport failures, misses and
 * unexpected runtime errors all become a failed {@link StepExecutionResult}.
 */
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    private final DeviceClient     client;
    private final SelectorResolver resolver;
    private final ReplayConfig     config;
    private final ReplayControl    control;

    StepExecutor(DeviceClient client, SelectorResolver resolver, ReplayConfig config, ReplayControl control) {
        this.client   = client;
        this.resolver = resolver;
        this.config   = config;
        this.control  = control;
    }

    public StepExecutionResult execute(WorkflowStep step) {
        Objects.requireNonNull(step, "step");
        long start = System.nanoTime();
        ActionType action = step.getAction();
        log.debug("Executing step '{}' ({})", step.getName(), action);
        try {
            if (action == null) {
                return StepExecutionResult.failed(step.getId(), step.getName(), "Step has no action",
                        elapsed(start), null, false, null);
            }
            return switch (action) {
                case TAP        -> executeTap(step, false, start);
                case LONG_TAP   -> executeTap(step, true, start);
                case SWIPE, SCROLL -> executeSwipe(step, start);
                case INPUT_TEXT -> executeInput(step, start);
                case WAIT       -> executeWait(step, start);
                case COMPLETE   -> executeComplete(step, start);
            };
        } catch (RuntimeException e) {
            log.error("Unexpected error in step '{}': {}", step.getName(), e.getMessage(), e);
            return StepExecutionResult.failed(step.getId(), step.getName(),
                    "Unexpected error: " + e.getMessage(), elapsed(start), null, false, e.toString());
        }
    }

    // ── Tap / long tap ────────────────────────────────────────────────────

    private StepExecutionResult executeTap(WorkflowStep step, boolean longPress, long start) {
        Lookup lookup = lookup(step.getSelector());
        TapData td = step.getTapData();
        int duration = longPressDuration(td);

        if (lookup.resolution().found()) {
            SelectorResolver.Resolution res = lookup.resolution();
            UiNode node = res.node();
            Bounds b = node.getParsedBounds();
            ActionResponse resp;
            if (b != null) {
                resp = longPress
                        ? client.longPress(b.centerX(), b.centerY(), duration)
                        : client.tap(b.centerX(), b.centerY());
            } else if (node.getIndex() != null) {
                Map<String, Object> p = new LinkedHashMap<>();
                p.put("index", node.getIndex());
                resp = client.dispatchAction(longPress ? "longclick" : "click", p);
            } else {
                return StepExecutionResult.failed(step.getId(), step.getName(),
                        "Matched element has neither bounds nor index", elapsed(start),
                        res.selectorUsed(), res.fallbackUsed(), null);
            }
            return fromResponse(step, resp, start, res.selectorUsed(), res.fallbackUsed());
        }

        if (td != null && td.hasCoordinates()) {
            if (step.hasSelector()) {
                log.warn("Step '{}': {}, using coordinates ({},{})",
                        step.getName(), lookup.missReason(step.getSelector()), td.getX(), td.getY());
            }
            ActionResponse resp = longPress
                    ? client.longPress(td.getX(), td.getY(), duration)
                    : client.tap(td.getX(), td.getY());
            return fromResponse(step, resp, start,
                    "coordinates(" + td.getX() + "," + td.getY() + ")", step.hasSelector());
        }

        String msg = step.hasSelector()
                ? lookup.missReason(step.getSelector())
                : "No selector or coordinates to " + (longPress ? "long tap" : "tap");
        return StepExecutionResult.failed(step.getId(), step.getName(), msg, elapsed(start),
                null, lookup.resolution().fallbackUsed(), null);
    }

    private int longPressDuration(TapData td) {
        if (td != null && td.getDurationMs() != TapData.DEFAULT_DURATION_MS && td.getDurationMs() > 0) {
            return td.getDurationMs();
        }
        return config.getLongPressMs();
    }

    // ── Swipe / scroll ────────────────────────────────────────────────────

    private StepExecutionResult executeSwipe(WorkflowStep step, long start) {
        SwipeData sd = step.getSwipeData();
        SwipeDirection direction = sd != null && sd.getDirection() != null ? sd.getDirection() : SwipeDirection.UP;
        int duration = sd != null ? sd.getDurationMs() : SwipeData.DEFAULT_DURATION_MS;

        Lookup lookup = lookup(step.getSelector());
        if (lookup.resolution().found()) {
            Bounds b = lookup.resolution().node().getParsedBounds();
            if (b != null) {
                int[] g = gesture(b.centerX(), b.centerY(), direction);
                ActionResponse resp = client.swipe(g[0], g[1], g[2], g[3], duration);
                return fromResponse(step, resp, start,
                        lookup.resolution().selectorUsed(), lookup.resolution().fallbackUsed());
            }
            log.warn("Step '{}': matched element has no usable bounds", step.getName());
        } else if (step.hasSelector()) {
            log.warn("Step '{}': {}", step.getName(), lookup.missReason(step.getSelector()));
        }

        if (sd != null && sd.hasCoordinates()) {
            ActionResponse resp = client.swipe(sd.getStartX(), sd.getStartY(), sd.getEndX(), sd.getEndY(), duration);
            String label = "coordinates(" + sd.getStartX() + "," + sd.getStartY() + ","
                    + sd.getEndX() + "," + sd.getEndY() + ")";
            return fromResponse(step, resp, start, label, step.hasSelector());
        }
        if (sd != null && sd.getDirection() != null) {
            int[] g = gesture(config.getScreenCenterX(), config.getScreenCenterY(), direction);
            ActionResponse resp = client.swipe(g[0], g[1], g[2], g[3], duration);
            return fromResponse(step, resp, start,
                    "direction:" + direction.wireName(), step.hasSelector());
        }

        String msg = step.hasSelector()
                ? lookup.missReason(step.getSelector())
                : "No selector, coordinates or direction to " + step.getAction().wireName();
        return StepExecutionResult.failed(step.getId(), step.getName(), msg, elapsed(start),
                null, lookup.resolution().fallbackUsed(), null);
    }

    /** Start and end points of a gesture of the configured length centred on (cx, cy). */
    private int[] gesture(int cx, int cy, SwipeDirection direction) {
        int half = Math.max(1, config.getSwipeDistance() / 2);
        return switch (direction) {
            case UP    -> new int[] {cx, cy + half, cx, Math.max(0, cy - half)};
            case DOWN  -> new int[] {cx, Math.max(0, cy - half), cx, cy + half};
            case LEFT  -> new int[] {cx + half, cy, Math.max(0, cx - half), cy};
            case RIGHT -> new int[] {Math.max(0, cx - half), cy, cx + half, cy};
        };
    }

    // ── Input / wait / complete ───────────────────────────────────────────

    private StepExecutionResult executeInput(WorkflowStep step, long start) {
        if (step.getInputData() == null || step.getInputData().getText() == null) {
            return StepExecutionResult.failed(step.getId(), step.getName(), "No text to input",
                    elapsed(start), null, false, null);
        }
        ActionResponse resp = client.inputText(step.getInputData().getText());
        return fromResponse(step, resp, start, null, false);
    }

    private StepExecutionResult executeWait(WorkflowStep step, long start) {
        WaitData wd = step.getWaitData();
        long ms = wd != null ? wd.getDurationMs() : WaitData.DEFAULT_DURATION_MS;
        try {
            long slept = control.sleep(ms);
            if (slept < ms && control.isCancelRequested()) {
                return StepExecutionResult.skipped(step.getId(), step.getName(),
                        "Wait interrupted by cancellation after " + slept + "ms", elapsed(start));
            }
            return StepExecutionResult.success(step.getId(), step.getName(),
                    "Waited " + ms + "ms", elapsed(start), null, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepExecutionResult.failed(step.getId(), step.getName(), "Interrupted during wait",
                    elapsed(start), null, false, null);
        }
    }

    private StepExecutionResult executeComplete(WorkflowStep step, long start) {
        CompleteData cd = step.getCompleteData() != null ? step.getCompleteData() : new CompleteData();
        if (cd.isSuccess()) {
            String msg = cd.getMessage() != null ? cd.getMessage() : "Workflow completed";
            return StepExecutionResult.success(step.getId(), step.getName(), msg, elapsed(start), null, false);
        }
        String msg = cd.getMessage() != null ? cd.getMessage() : "Workflow marked as failed";
        return StepExecutionResult.failed(step.getId(), step.getName(), msg, elapsed(start), null, false, msg);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Snapshot lookup for a selector chain; a fetch failure is kept as the miss reason. */
    private record Lookup(SelectorResolver.Resolution resolution, String fetchError) {

        String missReason(ElementSelector selector) {
            String base = "Element not found: " + selector.describe();
            return fetchError != null ? base + " (state fetch failed: " + fetchError + ")" : base;
        }
    }

    private Lookup lookup(ElementSelector selector) {
        if (selector == null) {
            return new Lookup(SelectorResolver.Resolution.miss(false), null);
        }
        try {
            DeviceState state = client.fetchState();
            return new Lookup(resolver.resolve(state, selector), null);
        } catch (DeviceTransportException e) {
            log.warn("State fetch failed while resolving {}: {}", selector.describe(), e.getMessage());
            return new Lookup(SelectorResolver.Resolution.miss(false), e.getMessage());
        }
    }

    private static StepExecutionResult fromResponse(WorkflowStep step, ActionResponse resp, long start,
                                                    String selectorUsed, boolean fallbackUsed) {
        if (resp.success()) {
            return StepExecutionResult.success(step.getId(), step.getName(), resp.message(),
                    elapsed(start), selectorUsed, fallbackUsed);
        }
        String msg = String.format(Locale.ROOT, "%s failed: %s", step.getAction().wireName(), resp.message());
        return StepExecutionResult.failed(step.getId(), step.getName(), msg, elapsed(start),
                selectorUsed, fallbackUsed, resp.message());
    }

    private static long elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
