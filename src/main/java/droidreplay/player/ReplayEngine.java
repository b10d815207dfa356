package droidreplay.player;

import droidreplay.device.ActionResponse;
import droidreplay.device.DeviceClient;
import droidreplay.model.ActionType;
import droidreplay.model.Workflow;
import droidreplay.model.WorkflowStep;
import droidreplay.model.WorkflowValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Replays a {@link Workflow} against one device.
 *
 * <p>Typical use:
 * <pre>{@code
 * try (ReplayEngine engine = new ReplayEngine("127.0.0.1", 8080)) {
 *     engine.addProgressCallback(p -> System.out.println(p.getProgressPercent()));
 *     if (engine.connect()) {
 *         ReplayProgress result = engine.executeWorkflow(workflow);
 *     }
 * }
 * }</pre>
 *
 * <p>An engine drives one run at a time; an overlapping
 * {@link #executeWorkflow} call is rejected. {@link #pause()},
 * {@link #resume()} and {@link #cancel()} may be called from any thread and
 * take effect at the next step boundary; a step already dispatched runs to
 * completion, except that a {@code wait} step ends early on cancel. The
 * delay between steps ends early on pause or cancel.
 *
 * <p>Step failures never abort the run. The run fails as a whole only when
 * the device is not connected, the workflow is invalid, a {@code complete}
 * step says so, or the run thread is interrupted.
 */
public class ReplayEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ReplayEngine.class);

    private final ReplayConfig     config;
    private final SelectorResolver resolver = new SelectorResolver();
    private final ReplayControl    control  = new ReplayControl();
    private final AtomicBoolean    running  = new AtomicBoolean(false);
    /** Orders run start against pause/resume/cancel so a request is never lost to the reset. */
    private final Object           runLock  = new Object();
    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();

    private volatile DeviceClient   client;
    private volatile StepExecutor   executor;
    private volatile boolean        connected;
    private volatile String         connectionError;
    private volatile ReplayProgress currentProgress;

    public ReplayEngine(String host, int port) {
        this(host, port, new ReplayConfig());
    }

    public ReplayEngine(String host, int port, ReplayConfig config) {
        this(newClient(host, port, config), config);
    }

    /** For tests: drives the given client. */
    ReplayEngine(DeviceClient client, ReplayConfig config) {
        this.config   = Objects.requireNonNull(config, "config");
        this.client   = Objects.requireNonNull(client, "client");
        this.executor = new StepExecutor(client, resolver, config, control);
    }

    private static DeviceClient newClient(String host, int port, ReplayConfig config) {
        return new DeviceClient(host, port, config.getTimeoutSec(), config.getPingTimeoutSec(),
                config.getRequestAttempts(), config.getRetryDelayMs(), config.getApiKey());
    }

    // ── Connection ────────────────────────────────────────────────────────

    /**
     * Opens the transport and pings up to {@code device.connect.attempts}
     * times. On failure {@link #getConnectionError()} says why and a later
     * {@link #executeWorkflow} fails without running any step.
     */
    public boolean connect() {
        DeviceClient c = client;
        c.open();
        int attempts = config.getConnectAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (c.ping()) {
                connected       = true;
                connectionError = null;
                log.info("Connected to device at {}", c.getBaseUrl());
                return true;
            }
            log.warn("Device at {} did not answer ping (attempt {}/{})", c.getBaseUrl(), attempt, attempts);
            if (attempt < attempts) {
                try {
                    Thread.sleep(config.getConnectRetryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        connected       = false;
        connectionError = "Device at " + c.getBaseUrl() + " did not respond after " + attempts + " attempt(s)";
        log.error(connectionError);
        return false;
    }

    /** Switches to another device endpoint, dropping any current connection, then connects. */
    public boolean connect(String host, int port) {
        if (running.get()) {
            throw new IllegalStateException("Cannot reconnect while a replay is running");
        }
        disconnect();
        DeviceClient c = newClient(host, port, config);
        this.client   = c;
        this.executor = new StepExecutor(c, resolver, config, control);
        return connect();
    }

    /** Releases the transport. Safe to call repeatedly and without a prior connect. */
    public void disconnect() {
        if (connected) {
            log.info("Disconnecting from {}", client.getBaseUrl());
        }
        connected = false;
        client.close();
    }

    @Override
    public void close() {
        disconnect();
    }

    // ── Execution ─────────────────────────────────────────────────────────

    public ReplayProgress executeWorkflow(Workflow workflow) {
        return executeWorkflow(workflow, 0);
    }

    /**
     * Runs {@code workflow} from step index {@code startStep}. Blocks until
     * the run reaches a terminal status and returns the final progress.
     * Progress totals count only the steps from {@code startStep} on.
     *
     * @throws IllegalStateException if another run is in progress on this engine
     */
    public ReplayProgress executeWorkflow(Workflow workflow, int startStep) {
        Objects.requireNonNull(workflow, "workflow");
        synchronized (runLock) {
            if (!running.compareAndSet(false, true)) {
                throw new IllegalStateException("A replay is already running on this engine");
            }
            control.reset();
        }
        ReplayProgress progress = null;
        try {
            List<WorkflowStep> steps = workflow.getSteps() == null
                    ? List.of()
                    : Collections.unmodifiableList(new ArrayList<>(workflow.getSteps()));
            boolean startValid = startStep == 0 || (startStep > 0 && startStep < steps.size());
            progress = new ReplayProgress(workflow.getId(), workflow.getName(),
                    startValid ? steps.size() - startStep : steps.size());
            currentProgress = progress;

            if (!connected) {
                String reason = connectionError != null
                        ? connectionError
                        : "Not connected to device. Call connect() first.";
                return failBeforeStart(progress, reason);
            }
            List<String> problems = WorkflowValidator.problems(workflow);
            if (!problems.isEmpty()) {
                return failBeforeStart(progress, "Workflow validation failed: " + String.join("; ", problems));
            }
            if (!startValid) {
                return failBeforeStart(progress, "Start step " + startStep + " is out of range for "
                        + steps.size() + " step(s)");
            }

            log.info("Starting replay of '{}': {} step(s) from index {}",
                    workflow.getName(), steps.size() - startStep, startStep);
            progress.markStarted();
            notifyListeners(progress);
            runSteps(progress, steps, startStep);
            return progress;
        } catch (RuntimeException e) {
            log.error("Replay of '{}' aborted: {}", workflow.getName(), e.getMessage(), e);
            if (progress != null && !progress.isFinished()) {
                progress.finish(ReplayStatus.FAILED, "Unexpected error: " + e.getMessage());
                notifyListeners(progress);
            }
            if (progress == null) {
                throw e;
            }
            return progress;
        } finally {
            running.set(false);
        }
    }

    private void runSteps(ReplayProgress progress, List<WorkflowStep> steps, int startStep) {
        int total = steps.size();
        int index = startStep;
        try {
            for (; index < total; index++) {
                WorkflowStep step = steps.get(index);

                if (control.isCancelRequested()) {
                    finishCancelled(progress);
                    return;
                }
                if (control.isPauseRequested()) {
                    progress.setStatus(ReplayStatus.PAUSED);
                    log.info("Replay paused before step {}", index + 1);
                    notifyListeners(progress);
                    control.awaitResume(config.getPausePollMs());
                    progress.setStatus(ReplayStatus.RUNNING);
                    log.info("Replay resumed");
                    notifyListeners(progress);
                }
                if (control.isCancelRequested()) {
                    finishCancelled(progress);
                    return;
                }

                progress.setCurrentStep(step.getId(), step.getName());
                log.info("Step {}/{}: {} '{}'", index + 1, total, step.getAction(), step.getName());
                StepExecutionResult result = executor.execute(step);
                progress.recordResult(result);
                if (result.getResult() == StepResult.FAILED) {
                    log.warn("Step {} '{}' failed: {}", index + 1, step.getName(), result.getMessage());
                }
                notifyListeners(progress);

                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException();
                }
                if (step.getAction() == ActionType.COMPLETE) {
                    boolean ok = result.isSuccess();
                    log.info("Complete step reached: {}", result.getMessage());
                    progress.finish(ok ? ReplayStatus.COMPLETED : ReplayStatus.FAILED,
                            ok ? null : result.getMessage());
                    notifyListeners(progress);
                    return;
                }
                long delay = config.getStepDelayMs();
                if (index < total - 1 && delay > 0) {
                    control.idle(delay);
                }
            }
            if (control.isCancelRequested()) {
                finishCancelled(progress);
                return;
            }
            progress.finish(ReplayStatus.COMPLETED, null);
            log.info("Replay completed: {} succeeded, {} failed",
                    progress.getSuccessCount(), progress.getFailedCount());
            notifyListeners(progress);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String reason = "Replay interrupted at step " + (index + 1);
            log.error(reason);
            progress.finish(ReplayStatus.FAILED, reason);
            notifyListeners(progress);
        }
    }

    /** Runs one step outside any workflow; no progress is kept. */
    public StepExecutionResult executeSingleStep(WorkflowStep step) {
        Objects.requireNonNull(step, "step");
        if (!connected) {
            return StepExecutionResult.failed(step.getId(), step.getName(),
                    "Not connected to device", 0L, null, false, null);
        }
        return executor.execute(step);
    }

    private ReplayProgress failBeforeStart(ReplayProgress progress, String reason) {
        log.error("Replay not started: {}", reason);
        progress.finish(ReplayStatus.FAILED, reason);
        notifyListeners(progress);
        return progress;
    }

    private void finishCancelled(ReplayProgress progress) {
        log.info("Replay cancelled after {} of {} step(s)", progress.getCompletedSteps(), progress.getTotalSteps());
        progress.finish(ReplayStatus.CANCELLED, null);
        notifyListeners(progress);
    }

    // ── Control ───────────────────────────────────────────────────────────

    public void pause() {
        synchronized (runLock) {
            if (!running.get()) {
                log.debug("pause() ignored: no replay running");
                return;
            }
            control.requestPause();
        }
    }

    public void resume() {
        synchronized (runLock) {
            if (!running.get()) {
                log.debug("resume() ignored: no replay running");
                return;
            }
            control.requestResume();
        }
    }

    public void cancel() {
        synchronized (runLock) {
            if (!running.get()) {
                log.debug("cancel() ignored: no replay running");
                return;
            }
            log.info("Cancellation requested");
            control.requestCancel();
        }
    }

    // ── Callbacks ─────────────────────────────────────────────────────────

    public void addProgressCallback(ProgressListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeProgressCallback(ProgressListener listener) {
        return listeners.remove(listener);
    }

    private void notifyListeners(ReplayProgress progress) {
        for (ProgressListener l : listeners) {
            try {
                l.onProgress(progress);
            } catch (RuntimeException e) {
                log.error("Progress callback failed: {}", e.getMessage(), e);
            }
        }
    }

    // ── Misc ──────────────────────────────────────────────────────────────

    /** Sends a system navigation action such as {@code back} or {@code home}. */
    public ActionResponse performGlobalAction(String action) {
        if (!connected) {
            return ActionResponse.failure("Not connected to device");
        }
        return client.globalAction(action);
    }

    public boolean        isConnected()        { return connected; }
    public boolean        isRunning()          { return running.get(); }
    public ReplayProgress getCurrentProgress() { return currentProgress; }
    public String         getConnectionError() { return connectionError; }
    public ReplayConfig   getConfig()          { return config; }
}
