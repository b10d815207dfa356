package droidreplay.cli;

import droidreplay.device.DeviceClient;
import droidreplay.model.Workflow;
import droidreplay.model.WorkflowIO;
import droidreplay.model.WorkflowStep;
import droidreplay.model.WorkflowValidationException;
import droidreplay.player.ReplayConfig;
import droidreplay.player.ReplayEngine;
import droidreplay.player.ReplayProgress;
import droidreplay.player.ReplayStatus;
import droidreplay.player.StepExecutionResult;
import droidreplay.player.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 *
 * <p>Sub-commands:
 * <ul>
 *   <li>{@code droidreplay play}     replay a workflow file on a device</li>
 *   <li>{@code droidreplay step}     run a single step of a workflow</li>
 *   <li>{@code droidreplay ping}     check that a device answers</li>
 *   <li>{@code droidreplay validate} check a workflow file without a device</li>
 * </ul>
 *
 * <p>Exit codes: 0 success, 1 missing or invalid workflow file, 2 failed or
 * cancelled run or unreachable device.
 */
@Command(
        name        = "droidreplay",
        description = "Replay recorded UI workflows on an Android device",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = {
                ReplayCLI.PlayCommand.class,
                ReplayCLI.StepCommand.class,
                ReplayCLI.PingCommand.class,
                ReplayCLI.ValidateCommand.class
        }
)
public class ReplayCLI implements Callable<Integer> {

    static final int EXIT_OK           = 0;
    static final int EXIT_BAD_INPUT    = 1;
    static final int EXIT_RUN_FAILED   = 2;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new ReplayCLI()).execute(args);
        System.exit(exit);
    }

    // ── Shared options ──────────────────────────────────────────────────────

    static class DeviceOptions {

        @Option(names = {"-H", "--host"}, description = "Device host (default: 127.0.0.1)",
                defaultValue = "127.0.0.1")
        String host;

        @Option(names = {"-p", "--port"}, description = "Device port (default: 8080)",
                defaultValue = "8080")
        int port;
    }

    /** Loads and validates a workflow, printing the reason and returning null on failure. */
    static Workflow loadWorkflow(Path file) {
        if (!Files.exists(file)) {
            System.err.println("Workflow file not found: " + file.toAbsolutePath());
            return null;
        }
        try {
            return WorkflowIO.read(file);
        } catch (WorkflowValidationException e) {
            System.err.println("Invalid workflow:");
            e.getProblems().forEach(p -> System.err.println("  - " + p));
        } catch (WorkflowIO.SchemaValidationException e) {
            System.err.println(e.getMessage());
        } catch (IOException e) {
            System.err.println("Cannot read workflow " + file + ": " + e.getMessage());
        }
        return null;
    }

    static void printResult(int index, StepExecutionResult r) {
        String mark = r.getResult() == StepResult.SUCCESS ? "OK  "
                : r.getResult() == StepResult.SKIPPED ? "SKIP" : "FAIL";
        System.out.printf("  [%s] %2d. %s  %s%s (%dms)%n", mark, index, r.getStepName(), r.getMessage(),
                r.getSelectorUsed() != null ? "  via " + r.getSelectorUsed() : "", r.getDurationMs());
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    @Command(name = "play", description = "Replay a workflow file on a device", mixinStandardHelpOptions = true)
    static class PlayCommand implements Callable<Integer> {

        private static final Logger log = LoggerFactory.getLogger(PlayCommand.class);

        @Parameters(index = "0", description = "Path to workflow JSON file")
        Path workflowFile;

        @CommandLine.Mixin
        DeviceOptions device;

        @Option(names = {"-s", "--start-step"}, description = "Index of the first step to run (default: 0)",
                defaultValue = "0")
        int startStep;

        @Option(names = "--json", description = "Print the final progress as JSON")
        boolean json;

        /** Cancels the run on Ctrl-C; registered only while the engine is open. */
        Thread cancelHook;

        @Override
        public Integer call() throws Exception {
            Workflow workflow = loadWorkflow(workflowFile);
            if (workflow == null) {
                return EXIT_BAD_INPUT;
            }
            System.out.printf("Workflow : %s (%d steps)%n", workflow.getName(), workflow.getStepCount());
            System.out.printf("Device   : %s:%d%n", device.host, device.port);

            try (ReplayEngine engine = new ReplayEngine(device.host, device.port, new ReplayConfig())) {
                cancelHook = new Thread(engine::cancel, "droidreplay-cancel");
                Runtime.getRuntime().addShutdownHook(cancelHook);
                try {
                    return run(engine, workflow);
                } finally {
                    try {
                        Runtime.getRuntime().removeShutdownHook(cancelHook);
                    } catch (IllegalStateException e) {
                        log.debug("JVM already shutting down: {}", e.getMessage());
                    }
                }
            }
        }

        private int run(ReplayEngine engine, Workflow workflow) throws IOException {
            int[] printed = {0};
            engine.addProgressCallback(p -> {
                List<StepExecutionResult> results = p.getStepResults();
                while (printed[0] < results.size()) {
                    printResult(startStep + printed[0] + 1, results.get(printed[0]));
                    printed[0]++;
                }
            });

            if (!engine.connect()) {
                System.err.println("Cannot connect: " + engine.getConnectionError());
                return EXIT_RUN_FAILED;
            }
            ReplayProgress progress = engine.executeWorkflow(workflow, startStep);

            System.out.printf("%nReplay %s: %d succeeded, %d failed, %d/%d steps%n",
                    progress.getStatus().wireName(), progress.getSuccessCount(), progress.getFailedCount(),
                    progress.getCompletedSteps(), progress.getTotalSteps());
            if (progress.getError() != null) {
                System.err.println("Error: " + progress.getError());
            }
            if (json) {
                System.out.println(WorkflowIO.toJson(progress));
            }
            return progress.getStatus() == ReplayStatus.COMPLETED ? EXIT_OK : EXIT_RUN_FAILED;
        }
    }

    @Command(name = "step", description = "Run one step of a workflow", mixinStandardHelpOptions = true)
    static class StepCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to workflow JSON file")
        Path workflowFile;

        @Option(names = "--step-id", required = true, description = "Id of the step to run")
        String stepId;

        @CommandLine.Mixin
        DeviceOptions device;

        @Override
        public Integer call() {
            Workflow workflow = loadWorkflow(workflowFile);
            if (workflow == null) {
                return EXIT_BAD_INPUT;
            }
            WorkflowStep step = workflow.getStepById(stepId);
            if (step == null) {
                System.err.println("No step with id '" + stepId + "' in " + workflowFile);
                return EXIT_BAD_INPUT;
            }
            try (ReplayEngine engine = new ReplayEngine(device.host, device.port, new ReplayConfig())) {
                if (!engine.connect()) {
                    System.err.println("Cannot connect: " + engine.getConnectionError());
                    return EXIT_RUN_FAILED;
                }
                StepExecutionResult result = engine.executeSingleStep(step);
                printResult(workflow.getSteps().indexOf(step) + 1, result);
                return result.getResult() == StepResult.FAILED ? EXIT_RUN_FAILED : EXIT_OK;
            }
        }
    }

    @Command(name = "ping", description = "Check that a device answers", mixinStandardHelpOptions = true)
    static class PingCommand implements Callable<Integer> {

        @CommandLine.Mixin
        DeviceOptions device;

        @Override
        public Integer call() {
            ReplayConfig config = new ReplayConfig();
            try (DeviceClient client = new DeviceClient(device.host, device.port, config.getTimeoutSec(),
                    config.getPingTimeoutSec(), 1, 0L, config.getApiKey())) {
                client.open();
                boolean alive = client.ping();
                System.out.printf("%s %s%n", client.getBaseUrl(), alive ? "is alive" : "did not answer");
                return alive ? EXIT_OK : EXIT_RUN_FAILED;
            }
        }
    }

    @Command(name = "validate", description = "Check a workflow file", mixinStandardHelpOptions = true)
    static class ValidateCommand implements Callable<Integer> {

        @Parameters(index = "0", description = "Path to workflow JSON file")
        Path workflowFile;

        @Override
        public Integer call() {
            Workflow workflow = loadWorkflow(workflowFile);
            if (workflow == null) {
                return EXIT_BAD_INPUT;
            }
            System.out.printf("%s: valid, %d step(s)%n", workflow.getName(), workflow.getStepCount());
            return EXIT_OK;
        }
    }
}
