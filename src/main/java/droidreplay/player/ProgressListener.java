package droidreplay.player;

/**
 * Observer of a replay run. Invoked synchronously on the run thread, so
 * implementations should return quickly. Exceptions thrown here are logged
 * and do not affect the run.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(ReplayProgress progress);
}
