package droidreplay.player;

/**
 * Pause and cancel flags shared between the run thread and callers.
 *
 * <p>The run thread blocks in {@link #awaitResume} while paused, in
 * {@link #sleep} during wait steps and in {@link #idle} between steps.
 * {@link #requestCancel} wakes all three; {@link #requestPause} wakes
 * {@link #idle} and {@link #requestResume} wakes {@link #awaitResume}.
 */
final class ReplayControl {

    private boolean pauseRequested;
    private boolean cancelRequested;

    synchronized void reset() {
        pauseRequested  = false;
        cancelRequested = false;
    }

    synchronized void requestPause() {
        pauseRequested = true;
        notifyAll();
    }

    synchronized void requestResume() {
        pauseRequested = false;
        notifyAll();
    }

    synchronized void requestCancel() {
        cancelRequested = true;
        notifyAll();
    }

    synchronized boolean isPauseRequested()  { return pauseRequested; }
    synchronized boolean isCancelRequested() { return cancelRequested; }

    /**
     * Blocks while a pause is requested and no cancel is. Wakes on
     * resume or cancel; {@code pollMs} bounds each wait.
     */
    synchronized void awaitResume(long pollMs) throws InterruptedException {
        while (pauseRequested && !cancelRequested) {
            wait(pollMs);
        }
    }

    /**
     * Sleeps up to {@code ms}, returning early on cancel.
     *
     * @return milliseconds actually slept
     */
    synchronized long sleep(long ms) throws InterruptedException {
        return sleepUntil(ms, false);
    }

    /**
     * Inter-step delay: sleeps up to {@code ms}, returning early on cancel
     * or pause so the run reaches its next boundary without delay.
     *
     * @return milliseconds actually slept
     */
    synchronized long idle(long ms) throws InterruptedException {
        return sleepUntil(ms, true);
    }

    private long sleepUntil(long ms, boolean wakeOnPause) throws InterruptedException {
        long start    = System.nanoTime();
        long deadline = start + ms * 1_000_000L;
        while (!cancelRequested && !(wakeOnPause && pauseRequested)) {
            long remaining = (deadline - System.nanoTime()) / 1_000_000L;
            if (remaining <= 0) {
                break;
            }
            wait(remaining);
        }
        return (System.nanoTime() - start) / 1_000_000L;
    }
}
