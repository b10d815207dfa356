package droidreplay.player;

/**
 * Unchecked exception for replay problems that are not step outcomes, such
 * as a missing base configuration or a misused engine.
 */
public class ReplayException extends RuntimeException {

    public ReplayException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
