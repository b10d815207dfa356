package droidreplay.device;

/**
 * A device HTTP call failed: the network call itself, a non-success
 * response, or a payload that could not be parsed.
 */
public class DeviceTransportException extends Exception {

    public DeviceTransportException(String message) {
        super(message);
    }

    public DeviceTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
