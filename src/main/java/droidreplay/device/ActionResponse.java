package droidreplay.device;

/** Outcome of one action dispatch as reported by the device. */
public record ActionResponse(boolean success, String message) {

    public static ActionResponse success(String message) {
        return new ActionResponse(true, message);
    }

    public static ActionResponse failure(String message) {
        return new ActionResponse(false, message);
    }
}
