package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload for the terminal {@code complete} step. Its outcome becomes the
 * outcome of the whole run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompleteData {

    @JsonProperty("success")
    private boolean success = true;

    @JsonProperty("message")
    private String message;

    public CompleteData() {}

    public CompleteData(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public boolean isSuccess()  { return success; }
    public String  getMessage() { return message; }

    public void setSuccess(boolean success)  { this.success = success; }
    public void setMessage(String message)   { this.message = message; }
}
