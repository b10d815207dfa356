package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload for {@code input_text} steps. The text goes to whichever element
 * holds focus on the device; an empty string is allowed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InputTextData {

    @JsonProperty("text")
    private String text;

    public InputTextData() {}

    public InputTextData(String text) {
        this.text = text;
    }

    public String getText()          { return text; }
    public void   setText(String t)  { this.text = t; }
}
