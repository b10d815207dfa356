package droidreplay.device;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element descriptor from the device's accessibility tree. Every
 * attribute is optional; the device omits what it does not know.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UiNode {

    @JsonProperty("index")
    private Integer index;

    @JsonProperty("resourceId")
    @JsonAlias({"resource-id", "resource_id"})
    private String resourceId;

    @JsonProperty("contentDescription")
    @JsonAlias({"content-desc", "content_desc"})
    private String contentDescription;

    @JsonProperty("text")
    private String text;

    @JsonProperty("className")
    @JsonAlias({"class", "class_name"})
    private String className;

    @JsonProperty("bounds")
    @JsonAlias("boundsInScreen")
    private String bounds;

    public UiNode() {}

    public UiNode(Integer index, String resourceId, String contentDescription,
                  String text, String className, String bounds) {
        this.index              = index;
        this.resourceId         = resourceId;
        this.contentDescription = contentDescription;
        this.text               = text;
        this.className          = className;
        this.bounds             = bounds;
    }

    public Integer getIndex()              { return index; }
    public String  getResourceId()         { return resourceId; }
    public String  getContentDescription() { return contentDescription; }
    public String  getText()               { return text; }
    public String  getClassName()          { return className; }
    public String  getBounds()             { return bounds; }

    public void setIndex(Integer index)                     { this.index = index; }
    public void setResourceId(String resourceId)            { this.resourceId = resourceId; }
    public void setContentDescription(String description)   { this.contentDescription = description; }
    public void setText(String text)                        { this.text = text; }
    public void setClassName(String className)              { this.className = className; }
    public void setBounds(String bounds)                    { this.bounds = bounds; }

    /** Parsed {@link #getBounds()}, or {@code null} when absent or malformed. */
    @JsonIgnore
    public Bounds getParsedBounds() {
        return Bounds.parse(bounds);
    }

    @Override
    public String toString() {
        return String.format("UiNode{index=%s, resourceId='%s', text='%s', bounds='%s'}",
                index, resourceId, text, bounds);
    }
}
