package droidreplay.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;

/**
 * One accessibility snapshot: the nodes in document order plus the device's
 * phone state, kept as raw JSON since replay never interprets it.
 */
public record DeviceState(List<UiNode> nodes, JsonNode phoneState) {

    public DeviceState {
        nodes      = nodes == null ? List.of() : List.copyOf(nodes);
        phoneState = phoneState == null ? NullNode.getInstance() : phoneState;
    }

    public static DeviceState of(List<UiNode> nodes) {
        return new DeviceState(nodes, null);
    }
}
