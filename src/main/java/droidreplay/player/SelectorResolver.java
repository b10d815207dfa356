package droidreplay.player;

import droidreplay.device.DeviceState;
import droidreplay.device.UiNode;
import droidreplay.model.ElementSelector;
import droidreplay.model.SelectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Finds the node a selector chain points at in one accessibility snapshot.
 *
 * <p>Links are tried in chain order; for each link nodes are scanned in
 * snapshot order and the first match wins. Identifiers, descriptions and
 * text match by case-sensitive substring, bounds by exact string equality.
 * Results are deterministic for a fixed snapshot.
 */
public class SelectorResolver {

    private static final Logger log = LoggerFactory.getLogger(SelectorResolver.class);

    /**
     * Outcome of {@link #resolve}. {@code node} is null on a miss;
     * {@code selectorUsed} then is null as well.
     */
    public record Resolution(UiNode node, ElementSelector matchedBy, String selectorUsed, boolean fallbackUsed) {

        public boolean found() { return node != null; }

        static Resolution miss(boolean fallbackUsed) {
            return new Resolution(null, null, null, fallbackUsed);
        }
    }

    // ── Matching ──────────────────────────────────────────────────────────

    /** True if {@code node} satisfies this single link, ignoring its fallback. */
    public boolean matches(UiNode node, ElementSelector selector) {
        if (node == null || selector == null || selector.getType() == null) {
            return false;
        }
        String value = selector.getValue();
        if (value == null || value.isEmpty()) {
            return false;
        }
        SelectorType type = selector.getType();
        return switch (type) {
            case RESOURCE_ID  -> contains(node.getResourceId(), value);
            case CONTENT_DESC -> contains(node.getContentDescription(), value);
            case TEXT         -> contains(node.getText(), value);
            case BOUNDS       -> value.equals(node.getBounds());
            case XPATH        -> {
                String cls = node.getClassName();
                yield cls != null && !cls.isEmpty() && value.contains(cls);
            }
        };
    }

    private static boolean contains(String attribute, String value) {
        return attribute != null && attribute.contains(value);
    }

    // ── Resolution ────────────────────────────────────────────────────────

    public Resolution resolve(DeviceState state, ElementSelector selector) {
        return resolve(state != null ? state.nodes() : List.of(), selector);
    }

    /**
     * Walks the chain until a link matches, at most
     * {@link ElementSelector#MAX_FALLBACK_DEPTH} links past the primary.
     * A chain that loops stops at the first repeated link.
     */
    public Resolution resolve(List<UiNode> nodes, ElementSelector selector) {
        if (selector == null) {
            return Resolution.miss(false);
        }
        List<UiNode> snapshot = nodes != null ? nodes : List.of();
        Set<ElementSelector> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        ElementSelector link = selector;
        int depth = 0;
        while (link != null && depth <= ElementSelector.MAX_FALLBACK_DEPTH) {
            if (!visited.add(link)) {
                log.warn("Selector chain loops back at {}, stopping", link.describe());
                break;
            }
            for (UiNode node : snapshot) {
                if (matches(node, link)) {
                    if (depth > 0) {
                        log.info("Primary selector {} missed, matched fallback {}",
                                selector.describe(), link.describe());
                    }
                    return new Resolution(node, link, link.describe(), depth > 0);
                }
            }
            link = link.getFallback();
            depth++;
        }
        log.debug("No node matched selector chain starting at {}", selector.describe());
        return Resolution.miss(depth > 1);
    }
}
