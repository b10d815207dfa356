package droidreplay.player;

import droidreplay.device.DeviceState;
import droidreplay.device.UiNode;
import droidreplay.model.ElementSelector;
import droidreplay.model.SelectorType;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SelectorResolverTest {

    private final SelectorResolver resolver = new SelectorResolver();

    private static UiNode node(String resourceId, String desc, String text, String cls, String bounds) {
        return new UiNode(null, resourceId, desc, text, cls, bounds);
    }

    // ── matches ───────────────────────────────────────────────────────────

    @Test
    public void resourceId_matchesBySubstring() {
        UiNode n = node("com.app:id/button", null, null, null, null);

        assertThat(resolver.matches(n, ElementSelector.byResourceId("button"))).isTrue();
        assertThat(resolver.matches(n, ElementSelector.byResourceId("com.app:id/button"))).isTrue();
        assertThat(resolver.matches(n, ElementSelector.byResourceId("id/buttons"))).isFalse();
    }

    @Test
    public void bounds_matchExactlyOnly() {
        UiNode n = node(null, null, null, null, "[100,200][300,400]");

        assertThat(resolver.matches(n, ElementSelector.byBounds("[100,200][300,400]"))).isTrue();
        assertThat(resolver.matches(n, ElementSelector.byBounds("[100,200][300,401]"))).isFalse();
        assertThat(resolver.matches(n, ElementSelector.byBounds("[100,200]"))).isFalse();
    }

    @Test
    public void textAndDescription_areCaseSensitive() {
        UiNode n = node(null, "Submit form", "Login", null, null);

        assertThat(resolver.matches(n, ElementSelector.byText("Log"))).isTrue();
        assertThat(resolver.matches(n, ElementSelector.byText("login"))).isFalse();
        assertThat(resolver.matches(n, ElementSelector.byContentDescription("Submit"))).isTrue();
        assertThat(resolver.matches(n, ElementSelector.byContentDescription("submit"))).isFalse();
    }

    @Test
    public void xpath_matchesOnClassName() {
        ElementSelector xpath = new ElementSelector(SelectorType.XPATH, "//android.widget.Button[@text='OK']");

        assertThat(resolver.matches(node(null, null, null, "android.widget.Button", null), xpath)).isTrue();
        assertThat(resolver.matches(node(null, null, null, "android.widget.EditText", null), xpath)).isFalse();
        assertThat(resolver.matches(node(null, null, null, "", null), xpath)).isFalse();
    }

    @Test
    public void missingAttribute_neverMatches() {
        assertThat(resolver.matches(node(null, null, null, null, null), ElementSelector.byText("a"))).isFalse();
    }

    // ── resolve ───────────────────────────────────────────────────────────

    @Test
    public void primaryHit_reportsNoFallback() {
        UiNode target = node("com.app:id/username", null, null, null, "[0,0][10,10]");
        DeviceState state = DeviceState.of(List.of(node("other", null, null, null, null), target));

        SelectorResolver.Resolution r = resolver.resolve(state, ElementSelector.byResourceId("username"));

        assertThat(r.found()).isTrue();
        assertThat(r.node()).isSameAs(target);
        assertThat(r.selectorUsed()).isEqualTo("resource-id:username");
        assertThat(r.fallbackUsed()).isFalse();
    }

    @Test
    public void firstMatchInSnapshotOrderWins() {
        UiNode first = node(null, null, "OK", null, null);
        UiNode second = node(null, null, "OK", null, null);

        SelectorResolver.Resolution r = resolver.resolve(List.of(first, second), ElementSelector.byText("OK"));

        assertThat(r.node()).isSameAs(first);
    }

    @Test
    public void kthFallbackHit_reportsThatLink() {
        UiNode target = node(null, null, null, null, "[1,1][2,2]");
        ElementSelector third = ElementSelector.byBounds("[1,1][2,2]");
        ElementSelector chain = ElementSelector.byResourceId("nope")
                .orElse(ElementSelector.byText("nothing").orElse(third));

        SelectorResolver.Resolution r = resolver.resolve(List.of(node("x", null, "y", null, null), target), chain);

        assertThat(r.node()).isSameAs(target);
        assertThat(r.matchedBy()).isSameAs(third);
        assertThat(r.selectorUsed()).isEqualTo("bounds:[1,1][2,2]");
        assertThat(r.fallbackUsed()).isTrue();
    }

    @Test
    public void missWithoutFallback_isPlainMiss() {
        SelectorResolver.Resolution r = resolver.resolve(
                List.of(node("a", null, null, null, null)), ElementSelector.byResourceId("b"));

        assertThat(r.found()).isFalse();
        assertThat(r.selectorUsed()).isNull();
        assertThat(r.fallbackUsed()).isFalse();
    }

    @Test
    public void exhaustedChain_reportsFallbackTried() {
        ElementSelector chain = ElementSelector.byResourceId("b").orElse(ElementSelector.byText("c"));

        SelectorResolver.Resolution r = resolver.resolve(List.of(node("a", null, null, null, null)), chain);

        assertThat(r.found()).isFalse();
        assertThat(r.fallbackUsed()).isTrue();
    }

    @Test
    public void cyclicChain_terminates() {
        ElementSelector a = ElementSelector.byText("a");
        ElementSelector b = ElementSelector.byText("b");
        a.setFallback(b);
        b.setFallback(a);

        SelectorResolver.Resolution r = resolver.resolve(List.of(node(null, null, "z", null, null)), a);

        assertThat(r.found()).isFalse();
    }

    @Test
    public void linksBeyondMaxDepth_areNotTried() {
        ElementSelector head = ElementSelector.byText("t0");
        ElementSelector tail = head;
        for (int i = 1; i <= ElementSelector.MAX_FALLBACK_DEPTH + 1; i++) {
            ElementSelector next = ElementSelector.byText("t" + i);
            tail.setFallback(next);
            tail = next;
        }
        UiNode onlyLast = node(null, null, "t" + (ElementSelector.MAX_FALLBACK_DEPTH + 1), null, null);

        assertThat(resolver.resolve(List.of(onlyLast), head).found()).isFalse();
    }

    @Test
    public void resolve_isDeterministicForFixedSnapshot() {
        List<UiNode> nodes = List.of(node("a", "b", "c", null, "[0,0][1,1]"), node("a", null, null, null, null));
        ElementSelector sel = ElementSelector.byResourceId("a");

        assertThat(resolver.resolve(nodes, sel)).isEqualTo(resolver.resolve(nodes, sel));
    }

    @Test
    public void nullSelectorOrSnapshot_isMiss() {
        assertThat(resolver.resolve(List.of(), null).found()).isFalse();
        assertThat(resolver.resolve((DeviceState) null, ElementSelector.byText("a")).found()).isFalse();
    }
}
