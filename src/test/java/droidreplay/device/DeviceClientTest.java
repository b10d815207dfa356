package droidreplay.device;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.testng.annotations.AfterClass;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.ServerSocket;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests {@link DeviceClient} against a WireMock stand-in for the on-device
 * automation service.
 */
public class DeviceClientTest {

    private WireMockServer wireMock;
    private DeviceClient client;

    @BeforeClass
    public void startServer() {
        wireMock = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMock.start();
    }

    @AfterClass
    public void stopServer() {
        if (wireMock != null) {
            wireMock.stop();
        }
    }

    @BeforeMethod
    public void setUp() {
        wireMock.resetAll();
        client = new DeviceClient("localhost", wireMock.port(), 5, 2, 3, 10L, null);
        client.open();
    }

    @AfterMethod
    public void tearDown() {
        client.close();
    }

    // ── ping ──────────────────────────────────────────────────────────────

    @Test
    public void ping_successPayload_returnsTrue() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(okJson("{\"status\":\"success\",\"message\":\"pong\"}")));

        assertThat(client.ping()).isTrue();
    }

    @Test
    public void ping_errorPayload_returnsFalse() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(okJson("{\"status\":\"error\",\"error\":\"busy\"}")));

        assertThat(client.ping()).isFalse();
    }

    @Test
    public void ping_serverError_returnsFalse() {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(aResponse().withStatus(500)));

        assertThat(client.ping()).isFalse();
    }

    @Test
    public void ping_unreachableDevice_returnsFalse() throws IOException {
        int freePort;
        try (ServerSocket s = new ServerSocket(0)) {
            freePort = s.getLocalPort();
        }
        try (DeviceClient offline = new DeviceClient("localhost", freePort, 2, 1, 1, 0L, null)) {
            offline.open();
            assertThat(offline.ping()).isFalse();
        }
    }

    @Test
    public void ping_beforeOpen_returnsFalse() {
        DeviceClient closed = new DeviceClient("localhost", wireMock.port());
        assertThat(closed.ping()).isFalse();
    }

    // ── fetchState ────────────────────────────────────────────────────────

    @Test
    public void fetchState_dataAsEncodedString() throws Exception {
        String data = "{\\\"a11y_tree\\\":[{\\\"index\\\":0,\\\"resourceId\\\":\\\"com.app:id/username\\\","
                + "\\\"bounds\\\":\\\"[0,0][100,100]\\\"},{\\\"index\\\":1,\\\"text\\\":\\\"Login\\\"}],"
                + "\\\"phone_state\\\":{\\\"packageName\\\":\\\"com.app\\\"}}";
        wireMock.stubFor(get(urlEqualTo("/state"))
                .willReturn(okJson("{\"status\":\"success\",\"data\":\"" + data + "\"}")));

        DeviceState state = client.fetchState();

        assertThat(state.nodes()).hasSize(2);
        assertThat(state.nodes().get(0).getResourceId()).isEqualTo("com.app:id/username");
        assertThat(state.nodes().get(0).getParsedBounds()).isEqualTo(new Bounds(0, 0, 100, 100));
        assertThat(state.nodes().get(1).getText()).isEqualTo("Login");
        assertThat(state.phoneState().path("packageName").asText()).isEqualTo("com.app");
    }

    @Test
    public void fetchState_dataAsObjectWithAliasedAttributes() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/state")).willReturn(okJson(
                "{\"status\":\"success\",\"data\":{\"a11y_tree\":[{\"resource-id\":\"id/ok\","
                        + "\"content-desc\":\"Confirm\",\"class\":\"android.widget.Button\","
                        + "\"boundsInScreen\":\"10,20,30,40\"}]}}")));

        DeviceState state = client.fetchState();

        UiNode node = state.nodes().get(0);
        assertThat(node.getResourceId()).isEqualTo("id/ok");
        assertThat(node.getContentDescription()).isEqualTo("Confirm");
        assertThat(node.getClassName()).isEqualTo("android.widget.Button");
        assertThat(node.getParsedBounds()).isEqualTo(new Bounds(10, 20, 30, 40));
        assertThat(state.phoneState().isNull()).isTrue();
    }

    @Test
    public void fetchState_errorStatus_throws() {
        wireMock.stubFor(get(urlEqualTo("/state"))
                .willReturn(okJson("{\"status\":\"error\",\"error\":\"accessibility service not running\"}")));

        assertThatThrownBy(() -> client.fetchState())
                .isInstanceOf(DeviceTransportException.class)
                .hasMessageContaining("accessibility service not running");
    }

    @Test
    public void fetchState_malformedBody_throws() {
        wireMock.stubFor(get(urlEqualTo("/state")).willReturn(aResponse().withStatus(200).withBody("not json")));

        assertThatThrownBy(() -> client.fetchState()).isInstanceOf(DeviceTransportException.class);
    }

    @Test
    public void fetchState_httpError_throwsWithoutRetry() {
        wireMock.stubFor(get(urlEqualTo("/state")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.fetchState())
                .isInstanceOf(DeviceTransportException.class)
                .hasMessageContaining("HTTP 503");
        wireMock.verify(1, getRequestedFor(urlEqualTo("/state")));
    }

    @Test
    public void fetchState_recoversAfterTransientFault() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/state")).inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withFault(Fault.EMPTY_RESPONSE))
                .willSetStateTo("recovered"));
        wireMock.stubFor(get(urlEqualTo("/state")).inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"status\":\"success\",\"data\":{\"a11y_tree\":[]}}")));

        DeviceState state = client.fetchState();

        assertThat(state.nodes()).isEmpty();
        assertThat(wireMock.findAll(getRequestedFor(urlEqualTo("/state")))).hasSizeGreaterThanOrEqualTo(2);
    }

    @Test
    public void fetchState_persistentFault_givesUpAfterConfiguredAttempts() {
        wireMock.stubFor(get(urlEqualTo("/state")).willReturn(aResponse().withFault(Fault.EMPTY_RESPONSE)));

        assertThatThrownBy(() -> client.fetchState())
                .isInstanceOf(DeviceTransportException.class)
                .hasMessageContaining("3 attempt(s)");
    }

    // ── dispatch ──────────────────────────────────────────────────────────

    @Test
    public void tap_postsCoordinates() {
        wireMock.stubFor(post(urlEqualTo("/action/tap"))
                .willReturn(okJson("{\"status\":\"success\",\"message\":\"Tapped\"}")));

        ActionResponse resp = client.tap(10, 20);

        assertThat(resp.success()).isTrue();
        assertThat(resp.message()).isEqualTo("Tapped");
        wireMock.verify(postRequestedFor(urlEqualTo("/action/tap"))
                .withRequestBody(equalToJson("{\"x\":10,\"y\":20}")));
    }

    @Test
    public void swipe_postsStartEndAndDuration() {
        wireMock.stubFor(post(urlEqualTo("/action/swipe")).willReturn(okJson("{\"status\":\"success\"}")));

        ActionResponse resp = client.swipe(1, 2, 3, 4, 300);

        assertThat(resp).isEqualTo(ActionResponse.success("OK"));
        wireMock.verify(postRequestedFor(urlEqualTo("/action/swipe")).withRequestBody(
                equalToJson("{\"startX\":1,\"startY\":2,\"endX\":3,\"endY\":4,\"duration\":300}")));
    }

    @Test
    public void inputText_sendsBase64ToKeyboard() {
        wireMock.stubFor(post(urlEqualTo("/keyboard/input")).willReturn(okJson("{\"status\":\"success\"}")));

        assertThat(client.inputText("hello").success()).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/keyboard/input"))
                .withRequestBody(equalToJson("{\"base64_text\":\"aGVsbG8=\"}")));
    }

    @Test
    public void globalAction_postsActionName() {
        wireMock.stubFor(post(urlEqualTo("/action/global")).willReturn(okJson("{\"status\":\"success\"}")));

        assertThat(client.globalAction("back").success()).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/action/global"))
                .withRequestBody(equalToJson("{\"action\":\"back\"}")));
    }

    @Test
    public void pressKey_postsKeyCode() {
        wireMock.stubFor(post(urlEqualTo("/action/pressKey")).willReturn(okJson("{\"status\":\"success\"}")));

        assertThat(client.pressKey(66).success()).isTrue();
        wireMock.verify(postRequestedFor(urlEqualTo("/action/pressKey"))
                .withRequestBody(equalToJson("{\"key\":66}")));
    }

    @Test
    public void dispatch_errorStatus_returnsFailureWithDeviceMessage() {
        wireMock.stubFor(post(urlEqualTo("/action/tap"))
                .willReturn(okJson("{\"status\":\"error\",\"error\":\"coordinates off screen\"}")));

        ActionResponse resp = client.tap(5000, 5000);

        assertThat(resp.success()).isFalse();
        assertThat(resp.message()).isEqualTo("coordinates off screen");
    }

    @Test
    public void dispatch_httpError_isNotRetried() {
        wireMock.stubFor(post(urlEqualTo("/action/tap")).willReturn(aResponse().withStatus(500)));

        ActionResponse resp = client.tap(1, 1);

        assertThat(resp.success()).isFalse();
        assertThat(resp.message()).isEqualTo("HTTP 500");
        wireMock.verify(1, postRequestedFor(urlEqualTo("/action/tap")));
    }

    @Test
    public void dispatch_afterClose_returnsFailure() {
        client.close();

        ActionResponse resp = client.tap(1, 1);

        assertThat(resp.success()).isFalse();
        assertThat(resp.message()).contains("not open");
    }

    // ── API key / lifecycle ───────────────────────────────────────────────

    @Test
    public void apiKey_sentOnRequestsButNotOnPing() throws Exception {
        wireMock.stubFor(get(urlEqualTo("/ping")).willReturn(okJson("{\"status\":\"success\"}")));
        wireMock.stubFor(get(urlEqualTo("/state"))
                .willReturn(okJson("{\"status\":\"success\",\"data\":{\"a11y_tree\":[]}}")));

        try (DeviceClient keyed = new DeviceClient("localhost", wireMock.port(), 5, 2, 1, 0L, "secret")) {
            keyed.open();
            assertThat(keyed.ping()).isTrue();
            keyed.fetchState();
        }

        wireMock.verify(getRequestedFor(urlEqualTo("/state")).withHeader("X-API-Key", equalTo("secret")));
        wireMock.verify(getRequestedFor(urlEqualTo("/ping")).withoutHeader("X-API-Key"));
    }

    @Test
    public void close_isIdempotent() {
        client.close();
        client.close();

        assertThat(client.isOpen()).isFalse();
        assertThat(client.getBaseUrl()).isEqualTo("http://localhost:" + wireMock.port());
    }
}
