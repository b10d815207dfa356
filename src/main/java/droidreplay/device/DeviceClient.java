package droidreplay.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the on-device automation service.
 *
 * <p>The device answers every call with {@code {"status": "success"|"error", ...}};
 * errors carry an {@code error} field. Endpoints used here:
 * <ul>
 *   <li>{@code GET /ping} liveness probe</li>
 *   <li>{@code GET /state} accessibility snapshot</li>
 *   <li>{@code POST /action/{type}} gesture dispatch</li>
 *   <li>{@code POST /keyboard/{op}} text input</li>
 * </ul>
 *
 * <p>State fetches and dispatches are retried on I/O failures only; an HTTP
 * error response is an answer and is returned as is. {@link #ping()} is
 * never retried and uses its own shorter timeout.
 *
 * <p>Call {@link #open()} before use and {@link #close()} when done.
 */
public class DeviceClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeviceClient.class);
    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final String API_KEY_HEADER = "X-API-Key";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final String baseUrl;
    private final int    timeoutSec;
    private final int    pingTimeoutSec;
    private final int    requestAttempts;
    private final long   retryDelayMs;
    private final String apiKey;

    private volatile OkHttpClient httpClient;
    private volatile OkHttpClient pingClient;

    public DeviceClient(String host, int port) {
        this(host, port, 30, 5, 3, 1000L, null);
    }

    /**
     * @param requestAttempts total attempts for state fetches and dispatches (at least 1)
     * @param apiKey          sent as {@code X-API-Key} on every call except ping; may be null
     */
    public DeviceClient(String host, int port, int timeoutSec, int pingTimeoutSec,
                        int requestAttempts, long retryDelayMs, String apiKey) {
        this.baseUrl         = "http://" + host + ":" + port;
        this.timeoutSec      = timeoutSec;
        this.pingTimeoutSec  = pingTimeoutSec;
        this.requestAttempts = Math.max(1, requestAttempts);
        this.retryDelayMs    = Math.max(0L, retryDelayMs);
        this.apiKey          = apiKey == null || apiKey.isBlank() ? null : apiKey;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    public synchronized void open() {
        if (httpClient != null) {
            return;
        }
        httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeoutSec, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(timeoutSec, TimeUnit.SECONDS)
                .build();
        pingClient = httpClient.newBuilder()
                .connectTimeout(pingTimeoutSec, TimeUnit.SECONDS)
                .readTimeout(pingTimeoutSec, TimeUnit.SECONDS)
                .callTimeout(pingTimeoutSec, TimeUnit.SECONDS)
                .build();
        log.debug("Device client opened for {}", baseUrl);
    }

    /** Releases the connection pool and dispatcher threads. Safe to call repeatedly. */
    @Override
    public synchronized void close() {
        OkHttpClient c = httpClient;
        if (c == null) {
            return;
        }
        httpClient = null;
        pingClient = null;
        c.dispatcher().executorService().shutdown();
        c.connectionPool().evictAll();
        log.debug("Device client closed for {}", baseUrl);
    }

    public boolean isOpen()     { return httpClient != null; }
    public String  getBaseUrl() { return baseUrl; }

    // ── Liveness ──────────────────────────────────────────────────────────

    /** True iff the device answers {@code /ping} with {@code status=success}. Never throws. */
    public boolean ping() {
        OkHttpClient client = pingClient;
        if (client == null) {
            log.debug("Ping skipped: client not open");
            return false;
        }
        Request request = new Request.Builder().url(baseUrl + "/ping").get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("Ping to {} returned HTTP {}", baseUrl, response.code());
                return false;
            }
            JsonNode root = MAPPER.readTree(bodyOf(response));
            return root != null && "success".equals(root.path("status").asText());
        } catch (IOException | RuntimeException e) {
            log.debug("Ping to {} failed: {}", baseUrl, e.getMessage());
            return false;
        }
    }

    // ── State ─────────────────────────────────────────────────────────────

    /**
     * Fetches the current accessibility snapshot.
     *
     * @throws DeviceTransportException on network failure, non-success status or malformed payload
     */
    public DeviceState fetchState() throws DeviceTransportException {
        Request request = authorized(new Request.Builder().url(baseUrl + "/state").get()).build();
        HttpResult result;
        try {
            result = execute(request);
        } catch (IOException e) {
            throw new DeviceTransportException("State fetch failed: " + e.getMessage(), e);
        }
        if (!result.isSuccessful()) {
            throw new DeviceTransportException("State fetch returned HTTP " + result.code()
                    + messageSuffix(result.body()));
        }
        try {
            JsonNode root = MAPPER.readTree(result.body());
            if (root == null || !root.isObject()) {
                throw new DeviceTransportException("State response is not a JSON object");
            }
            if (!"success".equals(root.path("status").asText())) {
                throw new DeviceTransportException("Device reported error: "
                        + firstText(root, "error", "message", "unknown error"));
            }
            JsonNode data = root.get("data");
            if (data != null && data.isTextual()) {
                data = MAPPER.readTree(data.asText());
            }
            if (data == null || !data.isObject()) {
                throw new DeviceTransportException("State response has no data object");
            }
            JsonNode tree = data.get("a11y_tree");
            List<UiNode> nodes = new ArrayList<>();
            if (tree != null && !tree.isNull()) {
                if (!tree.isArray()) {
                    throw new DeviceTransportException("a11y_tree is not an array");
                }
                for (JsonNode n : tree) {
                    nodes.add(MAPPER.treeToValue(n, UiNode.class));
                }
            }
            log.debug("Fetched state with {} nodes", nodes.size());
            return new DeviceState(nodes, data.get("phone_state"));
        } catch (JsonProcessingException e) {
            throw new DeviceTransportException("Malformed state payload: " + e.getOriginalMessage(), e);
        }
    }

    // ── Dispatch ──────────────────────────────────────────────────────────

    /** {@code POST /action/{type}}. Never throws; failures come back as unsuccessful responses. */
    public ActionResponse dispatchAction(String type, Map<String, ?> params) {
        return post("/action/" + type, params);
    }

    /** {@code POST /keyboard/{op}}. Never throws. */
    public ActionResponse keyboard(String op, Map<String, ?> params) {
        return post("/keyboard/" + op, params);
    }

    public ActionResponse tap(int x, int y) {
        return dispatchAction("tap", params("x", x, "y", y));
    }

    public ActionResponse longPress(int x, int y, int durationMs) {
        Map<String, Object> p = params("x", x, "y", y);
        p.put("duration", durationMs);
        return dispatchAction("longpress", p);
    }

    public ActionResponse swipe(int startX, int startY, int endX, int endY, int durationMs) {
        Map<String, Object> p = params("startX", startX, "startY", startY);
        p.put("endX", endX);
        p.put("endY", endY);
        p.put("duration", durationMs);
        return dispatchAction("swipe", p);
    }

    /** Sends {@code text} to the focused element, base64 encoded. */
    public ActionResponse inputText(String text) {
        String encoded = Base64.getEncoder().encodeToString(
                (text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("base64_text", encoded);
        return keyboard("input", p);
    }

    public ActionResponse pressKey(int keyCode) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("key", keyCode);
        return dispatchAction("pressKey", p);
    }

    /** System navigation: {@code back}, {@code home}, {@code recents}, {@code notifications}. */
    public ActionResponse globalAction(String action) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("action", action);
        return dispatchAction("global", p);
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private ActionResponse post(String path, Map<String, ?> params) {
        String json;
        try {
            json = MAPPER.writeValueAsString(params == null ? Map.of() : params);
        } catch (JsonProcessingException e) {
            return ActionResponse.failure("Could not encode request: " + e.getOriginalMessage());
        }
        Request request = authorized(new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(json, JSON))).build();
        log.debug("POST {} {}", path, json);

        HttpResult result;
        try {
            result = execute(request);
        } catch (IOException e) {
            log.warn("POST {} failed: {}", path, e.getMessage());
            return ActionResponse.failure("Transport error: " + e.getMessage());
        }

        JsonNode root;
        try {
            root = result.body().isBlank() ? null : MAPPER.readTree(result.body());
        } catch (JsonProcessingException e) {
            root = null;
        }
        if (!result.isSuccessful()) {
            String msg = root != null ? firstText(root, "error", "message", null) : null;
            return ActionResponse.failure(msg != null ? msg : "HTTP " + result.code());
        }
        if (root == null || !root.isObject()) {
            return ActionResponse.failure("Malformed response from " + path);
        }
        if ("success".equals(root.path("status").asText())) {
            return ActionResponse.success(firstText(root, "message", "error", "OK"));
        }
        return ActionResponse.failure(firstText(root, "error", "message", "Action failed"));
    }

    /** Runs the call up to {@code requestAttempts} times, retrying on I/O failures. */
    private HttpResult execute(Request request) throws IOException {
        OkHttpClient client = httpClient;
        if (client == null) {
            throw new IOException("Device client is not open");
        }
        IOException last = null;
        for (int attempt = 1; attempt <= requestAttempts; attempt++) {
            if (attempt > 1) {
                log.warn("Retrying {} {} (attempt {}/{}) after {}ms",
                        request.method(), request.url().encodedPath(), attempt, requestAttempts, retryDelayMs);
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted during retry delay", ie);
                }
            }
            try (Response response = client.newCall(request).execute()) {
                return new HttpResult(response.code(), bodyOf(response));
            } catch (IOException e) {
                last = e;
                log.debug("{} {} I/O error on attempt {}: {}",
                        request.method(), request.url().encodedPath(), attempt, e.getMessage());
            }
        }
        throw new IOException("Request failed after " + requestAttempts + " attempt(s): "
                + (last != null ? last.getMessage() : "unknown"), last);
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (apiKey != null) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        return builder;
    }

    private static String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }

    private static String messageSuffix(String body) {
        try {
            JsonNode root = body.isBlank() ? null : MAPPER.readTree(body);
            String msg = root != null ? firstText(root, "error", "message", null) : null;
            return msg != null ? ": " + msg : "";
        } catch (JsonProcessingException e) {
            return "";
        }
    }

    private static String firstText(JsonNode root, String field, String alternative, String dflt) {
        JsonNode n = root.get(field);
        if (n != null && !n.isNull() && !n.asText().isEmpty()) {
            return n.asText();
        }
        n = root.get(alternative);
        if (n != null && !n.isNull() && !n.asText().isEmpty()) {
            return n.asText();
        }
        return dflt;
    }

    private static Map<String, Object> params(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put(k1, v1);
        p.put(k2, v2);
        return p;
    }

    private record HttpResult(int code, String body) {
        boolean isSuccessful() { return code >= 200 && code < 300; }
    }
}
