package droidreplay.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed
 * device and replay settings with defaults.
 *
 * <p>A {@code config.local.properties} on the classpath overrides any value.
 */
public class ReplayConfig {

    private static final Logger log = LoggerFactory.getLogger(ReplayConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_TIMEOUT             = "device.timeout.sec";
    static final String KEY_PING_TIMEOUT        = "device.ping.timeout.sec";
    static final String KEY_CONNECT_ATTEMPTS    = "device.connect.attempts";
    static final String KEY_CONNECT_RETRY_DELAY = "device.connect.retry.delay.ms";
    static final String KEY_REQUEST_ATTEMPTS    = "device.request.attempts";
    static final String KEY_RETRY_DELAY         = "device.retry.delay.ms";
    static final String KEY_API_KEY             = "device.api.key";
    static final String KEY_STEP_DELAY          = "player.step.delay.ms";
    static final String KEY_PAUSE_POLL          = "player.pause.poll.ms";
    static final String KEY_SWIPE_DISTANCE      = "player.swipe.distance";
    static final String KEY_CENTER_X            = "player.screen.center.x";
    static final String KEY_CENTER_Y            = "player.screen.center.y";
    static final String KEY_LONG_PRESS          = "player.long.press.ms";

    // Defaults
    private static final int  DEFAULT_TIMEOUT             = 30;
    private static final int  DEFAULT_PING_TIMEOUT        = 5;
    private static final int  DEFAULT_CONNECT_ATTEMPTS    = 3;
    private static final long DEFAULT_CONNECT_RETRY_DELAY = 1000L;
    private static final int  DEFAULT_REQUEST_ATTEMPTS    = 3;
    private static final long DEFAULT_RETRY_DELAY         = 1000L;
    private static final long DEFAULT_STEP_DELAY          = 500L;
    private static final long DEFAULT_PAUSE_POLL          = 250L;
    private static final int  DEFAULT_SWIPE_DISTANCE      = 500;
    private static final int  DEFAULT_CENTER_X            = 540;
    private static final int  DEFAULT_CENTER_Y            = 960;
    private static final int  DEFAULT_LONG_PRESS          = 1000;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     *
     * @throws ReplayException if {@code config.properties} cannot be loaded
     */
    public ReplayConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new ReplayException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader().getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** For tests: uses {@code props} as is, without touching the classpath. */
    ReplayConfig(Properties props) {
        this.props = props;
    }

    // ── Device ────────────────────────────────────────────────────────────

    /** Connect/read/write timeout for device calls, seconds (default 30). */
    public int getTimeoutSec()            { return getInt(KEY_TIMEOUT, DEFAULT_TIMEOUT); }

    /** Timeout for a single liveness probe, seconds (default 5). */
    public int getPingTimeoutSec()        { return getInt(KEY_PING_TIMEOUT, DEFAULT_PING_TIMEOUT); }

    public int  getConnectAttempts()      { return Math.max(1, getInt(KEY_CONNECT_ATTEMPTS, DEFAULT_CONNECT_ATTEMPTS)); }
    public long getConnectRetryDelayMs()  { return getLong(KEY_CONNECT_RETRY_DELAY, DEFAULT_CONNECT_RETRY_DELAY); }

    /** Total attempts for a state fetch or dispatch, first try included (default 3). */
    public int  getRequestAttempts()      { return Math.max(1, getInt(KEY_REQUEST_ATTEMPTS, DEFAULT_REQUEST_ATTEMPTS)); }
    public long getRetryDelayMs()         { return getLong(KEY_RETRY_DELAY, DEFAULT_RETRY_DELAY); }

    /** Optional API key for the device service, or {@code null}. */
    public String getApiKey() {
        String raw = props.getProperty(KEY_API_KEY);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    // ── Player ────────────────────────────────────────────────────────────

    /** Pause between consecutive steps, ms (default 500). */
    public long getStepDelayMs()          { return getLong(KEY_STEP_DELAY, DEFAULT_STEP_DELAY); }
    public long getPausePollMs()          { return Math.max(1L, getLong(KEY_PAUSE_POLL, DEFAULT_PAUSE_POLL)); }
    public int  getSwipeDistance()        { return getInt(KEY_SWIPE_DISTANCE, DEFAULT_SWIPE_DISTANCE); }
    public int  getScreenCenterX()        { return getInt(KEY_CENTER_X, DEFAULT_CENTER_X); }
    public int  getScreenCenterY()        { return getInt(KEY_CENTER_Y, DEFAULT_CENTER_Y); }
    public int  getLongPressMs()          { return getInt(KEY_LONG_PRESS, DEFAULT_LONG_PRESS); }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
