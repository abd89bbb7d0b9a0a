package testblocks.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Reads {@code testblocks.properties} from the classpath and exposes typed
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a
 * {@code testblocks.local.properties} file on the classpath (higher
 * priority, not committed to VCS).
 */
public class FrameworkConfig {

    private static final Logger log = LoggerFactory.getLogger(FrameworkConfig.class);

    private static final String CONFIG_FILE       = "testblocks.properties";
    private static final String CONFIG_LOCAL_FILE = "testblocks.local.properties";

    // Property keys
    private static final String KEY_LOG_DEBUG_VALUES     = "testblocks.log.debug.values";
    private static final String KEY_SERIALIZER_PRETTY    = "testblocks.serializer.pretty";
    private static final String KEY_SERIALIZER_MAX       = "testblocks.serializer.max.length";
    private static final String KEY_WAIT_TIMEOUT         = "testblocks.wait.timeout.sec";
    private static final String KEY_WAIT_POLL            = "testblocks.wait.poll.ms";
    private static final String KEY_BROWSER_HEADLESS     = "testblocks.browser.headless";
    private static final String KEY_PAGE_LOAD_TIMEOUT    = "testblocks.browser.page.load.timeout.sec";
    private static final String KEY_SCREENSHOT_DIR       = "testblocks.screenshot.dir";

    // Defaults
    private static final boolean DEFAULT_LOG_DEBUG_VALUES  = true;
    private static final boolean DEFAULT_SERIALIZER_PRETTY = false;
    private static final int     DEFAULT_SERIALIZER_MAX    = 4000;
    private static final int     DEFAULT_WAIT_TIMEOUT      = 5;
    private static final long    DEFAULT_WAIT_POLL         = 250L;
    private static final boolean DEFAULT_BROWSER_HEADLESS  = false;
    private static final int     DEFAULT_PAGE_LOAD_TIMEOUT = 120;
    private static final String  DEFAULT_SCREENSHOT_DIR    = "screenshot";

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code testblocks.local.properties} values override {@code testblocks.properties}.
     *
     * @throws IllegalStateException if the base testblocks.properties cannot be loaded
     */
    public FrameworkConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
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

    /** Uses {@code props} as-is, without touching the classpath. */
    public FrameworkConfig(Properties props) {
        this.props = props;
    }

    // ── Engine ─────────────────────────────────────────────────────────────

    /** Whether serialized property and argument values go to the debug channel (default: true). */
    public boolean isLogDebugValues() {
        return getBool(KEY_LOG_DEBUG_VALUES, DEFAULT_LOG_DEBUG_VALUES);
    }

    /** Whether serialized values are pretty-printed (default: false). */
    public boolean isSerializerPretty() {
        return getBool(KEY_SERIALIZER_PRETTY, DEFAULT_SERIALIZER_PRETTY);
    }

    /** Longest serialized value written before truncation; 0 disables truncation (default: 4000). */
    public int getSerializerMaxLength() {
        return getInt(KEY_SERIALIZER_MAX, DEFAULT_SERIALIZER_MAX);
    }

    // ── Browser ────────────────────────────────────────────────────────────

    /** Default timeout for conditional waits (default: 5s). */
    public Duration getWaitTimeout() {
        return Duration.ofSeconds(getInt(KEY_WAIT_TIMEOUT, DEFAULT_WAIT_TIMEOUT));
    }

    /** Interval between conditional-wait attempts (default: 250ms). */
    public Duration getWaitPollInterval() {
        return Duration.ofMillis(getLong(KEY_WAIT_POLL, DEFAULT_WAIT_POLL));
    }

    /** Whether launched browsers run headless (default: false). */
    public boolean isBrowserHeadless() {
        return getBool(KEY_BROWSER_HEADLESS, DEFAULT_BROWSER_HEADLESS);
    }

    /** Page-load timeout applied to launched browsers (default: 120s). */
    public Duration getPageLoadTimeout() {
        return Duration.ofSeconds(getInt(KEY_PAGE_LOAD_TIMEOUT, DEFAULT_PAGE_LOAD_TIMEOUT));
    }

    /** Directory screenshots are written to (default: "screenshot"). */
    public String getScreenshotDir() {
        return props.getProperty(KEY_SCREENSHOT_DIR, DEFAULT_SCREENSHOT_DIR).trim();
    }

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

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
