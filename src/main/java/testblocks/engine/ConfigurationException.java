package testblocks.engine;

/**
 * Thrown when a block or pipeline is wired incorrectly: a block definition
 * without exactly one entry point, or explicit arguments that do not line up
 * with the entry point's parameters. Always raised before any block runs.
 */
public class ConfigurationException extends TestFrameworkException {

    public ConfigurationException(String msg) {
        super(msg);
    }

    public ConfigurationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
