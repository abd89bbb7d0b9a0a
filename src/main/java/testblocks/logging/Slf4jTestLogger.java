package testblocks.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link TestLogger}: writes every event to the SLF4J logger
 * {@value #LOGGER_NAME} as {@code "run - block - message"}.
 */
public class Slf4jTestLogger implements TestLogger {

    public static final String LOGGER_NAME = "testblocks.run";

    private final Logger log;

    public Slf4jTestLogger() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    /** Package-private for tests. */
    Slf4jTestLogger(Logger log) {
        this.log = log;
    }

    @Override
    public void info(String runName, String blockName, String message) {
        log.info("{} - {} - {}", runName, blockName, message);
    }

    @Override
    public void debug(String runName, String blockName, String message) {
        log.debug("{} - {} - {}", runName, blockName, message);
    }

    @Override
    public void error(String runName, String blockName, String message) {
        log.error("{} - {} - {}", runName, blockName, message);
    }

    @Override
    public void testBlockInput(String runName, String blockName, String serializedArgs) {
        log.debug("{} - {} - Arguments: {}", runName, blockName, serializedArgs);
    }

    @Override
    public void testBlockOutput(String runName, String blockName, String serializedResult) {
        log.debug("{} - {} - Returned: {}", runName, blockName, serializedResult);
    }
}
