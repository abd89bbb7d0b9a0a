package testblocks.selenium;

import testblocks.engine.TestFrameworkException;

/**
 * Thrown by {@link ConditionalWait} when its condition is not met in time.
 * The cause, when present, is the last ignored exception.
 */
public class WaitTimeoutException extends TestFrameworkException {

    public WaitTimeoutException(String msg) {
        super(msg);
    }

    public WaitTimeoutException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
