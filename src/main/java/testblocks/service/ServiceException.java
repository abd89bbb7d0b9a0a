package testblocks.service;

import testblocks.engine.TestFrameworkException;

/**
 * Thrown when a registered service cannot be produced: its provider failed,
 * returned null, or the provider graph is circular.
 */
public class ServiceException extends TestFrameworkException {

    public ServiceException(String msg) {
        super(msg);
    }

    public ServiceException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
