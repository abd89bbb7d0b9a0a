package testblocks.engine;

/**
 * Unchecked base for every failure the engine raises on its own behalf.
 * Failures raised by a block's entry point are never wrapped in this type.
 */
public class TestFrameworkException extends RuntimeException {

    public TestFrameworkException(String msg) {
        super(msg);
    }

    public TestFrameworkException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
