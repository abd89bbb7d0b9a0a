package testblocks.logging;

/**
 * Receives structured lifecycle events from a run. Every event carries the
 * run (test case) name and the name of the block it concerns.
 */
public interface TestLogger {

    /** Lifecycle milestones: a block starting or completing. */
    void info(String runName, String blockName, String message);

    /** Phase transitions and serialized property and argument values. */
    void debug(String runName, String blockName, String message);

    /** Resolution or invocation failures. */
    void error(String runName, String blockName, String message);

    /** The serialized arguments handed to a block's entry point. */
    void testBlockInput(String runName, String blockName, String serializedArgs);

    /** The serialized value a block's entry point returned. */
    void testBlockOutput(String runName, String blockName, String serializedResult);
}
