package testblocks.logging;

/**
 * Renders arbitrary values for log output. Implementations never throw:
 * a value that cannot be rendered yields {@link #FALLBACK}.
 */
@FunctionalInterface
public interface ValueSerializer {

    String FALLBACK = "[unable to serialize value]";

    String serialize(Object value);
}
