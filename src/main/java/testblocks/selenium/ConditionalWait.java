package testblocks.selenium;

import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.support.ui.FluentWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Retries an action until it succeeds or a timeout elapses, on top of
 * Selenium's {@link FluentWait}.
 *
 * <p>Only the exception types passed to each call are retried; any other
 * exception propagates immediately. When the timeout elapses the last
 * ignored exception becomes the cause of a {@link WaitTimeoutException}.
 * Each call has a single deadline, however many attempts it makes.
 *
 * <pre>{@code
 * ConditionalWait wait = new ConditionalWait(Duration.ofSeconds(5), Duration.ofMillis(250));
 * WebElement button = wait.until(() -> driver.findElement(By.id("submit")),
 *         NoSuchElementException.class);
 * }</pre>
 */
public class ConditionalWait {

    private static final Logger log = LoggerFactory.getLogger(ConditionalWait.class);

    private final Duration timeout;
    private final Duration pollInterval;

    public ConditionalWait(Duration timeout, Duration pollInterval) {
        this.timeout      = Objects.requireNonNull(timeout, "timeout");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (timeout.isNegative() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("timeout and pollInterval must not be negative");
        }
    }

    public Duration getTimeout()      { return timeout; }
    public Duration getPollInterval() { return pollInterval; }

    /** Same poll interval, different timeout. */
    public ConditionalWait withTimeout(Duration newTimeout) {
        return new ConditionalWait(newTimeout, pollInterval);
    }

    /**
     * Calls {@code action} until it returns a non-null value without throwing
     * one of {@code ignored}, and returns that value. A {@code null} result
     * counts as a failed attempt.
     *
     * @throws WaitTimeoutException if the action keeps failing until the timeout
     */
    @SafeVarargs
    public final <T> T until(Supplier<T> action, Class<? extends Exception>... ignored) {
        return await(action, Supplier::get, ignored);
    }

    /** Void form of {@link #until(Supplier, Class[])}. */
    @SafeVarargs
    public final void untilNoException(Runnable action, Class<? extends Exception>... ignored) {
        await(action, a -> {
            a.run();
            return Boolean.TRUE;
        }, ignored);
    }

    /**
     * Evaluates {@code condition} until it returns {@code true}. A
     * {@code false} result counts as a failed attempt, like an ignored exception.
     *
     * @throws WaitTimeoutException if the condition is not true before the timeout
     */
    @SafeVarargs
    public final void untilTrue(BooleanSupplier condition, Class<? extends Exception>... ignored) {
        await(condition, BooleanSupplier::getAsBoolean, ignored);
    }

    private <I, T> T await(I input, Function<I, T> attempt,
                           Class<? extends Exception>[] ignored) {
        List<Class<? extends Exception>> ignore = Arrays.asList(ignored);
        FluentWait<I> wait = new FluentWait<>(input)
                .withTimeout(timeout)
                .pollingEvery(pollInterval)
                .ignoreAll(ignore);
        try {
            return wait.until(attempt);
        } catch (TimeoutException e) {
            log.debug("Wait timed out after {}ms ignoring {}", timeout.toMillis(), names(ignore));
            throw new WaitTimeoutException("Timed out after " + timeout.toMillis()
                    + "ms ignoring " + names(ignore), e.getCause());
        }
    }

    private static String names(List<Class<? extends Exception>> types) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i).getSimpleName());
        }
        return sb.append(']').toString();
    }
}
