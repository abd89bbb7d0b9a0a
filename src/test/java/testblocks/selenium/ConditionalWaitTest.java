package testblocks.selenium;

import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.StaleElementReferenceException;
import org.testng.annotations.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConditionalWait} using short timeouts; no browser.
 */
public class ConditionalWaitTest {

    private final ConditionalWait wait = new ConditionalWait(Duration.ofMillis(300), Duration.ofMillis(10));

    @Test
    public void until_successOnFirstAttempt_returnsValue() {
        assertThat(wait.until(() -> "ready", NoSuchElementException.class)).isEqualTo("ready");
    }

    @Test(description = "Ignored exceptions are retried until the action succeeds")
    public void until_retriesIgnoredExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        String result = wait.until(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new NoSuchElementException("not yet");
            }
            return "found";
        }, NoSuchElementException.class);

        assertThat(result).isEqualTo("found");
        assertThat(attempts).hasValue(3);
    }

    @Test(description = "Exceptions that are not ignored propagate on the first attempt")
    public void until_otherException_propagatesImmediately() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> wait.until(() -> {
            attempts.incrementAndGet();
            throw new StaleElementReferenceException("stale");
        }, NoSuchElementException.class))
                .isInstanceOf(StaleElementReferenceException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    public void until_timeout_carriesLastIgnoredException() {
        NoSuchElementException missing = new NoSuchElementException("never");

        assertThatThrownBy(() -> wait.until(() -> {
            throw missing;
        }, NoSuchElementException.class))
                .isInstanceOf(WaitTimeoutException.class)
                .hasMessageContaining("NoSuchElementException")
                .hasCause(missing);
    }

    @Test
    public void untilTrue_falseUntilTimeout_throws() {
        assertThatThrownBy(() -> wait.untilTrue(() -> false))
                .isInstanceOf(WaitTimeoutException.class);
    }

    @Test
    public void untilTrue_eventuallyTrue_returns() {
        AtomicInteger calls = new AtomicInteger();

        wait.untilTrue(() -> calls.incrementAndGet() >= 2);

        assertThat(calls).hasValue(2);
    }

    @Test(description = "A condition that turns from false to throwing shares one deadline")
    public void untilTrue_falseThenIgnoredException_timesOutOnce() {
        long start = System.nanoTime();

        assertThatThrownBy(() -> wait.untilTrue(() -> {
            if (Duration.ofNanos(System.nanoTime() - start).toMillis() < 200) {
                return false;
            }
            throw new IllegalStateException("still loading");
        }, IllegalStateException.class))
                .isInstanceOf(WaitTimeoutException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(Duration.ofNanos(System.nanoTime() - start).toMillis()).isLessThan(550);
    }

    @Test
    public void untilNoException_runsActionUntilItSucceeds() {
        AtomicInteger calls = new AtomicInteger();

        wait.untilNoException(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new NoSuchElementException("first");
            }
        }, NoSuchElementException.class);

        assertThat(calls).hasValue(2);
    }

    @Test
    public void withTimeout_keepsPollInterval() {
        ConditionalWait longer = wait.withTimeout(Duration.ofSeconds(2));

        assertThat(longer.getTimeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(longer.getPollInterval()).isEqualTo(Duration.ofMillis(10));
    }

    @Test
    public void negativeDurations_areRejected() {
        assertThatThrownBy(() -> new ConditionalWait(Duration.ofSeconds(-1), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
