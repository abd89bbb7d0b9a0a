package testblocks.logging;

import io.qameta.allure.Allure;
import io.qameta.allure.model.Status;

import java.util.Objects;

/**
 * {@link TestLogger} that mirrors a run into the Allure report of the
 * enclosing test: milestones become steps, failures become failed steps and
 * block inputs and outputs are attached as JSON. Every event is also passed
 * to a delegate, so the usual log output is kept.
 *
 * <p>Outside a running Allure test case Allure logs and drops the step and
 * attachment calls, so this logger is safe to use anywhere.
 */
public class AllureTestLogger implements TestLogger {

    private final TestLogger delegate;

    public AllureTestLogger() {
        this(new Slf4jTestLogger());
    }

    public AllureTestLogger(TestLogger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void info(String runName, String blockName, String message) {
        delegate.info(runName, blockName, message);
        Allure.step(blockName + ": " + message);
    }

    @Override
    public void debug(String runName, String blockName, String message) {
        delegate.debug(runName, blockName, message);
    }

    @Override
    public void error(String runName, String blockName, String message) {
        delegate.error(runName, blockName, message);
        Allure.step(blockName + ": " + message, Status.FAILED);
    }

    @Override
    public void testBlockInput(String runName, String blockName, String serializedArgs) {
        delegate.testBlockInput(runName, blockName, serializedArgs);
        Allure.addAttachment(blockName + " arguments", "application/json", serializedArgs, ".json");
    }

    @Override
    public void testBlockOutput(String runName, String blockName, String serializedResult) {
        delegate.testBlockOutput(runName, blockName, serializedResult);
        Allure.addAttachment(blockName + " result", "application/json", serializedResult, ".json");
    }
}
