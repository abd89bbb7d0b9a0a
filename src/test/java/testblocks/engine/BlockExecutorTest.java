package testblocks.engine;

import testblocks.block.BlockDefinition;
import testblocks.block.BlockDescriptor;
import testblocks.block.BlockState;
import testblocks.logging.ValueSerializer;
import testblocks.model.TypeKey;
import testblocks.service.ServiceRegistry;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BlockExecutor}: the lifecycle events it reports and
 * how it stores results, driven through an {@link ExecutionContext} directly.
 */
public class BlockExecutorTest {

    static class Greeter {
        private String prefix = "Hello";

        String getPrefix()         { return prefix; }
        void setPrefix(String p)   { this.prefix = p; }
        String greet(String name)  { return prefix + " " + name; }
    }

    private static final TypeKey<String>  STRING = TypeKey.of(String.class);
    private static final TypeKey<Integer> NUMBER = TypeKey.of(Integer.class);

    private static final BlockDefinition<Greeter> GREET = BlockDefinition.builder("Greet", Greeter::new)
            .executes(STRING, STRING, Greeter::greet)
            .build();

    private ServiceRegistry     registry;
    private RecordingTestLogger logger;
    private BlockExecutor       executor;

    @BeforeMethod
    public void setUp() {
        registry = new ServiceRegistry();
        logger   = new RecordingTestLogger();
        executor = new BlockExecutor();
    }

    @AfterMethod
    public void tearDown() {
        registry.close();
    }

    private ExecutionContext context(boolean logDebugValues) {
        return context(String::valueOf, logDebugValues);
    }

    private ExecutionContext context(ValueSerializer serializer, boolean logDebugValues) {
        return new ExecutionContext("exec", registry.createScope("exec"), logger, serializer, logDebugValues);
    }

    // ── Lifecycle events ──────────────────────────────────────────────────

    @Test(description = "A successful block reports every phase, its input and its output, in order")
    public void execute_reportsLifecycleInOrder() throws Exception {
        RunResult result = executor.execute(List.of(BlockDescriptor.withArgs(GREET, "Ann")), context(true));

        assertThat(logger.events()).containsExactly(
                "INFO|Greet|Starting test block 1/1",
                "DEBUG|Greet|Phase PENDING -> RESOLVING",
                "DEBUG|Greet|Phase RESOLVING -> INSTANTIATED",
                "DEBUG|Greet|Handing argument into entry point: Ann",
                "INPUT|Greet|[Ann]",
                "DEBUG|Greet|Phase INSTANTIATED -> INVOKING",
                "OUTPUT|Greet|Hello Ann",
                "DEBUG|Greet|Phase INVOKING -> COMPLETED",
                "INFO|Greet|Test block completed");

        assertThat(result.getBlocks()).hasSize(1);
        assertThat(result.getBlocks().get(0).getState()).isEqualTo(BlockState.COMPLETED);
        assertThat(result.getResult(STRING)).contains("Hello Ann");
    }

    @Test
    public void execute_debugValuesDisabled_stillReportsInput() throws Exception {
        executor.execute(List.of(BlockDescriptor.withArgs(GREET, "Ann")), context(false));

        assertThat(logger.events()).noneMatch(e -> e.contains("Handing argument"));
        assertThat(logger.eventsFor("INPUT")).containsExactly("INPUT|Greet|[Ann]");
    }

    @Test
    public void execute_logsReadablePropertyValues() throws Exception {
        BlockDefinition<Greeter> def = BlockDefinition.builder("Prefixed", Greeter::new)
                .property("prefix", STRING, Greeter::setPrefix, Greeter::getPrefix)
                .executes(STRING, STRING, Greeter::greet)
                .build();
        ExecutionContext ctx = context(true);
        registry.registerInstance(STRING, "Howdy");

        executor.execute(List.of(BlockDescriptor.withArgs(def, "Bo")), ctx);

        assertThat(logger.events()).contains("DEBUG|Prefixed|Using property prefix with data: Howdy");
        assertThat(ctx.getResults().find(STRING)).contains("Howdy Bo");
    }

    @Test(description = "A failing block reports the phase it failed in and the FAILED transition")
    public void execute_failure_reportsErrorAndFailedPhase() {
        BlockDefinition<Greeter> def = BlockDefinition.builder("Fails", Greeter::new)
                .runs(g -> { throw new IllegalStateException("boom"); })
                .build();

        assertThatThrownBy(() -> executor.execute(List.of(BlockDescriptor.of(def)), context(true)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");

        assertThat(logger.eventsFor("ERROR")).containsExactly(
                "ERROR|Fails|Test block failed while INVOKING: java.lang.IllegalStateException: boom");
        assertThat(logger.events()).endsWith("DEBUG|Fails|Phase INVOKING -> FAILED");
    }

    @Test(description = "Invalid explicit arguments are rejected before the first block starts")
    public void execute_invalidExplicitArgs_failsBeforeAnyBlock() {
        List<BlockDescriptor> pipeline = List.of(
                BlockDescriptor.withArgs(GREET, "Ann"),
                BlockDescriptor.withArgs(GREET, "Ann", "Bo"));

        assertThatThrownBy(() -> executor.execute(pipeline, context(true)))
                .isInstanceOf(ConfigurationException.class);

        assertThat(logger.eventsFor("INFO")).isEmpty();
        assertThat(logger.eventsFor("ERROR")).hasSize(1);
    }

    // ── Results ───────────────────────────────────────────────────────────

    @Test
    public void execute_nullResult_storesNothing() throws Exception {
        BlockDefinition<Greeter> def = BlockDefinition.builder("ReturnsNull", Greeter::new)
                .executes(STRING, g -> null)
                .build();
        ExecutionContext ctx = context(true);

        executor.execute(List.of(BlockDescriptor.of(def)), ctx);

        assertThat(ctx.getResults().size()).isZero();
        assertThat(logger.eventsFor("OUTPUT")).isEmpty();
    }

    @Test
    public void execute_undeclaredOutputKey_usesRuntimeClass() throws Exception {
        BlockDefinition<Greeter> def = BlockDefinition.builder("Untyped", Greeter::new)
                .entryPoint(List.of(), null, (g, args) -> 42)
                .build();
        ExecutionContext ctx = context(true);

        executor.execute(List.of(BlockDescriptor.of(def)), ctx);

        assertThat(ctx.getResults().find(NUMBER)).contains(42);
    }

    @Test
    public void execute_resultNotMatchingDeclaredKey_throws() {
        BlockDefinition<Greeter> def = BlockDefinition.builder("Liar", Greeter::new)
                .entryPoint(List.of(), STRING, (g, args) -> 42)
                .build();

        assertThatThrownBy(() -> executor.execute(List.of(BlockDescriptor.of(def)), context(true)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Liar")
                .hasMessageContaining("java.lang.Integer");
    }

    @Test
    public void execute_replacingResult_isReported() throws Exception {
        BlockDefinition<Greeter> first = BlockDefinition.builder("First", Greeter::new)
                .executes(STRING, g -> "one")
                .build();
        BlockDefinition<Greeter> second = BlockDefinition.builder("Second", Greeter::new)
                .executes(STRING, g -> "two")
                .build();
        ExecutionContext ctx = context(true);

        executor.execute(List.of(BlockDescriptor.of(first), BlockDescriptor.of(second)), ctx);

        assertThat(ctx.getResults().find(STRING)).contains("two");
        assertThat(logger.events()).contains("DEBUG|Second|Replaced earlier String result");
    }

    @Test(description = "An InvocationTargetException thrown by the block itself reaches the caller as-is")
    public void execute_blockThrowsInvocationTargetException_isRethrownUnchanged() {
        InvocationTargetException thrown = new InvocationTargetException(new IOException("disk"));
        BlockDefinition<Greeter> def = BlockDefinition.builder("Reflective", Greeter::new)
                .entryPoint(List.of(), null, (g, args) -> {
                    throw thrown;
                })
                .build();

        assertThatThrownBy(() -> executor.execute(List.of(BlockDescriptor.of(def)), context(true)))
                .isSameAs(thrown);
    }

    @Test(description = "A serializer that throws never fails the block")
    public void execute_serializerFailure_isNotFatal() throws Exception {
        ValueSerializer broken = value -> {
            throw new IllegalStateException("cannot render");
        };

        RunResult result = executor.execute(List.of(BlockDescriptor.withArgs(GREET, "Ann")), context(broken, true));

        assertThat(result.getResult(STRING)).contains("Hello Ann");
        assertThat(logger.eventsFor("OUTPUT")).containsExactly("OUTPUT|Greet|" + ValueSerializer.FALLBACK);
    }
}
