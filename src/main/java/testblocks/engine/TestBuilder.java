package testblocks.engine;

import testblocks.block.BlockDefinition;
import testblocks.block.BlockDescriptor;
import testblocks.config.FrameworkConfig;
import testblocks.logging.JsonValueSerializer;
import testblocks.logging.Slf4jTestLogger;
import testblocks.logging.TestLogger;
import testblocks.logging.ValueSerializer;
import testblocks.model.TypeKey;
import testblocks.service.Lifetime;
import testblocks.service.ServiceException;
import testblocks.service.ServiceProvider;
import testblocks.service.ServiceRegistry;
import testblocks.service.ServiceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles a test case from blocks and services, then runs it.
 *
 * <p>Nothing happens until {@link #run()}: every {@code add*} call only
 * records intent. Each call to {@code run()} gets its own result store and
 * scoped services, so a builder may be run repeatedly, and concurrently from
 * different threads once assembly is finished.
 *
 * <pre>{@code
 * new TestBuilder("LogInAndCheckHome")
 *         .addScopedService(Browser.class, scope -> Browser.launch(BrowserType.CHROME, config))
 *         .addBlock(OPEN_LOGIN_PAGE)
 *         .addBlock(LOG_IN, new Credentials("admin", "secret"))
 *         .addBlock(VERIFY_HOME)
 *         .run();
 * }</pre>
 */
public class TestBuilder {

    private static final Logger log = LoggerFactory.getLogger(TestBuilder.class);

    private static final TypeKey<TestLogger> LOGGER_KEY = TypeKey.of(TestLogger.class);

    private final String                testCaseName;
    private final ServiceRegistry       registry;
    private final FrameworkConfig       config;
    private final BlockExecutor         executor;
    private final List<BlockDescriptor> blocks = new ArrayList<>();

    private TestLogger      logger;
    private ValueSerializer serializer;

    /** Names the test case after the calling method. */
    public TestBuilder() {
        this(callerMethodName());
    }

    public TestBuilder(String testCaseName) {
        this(testCaseName, new ServiceRegistry(), new FrameworkConfig());
    }

    /**
     * @param registry shared registry; its singletons outlive this builder's runs
     */
    public TestBuilder(String testCaseName, ServiceRegistry registry, FrameworkConfig config) {
        if (testCaseName == null || testCaseName.isBlank()) {
            throw new IllegalArgumentException("testCaseName must not be blank");
        }
        this.testCaseName = testCaseName;
        this.registry     = Objects.requireNonNull(registry, "registry");
        this.config       = Objects.requireNonNull(config, "config");
        this.executor     = new BlockExecutor();
    }

    // ── Blocks ────────────────────────────────────────────────────────────

    /** Appends a block whose entry-point arguments are all resolved. */
    public TestBuilder addBlock(BlockDefinition<?> definition) {
        blocks.add(BlockDescriptor.of(definition));
        return this;
    }

    /**
     * Appends a block whose entry point receives exactly {@code args},
     * positionally. The count must equal the entry point's parameter count.
     */
    public TestBuilder addBlock(BlockDefinition<?> definition, Object... args) {
        blocks.add(BlockDescriptor.withArgs(definition, args));
        return this;
    }

    // ── Services ──────────────────────────────────────────────────────────

    /** Registers {@code provider} under {@code key}, replacing any earlier registration. */
    public <T> TestBuilder addService(TypeKey<T> key, ServiceProvider<T> provider, Lifetime lifetime) {
        registry.registerFactory(key, lifetime, provider);
        return this;
    }

    public <T> TestBuilder addService(Class<T> type, ServiceProvider<T> provider, Lifetime lifetime) {
        return addService(TypeKey.of(type), provider, lifetime);
    }

    public <T> TestBuilder addScopedService(Class<T> type, ServiceProvider<T> provider) {
        return addService(type, provider, Lifetime.SCOPED);
    }

    public <T> TestBuilder addSingletonService(Class<T> type, ServiceProvider<T> provider) {
        return addService(type, provider, Lifetime.SINGLETON);
    }

    /** Registers {@code implementation}, built through its no-argument constructor, under {@code type}. */
    public <T> TestBuilder addServiceType(Class<T> type, Class<? extends T> implementation, Lifetime lifetime) {
        registry.registerType(TypeKey.of(type), lifetime, implementation);
        return this;
    }

    /** Registers {@code value} as a singleton keyed by its runtime class. */
    public TestBuilder addInstance(Object value) {
        Objects.requireNonNull(value, "value");
        return addInstance(TypeKey.ofValue(value), value);
    }

    /** Registers {@code value} as a singleton under {@code key}. */
    public <T> TestBuilder addInstance(TypeKey<T> key, T value) {
        registry.registerInstance(key, value);
        return this;
    }

    // ── Collaborators ─────────────────────────────────────────────────────

    /**
     * Logger used when no {@link TestLogger} is registered as a service.
     * Defaults to {@link Slf4jTestLogger}.
     */
    public TestBuilder withLogger(TestLogger logger) {
        this.logger = logger;
        return this;
    }

    /** Defaults to a {@link JsonValueSerializer} configured from {@link FrameworkConfig}. */
    public TestBuilder withSerializer(ValueSerializer serializer) {
        this.serializer = serializer;
        return this;
    }

    public String                getTestCaseName() { return testCaseName; }
    public ServiceRegistry       getRegistry()     { return registry; }
    public List<BlockDescriptor> getBlocks()       { return Collections.unmodifiableList(blocks); }

    // ── Run ───────────────────────────────────────────────────────────────

    /**
     * Runs every block in order. Scoped services are released once the
     * outcome is known, before this method returns or throws.
     *
     * @return per-block outcome of a successful run
     * @throws ConfigurationException        if the pipeline is wired incorrectly; no block has run
     * @throws UnresolvedDependencyException if a block's dependency cannot be satisfied
     * @throws ServiceException              if a registered {@link TestLogger} cannot be created; no block has run
     * @throws Exception                     the exact failure raised by the first failing block
     */
    public RunResult run() throws Exception {
        List<BlockDescriptor> pipeline = List.copyOf(blocks);
        ServiceScope     scope   = registry.createScope(testCaseName);
        ExecutionContext context;
        try {
            context = new ExecutionContext(testCaseName, scope,
                    resolveLogger(scope), resolveSerializer(), config.isLogDebugValues());
        } catch (RuntimeException | Error e) {
            for (Exception disposalFailure : scope.dispose()) {
                e.addSuppressed(disposalFailure);
            }
            throw e;
        }

        RunResult result;
        try {
            result = executor.execute(pipeline, context);
        } catch (Exception | Error e) {
            for (Exception disposalFailure : context.release()) {
                e.addSuppressed(disposalFailure);
            }
            throw e;
        }
        List<Exception> disposalFailures = context.release();
        if (!disposalFailures.isEmpty()) {
            log.warn("Test case '{}' passed but {} scoped service(s) failed to dispose",
                    testCaseName, disposalFailures.size());
        }
        return result;
    }

    private TestLogger resolveLogger(ServiceScope scope) {
        Optional<TestLogger> registered = scope.find(LOGGER_KEY);
        if (registered.isPresent()) {
            return registered.get();
        }
        return logger != null ? logger : new Slf4jTestLogger();
    }

    private ValueSerializer resolveSerializer() {
        return serializer != null ? serializer : new JsonValueSerializer(config);
    }

    private static String callerMethodName() {
        return StackWalker.getInstance().walk(frames -> frames
                .filter(f -> !f.getClassName().equals(TestBuilder.class.getName()))
                .findFirst()
                .map(StackWalker.StackFrame::getMethodName)
                .orElse("TestCase"));
    }
}
