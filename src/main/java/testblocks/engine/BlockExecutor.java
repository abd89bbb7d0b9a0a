package testblocks.engine;

import testblocks.block.BlockDefinition;
import testblocks.block.BlockDescriptor;
import testblocks.block.BlockState;
import testblocks.block.PropertyBinding;
import testblocks.logging.TestLogger;
import testblocks.model.TypeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a pipeline of blocks, one at a time, in order.
 *
 * <p>For each block the executor:
 * <ol>
 *   <li>resolves constructor arguments, entry-point arguments and injectable
 *       property values through the {@link DependencyResolver};</li>
 *   <li>constructs the block and assigns its properties;</li>
 *   <li>calls the entry point;</li>
 *   <li>stores a non-null result in the run's {@link ResultStore}, replacing
 *       any earlier value under the same key.</li>
 * </ol>
 *
 * <p>Every phase change is reported to the run's {@link TestLogger}. The
 * first failure stops the pipeline and is rethrown as-is: resolution and
 * configuration problems as engine exceptions, entry-point failures as the
 * exact throwable the block raised. Explicit arguments of every block are
 * validated before the first block starts.
 */
public class BlockExecutor {

    private static final Logger log = LoggerFactory.getLogger(BlockExecutor.class);

    private final DependencyResolver resolver;

    public BlockExecutor() {
        this(new DependencyResolver());
    }

    public BlockExecutor(DependencyResolver resolver) {
        this.resolver = resolver;
    }

    // ── Pipeline ──────────────────────────────────────────────────────────

    /**
     * Runs every block of {@code pipeline} against {@code context}. Does not
     * release the context.
     *
     * @return the per-block outcome when every block completed
     * @throws ConfigurationException        if any descriptor's explicit arguments are invalid
     * @throws UnresolvedDependencyException if a block's dependency cannot be satisfied
     * @throws Exception                     whatever a block's constructor or entry point raised
     */
    public RunResult execute(List<BlockDescriptor> pipeline, ExecutionContext context) throws Exception {
        String runName = context.getRunName();
        int    total   = pipeline.size();
        long   start   = System.nanoTime();

        log.info("Starting test case '{}' with {} test block(s)", runName, total);

        for (BlockDescriptor descriptor : pipeline) {
            try {
                resolver.validate(descriptor);
            } catch (ConfigurationException e) {
                context.getLogger().error(runName, descriptor.getName(), e.getMessage());
                throw e;
            }
        }

        List<BlockRecord> records = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            records.add(executeBlock(pipeline.get(i).getDefinition(), pipeline.get(i), i, total, context));
        }

        log.info("Test case '{}' completed: {}/{} test block(s) passed", runName, total, total);
        return new RunResult(runName, records, context.getResults().snapshot(), since(start));
    }

    // ── Single block ──────────────────────────────────────────────────────

    private <B> BlockRecord executeBlock(BlockDefinition<B> definition, BlockDescriptor descriptor,
                                         int index, int total, ExecutionContext context) throws Exception {
        String     runName = context.getRunName();
        String     name    = definition.getName();
        TestLogger logger  = context.getLogger();
        long       start   = System.nanoTime();
        BlockState state   = BlockState.PENDING;

        logger.info(runName, name, "Starting test block " + (index + 1) + "/" + total);
        try {
            state = transition(context, name, state, BlockState.RESOLVING);
            Object[] constructorArgs = resolver.resolveAll(definition.getConstructorParameters(), name, context);
            Object[] args            = resolver.resolveEntryArguments(descriptor, context);
            Map<PropertyBinding<B, ?>, Object> propertyValues = resolveProperties(definition, context);

            B block = definition.instantiate(constructorArgs);
            for (Map.Entry<PropertyBinding<B, ?>, Object> p : propertyValues.entrySet()) {
                p.getKey().set(block, p.getValue());
            }
            state = transition(context, name, state, BlockState.INSTANTIATED);
            logInputs(definition, block, args, context);

            state = transition(context, name, state, BlockState.INVOKING);
            Object result = invoke(definition, block, args);
            if (result != null) {
                store(definition, result, context);
            }

            state = transition(context, name, state, BlockState.COMPLETED);
            logger.info(runName, name, "Test block completed");
            return new BlockRecord(index, name, state, since(start));
        } catch (Exception e) {
            fail(context, name, state, e);
            throw e;
        } catch (Error e) {
            fail(context, name, state, e);
            throw e;
        }
    }

    private <B> Map<PropertyBinding<B, ?>, Object> resolveProperties(BlockDefinition<B> definition,
                                                                     ExecutionContext context) {
        String name = definition.getName();
        Map<PropertyBinding<B, ?>, Object> values = new LinkedHashMap<>();
        for (PropertyBinding<B, ?> property : definition.getProperties()) {
            if (!property.isWritable()) {
                context.getLogger().debug(context.getRunName(), name,
                        "Skipping property " + property.getName() + ": no setter");
                continue;
            }
            values.put(property, resolver.resolve(property.getKey(), name, context));
        }
        return values;
    }

    private static <B> Object invoke(BlockDefinition<B> definition, B block, Object[] args) throws Exception {
        return definition.invoke(block, args);
    }

    private void store(BlockDefinition<?> definition, Object result, ExecutionContext context) {
        String     name = definition.getName();
        TypeKey<?> key  = definition.getOutputKey() != null
                ? definition.getOutputKey()
                : TypeKey.ofValue(result);
        if (!key.accepts(result)) {
            throw new ConfigurationException("Test block '" + name + "' returned a "
                    + result.getClass().getName() + " but declares its result as " + key.id());
        }
        Object replaced = context.getResults().put(key, result);
        if (replaced != null) {
            context.getLogger().debug(context.getRunName(), name, "Replaced earlier " + key + " result");
        }
        context.getLogger().testBlockOutput(context.getRunName(), name, context.serialize(result));
    }

    // ── Logging ───────────────────────────────────────────────────────────

    private <B> void logInputs(BlockDefinition<B> definition, B block, Object[] args, ExecutionContext context) {
        String     runName = context.getRunName();
        String     name    = definition.getName();
        TestLogger logger  = context.getLogger();

        if (context.isLogDebugValues()) {
            for (PropertyBinding<B, ?> property : definition.getProperties()) {
                if (property.isReadable()) {
                    logger.debug(runName, name, "Using property " + property.getName()
                            + " with data: " + readProperty(property, block, context));
                }
            }
            for (Object arg : args) {
                logger.debug(runName, name, "Handing argument into entry point: " + context.serialize(arg));
            }
        }
        if (args.length > 0) {
            logger.testBlockInput(runName, name, context.serialize(Arrays.asList(args)));
        }
    }

    private static <B> String readProperty(PropertyBinding<B, ?> property, B block, ExecutionContext context) {
        try {
            return context.serialize(property.get(block));
        } catch (RuntimeException e) {
            log.warn("[{}] Could not read property {}: {}", context.getRunName(), property.getName(), e.getMessage());
            return "[unreadable: " + e.getClass().getSimpleName() + "]";
        }
    }

    private static BlockState transition(ExecutionContext context, String blockName,
                                         BlockState from, BlockState to) {
        context.getLogger().debug(context.getRunName(), blockName, "Phase " + from + " -> " + to);
        return to;
    }

    private static void fail(ExecutionContext context, String blockName, BlockState from, Throwable t) {
        context.getLogger().error(context.getRunName(), blockName,
                "Test block failed while " + from + ": " + t);
        transition(context, blockName, from, BlockState.FAILED);
        log.debug("[{}] {} failed", context.getRunName(), blockName, t);
    }

    private static Duration since(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
