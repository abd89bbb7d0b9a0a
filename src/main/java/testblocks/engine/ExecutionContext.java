package testblocks.engine;

import testblocks.logging.TestLogger;
import testblocks.logging.ValueSerializer;
import testblocks.service.ServiceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * State owned by a single run: its name, result store, scoped services,
 * logger and serializer.
 *
 * <p>{@link #release()} disposes the scoped services exactly once, whatever
 * the run's outcome.
 */
public class ExecutionContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final String          runName;
    private final ResultStore     results;
    private final ServiceScope    services;
    private final TestLogger      logger;
    private final ValueSerializer serializer;
    private final boolean         logDebugValues;

    public ExecutionContext(String runName, ServiceScope services, TestLogger logger,
                            ValueSerializer serializer, boolean logDebugValues) {
        this.runName        = Objects.requireNonNull(runName, "runName");
        this.services       = Objects.requireNonNull(services, "services");
        this.logger         = Objects.requireNonNull(logger, "logger");
        this.serializer     = Objects.requireNonNull(serializer, "serializer");
        this.logDebugValues = logDebugValues;
        this.results        = new ResultStore();
    }

    public String          getRunName()       { return runName; }
    public ResultStore     getResults()       { return results; }
    public ServiceScope    getServices()      { return services; }
    public TestLogger      getLogger()        { return logger; }
    public boolean         isLogDebugValues() { return logDebugValues; }

    /** Serializes {@code value}; never throws. */
    public String serialize(Object value) {
        try {
            return serializer.serialize(value);
        } catch (RuntimeException e) {
            log.warn("[{}] Serializer {} failed: {}", runName, serializer.getClass().getName(), e.getMessage());
            return ValueSerializer.FALLBACK;
        }
    }

    public boolean isReleased() {
        return services.isDisposed();
    }

    /**
     * Disposes scoped services. Subsequent calls do nothing.
     *
     * @return failures raised while disposing
     */
    public List<Exception> release() {
        return services.dispose();
    }

    @Override
    public void close() {
        release();
    }
}
