package testblocks.service;

import testblocks.model.TypeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One run's view of a {@link ServiceRegistry}.
 *
 * <p>Scoped entries are created at most once per scope and disposed, newest
 * first, by {@link #dispose()}. Singleton requests are delegated to the
 * registry. A scope belongs to a single run and is not thread-safe.
 */
public class ServiceScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceScope.class);

    private final ServiceRegistry          registry;
    private final String                   runName;
    private final Map<TypeKey<?>, Object>  instances   = new HashMap<>();
    private final Deque<AutoCloseable>     disposables = new ArrayDeque<>();
    private final Set<TypeKey<?>>          creating    = new LinkedHashSet<>();
    private boolean disposed;

    ServiceScope(ServiceRegistry registry, String runName) {
        this.registry = registry;
        this.runName  = runName;
    }

    public String getRunName() { return runName; }

    // ── Resolution ────────────────────────────────────────────────────────

    /**
     * Looks up the service registered under exactly {@code key}.
     *
     * @return the instance, or empty when nothing is registered under the key
     * @throws ServiceException if an entry exists but its provider fails
     */
    public <T> Optional<T> find(TypeKey<T> key) {
        if (disposed) {
            throw new IllegalStateException("Service scope for run '" + runName + "' has been disposed");
        }
        Object cached = instances.get(key);
        if (cached != null) {
            return Optional.of(key.cast(cached));
        }
        Optional<ServiceEntry<T>> entry = registry.find(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (entry.get().getLifetime() == Lifetime.SINGLETON) {
            return Optional.of(registry.singleton(entry.get(), this));
        }

        T created = create(entry.get());
        instances.put(key, created);
        if (created instanceof AutoCloseable) {
            disposables.push((AutoCloseable) created);
        }
        log.debug("[{}] Created scoped service {}", runName, key);
        return Optional.of(created);
    }

    /**
     * @throws ServiceException if nothing is registered under {@code key} or
     *                          its provider fails
     */
    public <T> T get(TypeKey<T> key) {
        return find(key).orElseThrow(() ->
                new ServiceException("No service registered for " + key.id()));
    }

    public <T> T get(Class<T> type) {
        return get(TypeKey.of(type));
    }

    /** Runs {@code entry}'s provider, guarding against provider cycles. */
    <T> T create(ServiceEntry<T> entry) {
        TypeKey<T> key = entry.getKey();
        if (!creating.add(key)) {
            throw new ServiceException("Circular service dependency: " + creating + " -> " + key);
        }
        try {
            T value = entry.getProvider().provide(this);
            if (value == null) {
                throw new ServiceException("Provider for " + key.id() + " returned null");
            }
            if (!key.accepts(value)) {
                throw new ServiceException("Provider for " + key.id() + " returned a "
                        + value.getClass().getName());
            }
            return value;
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ServiceException("Provider for " + key.id() + " failed: " + e.getMessage(), e);
        } finally {
            creating.remove(key);
        }
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /** Number of scoped instances created so far in this scope. */
    public int getScopedInstanceCount() {
        return instances.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Closes every {@link AutoCloseable} scoped instance, newest first. Runs
     * once; later calls return an empty list.
     *
     * @return the failures raised by individual {@code close()} calls
     */
    public List<Exception> dispose() {
        if (disposed) {
            return List.of();
        }
        disposed = true;
        List<Exception> failures = new ArrayList<>();
        while (!disposables.isEmpty()) {
            AutoCloseable resource = disposables.pop();
            try {
                resource.close();
                log.debug("[{}] Disposed scoped service {}", runName, resource.getClass().getSimpleName());
            } catch (Exception e) {
                log.warn("[{}] Failed to dispose scoped service {}: {}",
                        runName, resource.getClass().getName(), e.getMessage());
                failures.add(e);
            }
        }
        instances.clear();
        return failures;
    }

    @Override
    public void close() {
        dispose();
    }
}
