package testblocks.service;

import testblocks.model.TypeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Type-keyed catalog of service providers, shared by every run of the
 * pipelines built against it.
 *
 * <p>At most one entry exists per key; registering a key again replaces the
 * previous entry. Singleton instances are created lazily on first request
 * and live until {@link #close()}. Scoped instances never live here: each
 * run gets its own {@link ServiceScope}.
 *
 * <p>Registration and singleton creation are synchronized, so independent
 * runs may resolve from the same registry concurrently.
 */
public class ServiceRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<TypeKey<?>, ServiceEntry<?>> entries = new ConcurrentHashMap<>();

    /** Guarded by {@code this}. */
    private final Map<TypeKey<?>, Object> singletons = new HashMap<>();

    /** Singletons this registry created, in creation order. Guarded by {@code this}. */
    private final Deque<Object> ownedSingletons = new ArrayDeque<>();

    private boolean closed;

    // ── Registration ──────────────────────────────────────────────────────

    /**
     * Adds {@code entry}, replacing any entry already registered under its key.
     * A singleton already created for the replaced entry stays owned by this
     * registry until {@link #close()} but is no longer handed out.
     */
    public synchronized <T> ServiceRegistry register(ServiceEntry<T> entry) {
        ensureOpen();
        ServiceEntry<?> previous = entries.put(entry.getKey(), entry);
        singletons.remove(entry.getKey());
        if (previous != null) {
            log.debug("Replaced {} with {}", previous, entry);
        } else {
            log.debug("Registered {}", entry);
        }
        return this;
    }

    public <T> ServiceRegistry registerInstance(TypeKey<T> key, T value) {
        return register(ServiceEntry.ofInstance(key, value));
    }

    public <T> ServiceRegistry registerFactory(TypeKey<T> key, Lifetime lifetime, ServiceProvider<T> provider) {
        return register(ServiceEntry.ofFactory(key, lifetime, provider));
    }

    public <T> ServiceRegistry registerType(TypeKey<T> key, Lifetime lifetime, Class<? extends T> implementation) {
        return register(ServiceEntry.ofType(key, lifetime, implementation));
    }

    // ── Lookup ────────────────────────────────────────────────────────────

    /** Finds the entry registered under exactly {@code key}. */
    @SuppressWarnings("unchecked")
    public <T> Optional<ServiceEntry<T>> find(TypeKey<T> key) {
        return Optional.ofNullable((ServiceEntry<T>) entries.get(key));
    }

    public boolean isRegistered(TypeKey<?> key) {
        return entries.containsKey(key);
    }

    public Set<TypeKey<?>> getRegisteredKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    /** Opens a new per-run view of this registry. */
    public ServiceScope createScope(String runName) {
        ensureOpen();
        return new ServiceScope(this, runName);
    }

    /**
     * Returns the singleton for {@code entry}, creating it through
     * {@code requester} on first use.
     */
    synchronized <T> T singleton(ServiceEntry<T> entry, ServiceScope requester) {
        ensureOpen();
        TypeKey<T> key = entry.getKey();
        Object existing = singletons.get(key);
        if (existing != null) {
            return key.cast(existing);
        }
        T created = requester.create(entry);
        singletons.put(key, created);
        if (entry.getKind() != ServiceEntry.Kind.INSTANCE) {
            ownedSingletons.push(created);
        }
        log.debug("Created singleton {} ({})", key, created.getClass().getSimpleName());
        return created;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    /**
     * Disposes every {@link AutoCloseable} singleton this registry created,
     * newest first. Caller-supplied instances are left alone. Failures are
     * logged and do not stop the remaining disposals.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        while (!ownedSingletons.isEmpty()) {
            Object instance = ownedSingletons.pop();
            if (instance instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) instance).close();
                    log.debug("Disposed singleton {}", instance.getClass().getSimpleName());
                } catch (Exception e) {
                    log.warn("Failed to dispose singleton {}: {}",
                            instance.getClass().getName(), e.getMessage(), e);
                }
            }
        }
        singletons.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("ServiceRegistry has been closed");
        }
    }
}
