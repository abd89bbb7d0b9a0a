package testblocks.service;

import testblocks.model.TypeKey;

import java.util.Objects;

/**
 * One registration in a {@link ServiceRegistry}: the key it answers, its
 * lifetime, and how instances are produced.
 */
public final class ServiceEntry<T> {

    /** The shape of provider behind an entry. */
    public enum Kind {
        /** A fixed, caller-owned instance. */
        INSTANCE,
        /** A factory function. */
        FACTORY,
        /** A concrete type built through its no-argument constructor. */
        CONSTRUCTOR
    }

    private final TypeKey<T>         key;
    private final Lifetime           lifetime;
    private final Kind               kind;
    private final ServiceProvider<T> provider;

    private ServiceEntry(TypeKey<T> key, Lifetime lifetime, Kind kind, ServiceProvider<T> provider) {
        this.key      = Objects.requireNonNull(key, "key");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.kind     = kind;
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public static <T> ServiceEntry<T> ofInstance(TypeKey<T> key, T value) {
        Objects.requireNonNull(value, "value");
        if (!key.accepts(value)) {
            throw new IllegalArgumentException(value.getClass().getName()
                    + " cannot be registered as " + key.id());
        }
        return new ServiceEntry<>(key, Lifetime.SINGLETON, Kind.INSTANCE, ServiceProvider.instance(value));
    }

    public static <T> ServiceEntry<T> ofFactory(TypeKey<T> key, Lifetime lifetime, ServiceProvider<T> provider) {
        return new ServiceEntry<>(key, lifetime, Kind.FACTORY, provider);
    }

    public static <T> ServiceEntry<T> ofType(TypeKey<T> key, Lifetime lifetime, Class<? extends T> implementation) {
        return new ServiceEntry<>(key, lifetime, Kind.CONSTRUCTOR, ServiceProvider.constructing(implementation));
    }

    public TypeKey<T>         getKey()      { return key; }
    public Lifetime           getLifetime() { return lifetime; }
    public Kind               getKind()     { return kind; }
    public ServiceProvider<T> getProvider() { return provider; }

    @Override
    public String toString() {
        return String.format("ServiceEntry{%s, %s, %s}", key, lifetime, kind);
    }
}
