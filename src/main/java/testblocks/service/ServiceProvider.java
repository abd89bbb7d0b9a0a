package testblocks.service;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/**
 * Manufactures an instance of a requested service type.
 *
 * <p>The scope passed in is the current run's view of the registry, so a
 * factory may request the other services it is built from.
 */
@FunctionalInterface
public interface ServiceProvider<T> {

    T provide(ServiceScope scope) throws Exception;

    /** Always returns {@code value}. */
    static <T> ServiceProvider<T> instance(T value) {
        Objects.requireNonNull(value, "value");
        return scope -> value;
    }

    /**
     * Creates a new {@code type} through its public no-argument constructor
     * each time it is called. Lifetime decides how often that is.
     */
    static <T> ServiceProvider<T> constructing(Class<? extends T> type) {
        Objects.requireNonNull(type, "type");
        return scope -> {
            Constructor<? extends T> ctor;
            try {
                ctor = type.getConstructor();
            } catch (NoSuchMethodException e) {
                throw new ServiceException(type.getName()
                        + " has no public no-argument constructor", e);
            }
            try {
                return ctor.newInstance();
            } catch (InvocationTargetException e) {
                Throwable target = e.getTargetException();
                if (target instanceof Exception) throw (Exception) target;
                if (target instanceof Error) throw (Error) target;
                throw e;
            }
        };
    }
}
