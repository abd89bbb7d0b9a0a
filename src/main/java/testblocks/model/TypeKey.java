package testblocks.model;

import java.util.Objects;

/**
 * Stable identifier for a dependency or result type.
 *
 * <p>Keys compare by exact class and optional qualifier. A key for
 * {@code Foo} never matches a key for an interface {@code Foo} implements:
 * there is no assignability check anywhere in lookup. Primitive classes are
 * keyed as their wrapper, so {@code of(int.class)} equals {@code of(Integer.class)}.
 *
 * <pre>{@code
 * TypeKey<Credentials> admin = TypeKey.named(Credentials.class, "admin");
 * TypeKey<HomePage>    home  = TypeKey.of(HomePage.class);
 * }</pre>
 */
public final class TypeKey<T> {

    private final Class<T> type;
    private final String   qualifier;

    @SuppressWarnings("unchecked")
    private TypeKey(Class<T> type, String qualifier) {
        this.type      = (Class<T>) boxed(Objects.requireNonNull(type, "type"));
        this.qualifier = qualifier;
    }

    public static <T> TypeKey<T> of(Class<T> type) {
        return new TypeKey<>(type, null);
    }

    public static <T> TypeKey<T> named(Class<T> type, String qualifier) {
        if (qualifier == null || qualifier.isBlank()) {
            throw new IllegalArgumentException("qualifier must not be blank");
        }
        return new TypeKey<>(type, qualifier);
    }

    /** Key for the runtime class of {@code value}. */
    @SuppressWarnings("unchecked")
    public static <T> TypeKey<T> ofValue(T value) {
        Objects.requireNonNull(value, "value");
        return (TypeKey<T>) of(value.getClass());
    }

    public Class<T> getType()      { return type; }
    public String   getQualifier() { return qualifier; }

    /** {@code type.getName()}, suffixed with {@code #qualifier} when qualified. */
    public String id() {
        return qualifier == null ? type.getName() : type.getName() + "#" + qualifier;
    }

    /** True if {@code value} is null or an instance of this key's class. */
    public boolean accepts(Object value) {
        return value == null || type.isInstance(value);
    }

    public T cast(Object value) {
        return type.cast(value);
    }

    private static Class<?> boxed(Class<?> c) {
        if (!c.isPrimitive()) return c;
        if (c == int.class)     return Integer.class;
        if (c == long.class)    return Long.class;
        if (c == boolean.class) return Boolean.class;
        if (c == double.class)  return Double.class;
        if (c == float.class)   return Float.class;
        if (c == short.class)   return Short.class;
        if (c == byte.class)    return Byte.class;
        if (c == char.class)    return Character.class;
        return Void.class;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeKey)) return false;
        TypeKey<?> other = (TypeKey<?>) o;
        return type.equals(other.type) && Objects.equals(qualifier, other.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, qualifier);
    }

    @Override
    public String toString() {
        return qualifier == null
                ? type.getSimpleName()
                : type.getSimpleName() + "(" + qualifier + ")";
    }
}
