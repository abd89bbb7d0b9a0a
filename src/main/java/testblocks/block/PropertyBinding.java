package testblocks.block;

import testblocks.model.TypeKey;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * An injectable property on a block instance.
 *
 * <p>A binding without a setter is reported and skipped during population;
 * the getter, when present, is only used to log the populated value.
 */
public final class PropertyBinding<B, T> {

    private final String               name;
    private final TypeKey<T>           key;
    private final BiConsumer<B, T>     setter;
    private final Function<B, T>       getter;

    PropertyBinding(String name, TypeKey<T> key, BiConsumer<B, T> setter, Function<B, T> getter) {
        this.name   = name;
        this.key    = key;
        this.setter = setter;
        this.getter = getter;
    }

    public String     getName() { return name; }
    public TypeKey<T> getKey()  { return key; }

    public boolean isWritable() { return setter != null; }
    public boolean isReadable() { return getter != null; }

    /** Assigns {@code value}, which must be accepted by {@link #getKey()}. */
    public void set(B block, Object value) {
        if (setter == null) {
            throw new IllegalStateException("Property '" + name + "' has no setter");
        }
        setter.accept(block, key.cast(value));
    }

    public T get(B block) {
        if (getter == null) {
            throw new IllegalStateException("Property '" + name + "' has no getter");
        }
        return getter.apply(block);
    }

    @Override
    public String toString() {
        return name + ":" + key + (setter == null ? " (read-only)" : "");
    }
}
