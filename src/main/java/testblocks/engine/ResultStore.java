package testblocks.engine;

import testblocks.model.TypeKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run map from result key to the most recent value produced under it.
 *
 * <p>Inserting under a key that already holds a value replaces that value:
 * a later block asking for the key only ever sees the newest result.
 * Lookup is by exact key; no assignability is considered.
 */
public class ResultStore {

    private final Map<TypeKey<?>, Object> values = new LinkedHashMap<>();

    public <T> Optional<T> find(TypeKey<T> key) {
        Object value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(key.cast(value));
    }

    public boolean contains(TypeKey<?> key) {
        return values.containsKey(key);
    }

    /**
     * Stores {@code value} under {@code key}.
     *
     * @return the value it replaced, or {@code null}
     * @throws IllegalArgumentException if value is null or not an instance of the key's class
     */
    public Object put(TypeKey<?> key, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Cannot store null under " + key.id());
        }
        if (!key.accepts(value)) {
            throw new IllegalArgumentException(value.getClass().getName()
                    + " cannot be stored as " + key.id());
        }
        // remove first so the key moves to the end of the iteration order
        Object previous = values.remove(key);
        values.put(key, value);
        return previous;
    }

    public int size() {
        return values.size();
    }

    /** Immutable copy in insertion order of the latest write per key. */
    public Map<TypeKey<?>, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
