package com.questrail.diameter.server;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable per-connection value store for application bookkeeping, such as
 * the peer's Origin-Host once capabilities have been exchanged.
 *
 * <p>It carries values only. Nothing in the connection core watches it, so
 * it cannot cancel or time out an in-flight read or write.</p>
 */
public final class ConnContext
{
    private static final ConnContext EMPTY = new ConnContext(Collections.emptyMap());

    private final Map<ContextKey<?>, Object> values;

    private ConnContext(Map<ContextKey<?>, Object> values) {
        this.values = values;
    }

    public static ConnContext empty() {
        return EMPTY;
    }

    /**
     * Returns a context holding every value of this one plus {@code key → value}.
     */
    public <T> ConnContext with(ContextKey<T> key, T value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Map<ContextKey<?>, Object> copy = new IdentityHashMap<>(values);
        copy.put(key, value);
        return new ConnContext(Collections.unmodifiableMap(copy));
    }

    public <T> Optional<T> get(ContextKey<T> key) {
        Objects.requireNonNull(key, "key");
        return Optional.ofNullable(values.get(key)).map(key.type()::cast);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "ConnContext" + values.keySet();
    }
}
