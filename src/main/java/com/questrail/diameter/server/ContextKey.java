package com.questrail.diameter.server;

import java.util.Objects;

/**
 * Typed key for values stored in a {@link ConnContext}. Keys compare by
 * identity, so two keys with the same name never collide.
 */
public final class ContextKey<T>
{
    private final String name;
    private final Class<T> type;

    private ContextKey(String name, Class<T> type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public static <T> ContextKey<T> of(String name, Class<T> type) {
        return new ContextKey<>(name, type);
    }

    public String name() {
        return name;
    }

    Class<T> type() {
        return type;
    }

    @Override
    public String toString() {
        return "ContextKey[" + name + ':' + type.getSimpleName() + ']';
    }
}
