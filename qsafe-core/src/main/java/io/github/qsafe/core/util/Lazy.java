package io.github.qsafe.core.util;

import java.util.function.Supplier;

/**
 * A value computed the first time it is needed.
 *
 * @param <T> The type of the value.
 */
public final class Lazy<T> implements Supplier<T> {
    private Supplier<T> thunk;
    private T value;

    private Lazy(Supplier<T> thunk) {
        this.thunk = thunk;
    }

    public static <T> Lazy<T> lazy(Supplier<T> thunk) {
        return new Lazy<>(thunk);
    }

    @Override
    public T get() {
        if (thunk != null) {
            value = thunk.get();
            thunk = null;
        }
        return value;
    }
}
