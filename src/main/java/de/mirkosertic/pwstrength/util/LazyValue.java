package de.mirkosertic.pwstrength.util;

import org.jspecify.annotations.Nullable;

import java.util.function.Supplier;

/**
 * Value built on first use and cached until {@link #reset()}.
 *
 * <p>Concurrent first calls to {@link #get()} are serialized, so the supplier runs exactly once per
 * build. Once built, reads do not take the lock.</p>
 *
 * @param <T> type of the cached value
 */
public final class LazyValue<T> {

    private final Supplier<T> supplier;
    private final Object lock = new Object();
    private volatile @Nullable T value;

    public LazyValue(final Supplier<T> supplier) {
        this.supplier = supplier;
    }

    public T get() {
        T result = value;
        if (result != null) {
            return result;
        }
        synchronized (lock) {
            result = value;
            if (result == null) {
                result = supplier.get();
                if (result == null) {
                    throw new IllegalStateException("Supplier returned null");
                }
                value = result;
            }
            return result;
        }
    }

    public boolean isBuilt() {
        return value != null;
    }

    /**
     * Drop the cached value. The next {@link #get()} builds it again.
     */
    public void reset() {
        synchronized (lock) {
            value = null;
        }
    }
}
