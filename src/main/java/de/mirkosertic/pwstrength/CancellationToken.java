package de.mirkosertic.pwstrength;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by all matchers of one evaluation.
 *
 * <p>Matchers poll the token before expensive scans and abort via {@link #throwIfCancellationRequested()}.
 * The estimator turns the abort into an empty result, so cancellation never surfaces as an error
 * to callers.</p>
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(final boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Request cancellation. Idempotent.
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if cancellation was requested
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new CancellationException("Password evaluation cancelled");
        }
    }
}
