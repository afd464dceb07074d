package org.hexa.pathfinding.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled once per search-loop iteration.
 *
 * <p>Tokens compare by identity so a context holding a live token never shares a cache slot
 * with one holding a different token.</p>
 */
public final class CancellationToken {

    /** Token that can never be cancelled. */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a fresh, not yet cancelled token.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Requests cancellation. Ignored for {@link #NONE}.
     */
    public void cancel() {
        if (cancellable) {
            cancelled.set(true);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken.NONE";
        }
        return "CancellationToken[cancelled=" + isCancelled() + "]";
    }
}
