package com.agenttrace.core;

/**
 * Restores an ambient slot to the value it held before a push. Single use, and only on the thread
 * that made the push.
 */
public final class ContextToken<T> {

    private final ThreadLocal<T> slot;
    private final T previous;
    private final Thread owner;
    private boolean used;

    ContextToken(ThreadLocal<T> slot, T previous) {
        this.slot = slot;
        this.previous = previous;
        this.owner = Thread.currentThread();
    }

    /**
     * @throws IllegalStateException if already used, or called from another thread
     */
    public void reset() {
        if (used) {
            throw new IllegalStateException("Context token has already been used");
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Context token was created on thread '" + owner.getName()
                + "' and cannot be reset on '" + Thread.currentThread().getName() + "'");
        }
        used = true;
        if (previous == null) {
            slot.remove();
        } else {
            slot.set(previous);
        }
    }
}
