package io.tabula.kernel;

import java.util.function.UnaryOperator;

/**
 * Copy-on-write slot: a value either exclusively owned by one handle or shared with others.
 * <p>
 * {@link #share()} marks the slot shared and returns a second, shared slot over the same value
 * for the other handle. The flag is set once and never cleared, so a slot may be shared from
 * several threads at once without further coordination.
 * <p>
 * Shared values are never mutated in place. A handle that needs to mutate calls
 * {@link #toOwned(UnaryOperator)} first and stores the returned slot.
 */
public final class Cow<T> {
    private final T value;
    private volatile boolean shared;

    private Cow(T value, boolean shared) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
        this.value = value;
        this.shared = shared;
    }

    public static <T> Cow<T> owned(T value) {
        return new Cow<>(value, false);
    }

    public static <T> Cow<T> shared(T value) {
        return new Cow<>(value, true);
    }

    public T get() {
        return value;
    }

    public boolean isOwned() {
        return !shared;
    }

    /**
     * Marks this slot shared and returns a shared slot over the same value.
     */
    public Cow<T> share() {
        shared = true;
        return new Cow<>(value, true);
    }

    /**
     * Returns this slot when owned, otherwise an owned slot holding {@code copier(get())}.
     */
    public Cow<T> toOwned(UnaryOperator<T> copier) {
        if (!shared) {
            return this;
        }
        if (copier == null) {
            throw new IllegalArgumentException("copier required");
        }
        return new Cow<>(copier.apply(value), false);
    }

    @Override
    public String toString() {
        return (shared ? "Shared[" : "Owned[") + value + "]";
    }
}
