package su.grinev.intern.pool;

import lombok.extern.slf4j.Slf4j;
import su.grinev.intern.exception.PoolPoisonedException;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared reference to a canonical instance held by an {@link InternPool}.
 * <p>
 * Equality, hashing and natural ordering are identity based: two handles are equal iff they point to the same pool
 * entry. The hash is the value's hash computed once at insertion; the ordering follows entry creation order. Every
 * handle must be closed exactly once; additional closes are ignored. When the pool was built with auto release, a
 * handle that becomes unreachable without being closed is released by the pool's cleaner.
 */
@Slf4j
public final class Interned<T> implements Disposable, Comparable<Interned<?>> {

    private final InternPool.Entry<T> entry;
    private final Release<T> release;
    private final Cleaner.Cleanable cleanable;

    Interned(InternPool.Entry<T> entry) {
        this.entry = entry;
        this.release = new Release<>(entry);
        Cleaner cleaner = entry.pool.getCleaner();
        this.cleanable = cleaner != null ? cleaner.register(this, release) : null;
    }

    // The fences keep this handle reachable, otherwise the cleaner may release it while it is still in use.
    public T get() {
        try {
            ensureLive();
            return entry.value;
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    public Interned<T> copy() {
        try {
            ensureLive();
            if (!entry.tryRetain()) {
                throw new IllegalStateException("Interned value was already evicted");
            }
            return new Interned<>(entry);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    public int refCount() {
        try {
            return entry.refs.get();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    @Override
    public void dispose() {
        release.explicit = true;
        if (cleanable != null) {
            cleanable.clean();
        } else {
            release.run();
        }
    }

    @Override
    public boolean isDisposed() {
        return release.released.get();
    }

    public static <T extends Comparable<? super T>> Comparator<Interned<T>> byValue() {
        return Comparator.comparing(Interned<T>::get);
    }

    @Override
    public int compareTo(Interned<?> other) {
        return Long.compare(entry.id, other.entry.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interned<?> other)) return false;
        return entry == other.entry;
    }

    @Override
    public int hashCode() {
        return entry.hash;
    }

    @Override
    public String toString() {
        return String.valueOf(entry.value);
    }

    private void ensureLive() {
        if (release.released.get()) {
            throw new IllegalStateException("Interned handle is already disposed");
        }
    }

    // Must not reference the handle, otherwise the cleaner never fires.
    private static final class Release<T> implements Runnable {
        private final InternPool.Entry<T> entry;
        private final AtomicBoolean released = new AtomicBoolean(false);
        private volatile boolean explicit;

        private Release(InternPool.Entry<T> entry) {
            this.entry = entry;
        }

        @Override
        public void run() {
            if (released.compareAndSet(false, true)) {
                if (!explicit) {
                    entry.pool.onAutoRelease(entry);
                }
                try {
                    entry.release();
                } catch (PoolPoisonedException e) {
                    if (explicit) {
                        throw e;
                    }
                    // the cleaner thread drops exceptions
                    log.error("Could not release entry #{} of a poisoned pool", entry.id, e);
                }
            }
        }
    }
}
