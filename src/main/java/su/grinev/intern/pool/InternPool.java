package su.grinev.intern.pool;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import su.grinev.intern.exception.PoolPoisonedException;

import java.lang.ref.Cleaner;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps exactly one canonical instance of every distinct value that still has a live {@link Interned} handle.
 * <p>
 * All index mutations ({@code intern} lookup-or-insert and the last-handle decrement-and-remove) run under the
 * monitor of the index, so an eviction and a concurrent intern of an equal value never interleave. Copying a handle
 * and dropping a handle that is not the last one only touch the entry's atomic counter.
 */
@Slf4j
public class InternPool<T> {

    private static final AtomicLong entryIds = new AtomicLong(0);

    @Getter
    private final String name;
    private final Map<T, Entry<T>> index;
    private final Cleaner cleaner;
    private final boolean statistics;
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong autoReleased = new AtomicLong(0);
    private volatile Throwable poison;

    public InternPool(String name, int initialCapacity, Cleaner cleaner, boolean statistics) {
        this.name = name;
        this.index = new HashMap<>(initialCapacity);
        this.cleaner = cleaner;
        this.statistics = statistics;
    }

    public InternPool(String name) {
        this(name, 64, null, true);
    }

    public Interned<T> intern(T value) {
        Objects.requireNonNull(value, "value");
        int hash = value.hashCode();
        Entry<T> entry;
        synchronized (index) {
            checkPoisoned();
            try {
                entry = index.get(value);
                if (entry != null) {
                    // entries reachable from the index always hold at least one reference
                    entry.refs.incrementAndGet();
                    if (statistics) {
                        hits.incrementAndGet();
                    }
                } else {
                    entry = new Entry<>(this, value, hash, entryIds.incrementAndGet());
                    index.put(value, entry);
                    if (statistics) {
                        misses.incrementAndGet();
                    }
                    log.trace("{}: interned new entry #{}", name, entry.id);
                }
            } catch (RuntimeException | Error e) {
                poisonWith(e);
                throw e;
            }
        }
        return new Interned<>(entry);
    }

    public int size() {
        synchronized (index) {
            checkPoisoned();
            return index.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean contains(T value) {
        Objects.requireNonNull(value, "value");
        synchronized (index) {
            checkPoisoned();
            try {
                return index.containsKey(value);
            } catch (RuntimeException | Error e) {
                poisonWith(e);
                throw e;
            }
        }
    }

    // Live handles become detached: their release no longer touches the index.
    public void clear() {
        synchronized (index) {
            checkPoisoned();
            log.debug("{}: clearing {} entries", name, index.size());
            index.clear();
        }
    }

    public boolean isPoisoned() {
        return poison != null;
    }

    public PoolStats stats() {
        int size;
        synchronized (index) {
            size = index.size();
        }
        return PoolStats.builder()
                .name(name)
                .size(size)
                .hits(hits.get())
                .misses(misses.get())
                .evictions(evictions.get())
                .autoReleased(autoReleased.get())
                .build();
    }

    Cleaner getCleaner() {
        return cleaner;
    }

    void onAutoRelease(Entry<T> entry) {
        if (statistics) {
            autoReleased.incrementAndGet();
        }
        log.debug("{}: handle to entry #{} was released without being closed", name, entry.id);
    }

    void releaseLast(Entry<T> entry) {
        synchronized (index) {
            checkPoisoned();
            try {
                if (entry.refs.decrementAndGet() == 0) {
                    // conditional on identity: a detached entry must not remove its successor
                    if (index.remove(entry.value, entry)) {
                        if (statistics) {
                            evictions.incrementAndGet();
                        }
                        log.trace("{}: evicted entry #{}", name, entry.id);
                    }
                }
            } catch (RuntimeException | Error e) {
                poisonWith(e);
                throw e;
            }
        }
    }

    private void checkPoisoned() {
        Throwable cause = poison;
        if (cause != null) {
            throw new PoolPoisonedException(name, cause);
        }
    }

    private void poisonWith(Throwable cause) {
        if (poison == null) {
            poison = cause;
            log.error("{}: critical section failed, pool is poisoned", name, cause);
        }
    }

    static final class Entry<T> {
        final InternPool<T> pool;
        final T value;
        final int hash;
        final long id;
        final AtomicInteger refs = new AtomicInteger(1);

        Entry(InternPool<T> pool, T value, int hash, long id) {
            this.pool = pool;
            this.value = value;
            this.hash = hash;
            this.id = id;
        }

        boolean tryRetain() {
            for (;;) {
                int current = refs.get();
                if (current == 0) {
                    return false;
                }
                if (refs.compareAndSet(current, current + 1)) {
                    return true;
                }
            }
        }

        void release() {
            for (;;) {
                int current = refs.get();
                if (current <= 1) {
                    pool.releaseLast(this);
                    return;
                }
                if (refs.compareAndSet(current, current - 1)) {
                    return;
                }
            }
        }
    }
}
