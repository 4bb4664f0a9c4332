package su.grinev.intern.pool;

import lombok.extern.slf4j.Slf4j;

import java.lang.ref.Cleaner;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one {@link InternPool} per value type, created on first use.
 */
@Slf4j
public class InternPoolFactory {

    private int initialCapacity = 64;
    private boolean autoRelease = true;
    private boolean statistics = true;
    private Cleaner cleaner;
    private final Map<Class<?>, InternPool<?>> pools = new ConcurrentHashMap<>();

    public InternPoolFactory(int initialCapacity, boolean autoRelease, boolean statistics) {
        this.initialCapacity = initialCapacity;
        this.autoRelease = autoRelease;
        this.statistics = statistics;
    }

    public InternPoolFactory() {

    }

    public static InternPoolFactory getDefault() {
        return DefaultHolder.INSTANCE;
    }

    @SuppressWarnings("unchecked")
    public <T> InternPool<T> getPool(Class<T> type) {
        return (InternPool<T>) pools.computeIfAbsent(type, t -> {
            log.debug("Creating intern pool for {}", t.getName());
            return new InternPool<>(t.getName(), initialCapacity, getCleaner(), statistics);
        });
    }

    // Keyed by the runtime class: equal values of different implementation classes stay apart.
    public <T> Interned<T> intern(T value) {
        @SuppressWarnings("unchecked")
        Class<T> type = (Class<T>) value.getClass();
        return getPool(type).intern(value);
    }

    @SuppressWarnings("unchecked")
    public <T> Interned<T> intern(Class<? super T> type, T value) {
        Objects.requireNonNull(value, "value");
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(value.getClass().getName() + " is not a " + type.getName());
        }
        InternPool<T> pool = (InternPool<T>) (InternPool<?>) getPool(type);
        return pool.intern(value);
    }

    // Does not create the pool.
    public int size(Class<?> type) {
        InternPool<?> pool = pools.get(type);
        return pool == null ? 0 : pool.size();
    }

    public Map<Class<?>, InternPool<?>> getPools() {
        return new HashMap<>(pools);
    }

    public Map<Class<?>, PoolStats> getStats() {
        Map<Class<?>, PoolStats> stats = new HashMap<>();
        pools.forEach((type, pool) -> stats.put(type, pool.stats()));
        return stats;
    }

    public void clear() {
        log.debug("Clearing {} intern pools", pools.size());
        pools.values().stream()
                .filter(pool -> !pool.isPoisoned())
                .forEach(InternPool::clear);
        pools.clear();
    }

    private synchronized Cleaner getCleaner() {
        if (autoRelease && cleaner == null) {
            cleaner = Cleaner.create();
        }
        return cleaner;
    }

    private static class DefaultHolder {
        private static final InternPoolFactory INSTANCE = new InternPoolFactory();
    }

    public static class Builder {

        private final InternPoolFactory instance = new InternPoolFactory();

        public static Builder builder() {
            return new Builder();
        }

        public Builder setInitialCapacity(int initialCapacity) {
            instance.initialCapacity = initialCapacity;
            return this;
        }

        public Builder setAutoRelease(boolean autoRelease) {
            instance.autoRelease = autoRelease;
            return this;
        }

        public Builder setStatistics(boolean statistics) {
            instance.statistics = statistics;
            return this;
        }

        public InternPoolFactory build() {
            return instance;
        }
    }
}
