package su.grinev.intern;

import su.grinev.intern.pool.InternPoolFactory;
import su.grinev.intern.pool.Interned;

/**
 * Entry point backed by the process-wide {@link InternPoolFactory#getDefault() default factory}.
 * {@link #intern(Object)} keys pools by the runtime class of the value; use {@link #intern(Class, Object)} for values
 * whose implementation classes vary, such as collections.
 */
public final class Interner {

    private Interner() {
    }

    public static <T> Interned<T> intern(T value) {
        return InternPoolFactory.getDefault().intern(value);
    }

    public static <T> Interned<T> intern(Class<? super T> type, T value) {
        return InternPoolFactory.getDefault().intern(type, value);
    }

    public static int size(Class<?> type) {
        return InternPoolFactory.getDefault().size(type);
    }
}
