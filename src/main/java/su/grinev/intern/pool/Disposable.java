package su.grinev.intern.pool;

public interface Disposable extends AutoCloseable {

    void dispose();
    boolean isDisposed();

    @Override
    default void close() {
        dispose();
    }
}
