package su.grinev.intern.exception;

/**
 * Thrown by every index operation of a pool whose critical section was left abnormally.
 * The canonical mapping can no longer be trusted, so the pool refuses to answer.
 */
public class PoolPoisonedException extends IllegalStateException {

    public PoolPoisonedException(String poolName, Throwable cause) {
        super("Intern pool " + poolName + " is poisoned", cause);
    }
}
