package su.grinev.intern.pool;

import org.junit.jupiter.api.Test;

import su.grinev.intern.exception.PoolPoisonedException;

import java.lang.ref.Cleaner;

import static org.junit.jupiter.api.Assertions.*;

public class AutoReleaseTest {

    private final InternPool<String> pool = new InternPool<>("released", 16, Cleaner.create(), true);

    @Test
    void testUnreachableHandleIsReleased() throws InterruptedException {
        internAndForget("leaked");
        assertEquals(1, pool.size());

        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.size() > 0 && System.currentTimeMillis() < deadline) {
            System.gc();
            Thread.sleep(20);
        }

        assertEquals(0, pool.size());
        assertEquals(1, pool.stats().getAutoReleased());
        assertEquals(1, pool.stats().getEvictions());
    }

    @Test
    void testExplicitCloseIsNotCountedAsAutoRelease() {
        Interned<String> handle = pool.intern("closed");
        handle.close();
        handle.close();

        assertEquals(0, pool.size());
        assertEquals(0, pool.stats().getAutoReleased());
        assertEquals(1, pool.stats().getEvictions());
    }

    @Test
    void testCopyOfTemporaryHandleSurvivesCollection() {
        for (int i = 0; i < 20_000; i++) {
            Interned<String> copy = pool.intern(new String("temporary")).copy();
            assertEquals("temporary", copy.get());
            assertTrue(copy.refCount() >= 1);
            copy.close();
            if (i % 1_000 == 0) {
                System.gc();
            }
        }
    }

    @Test
    void testCleanerReleaseOfPoisonedPoolIsContained() throws InterruptedException {
        InternPool<PoisonedPoolTest.Fragile> fragile = new InternPool<>("fragile", 16, Cleaner.create(), true);
        Interned<PoisonedPoolTest.Fragile> closed = fragile.intern(new PoisonedPoolTest.Fragile(2, false));
        forget(fragile.intern(new PoisonedPoolTest.Fragile(1, false)));
        assertThrows(IllegalArgumentException.class, () -> fragile.intern(new PoisonedPoolTest.Fragile(1, true)));

        long deadline = System.currentTimeMillis() + 10_000;
        while (fragile.stats().getAutoReleased() == 0 && System.currentTimeMillis() < deadline) {
            System.gc();
            Thread.sleep(20);
        }

        assertEquals(1, fragile.stats().getAutoReleased());
        assertTrue(fragile.isPoisoned());
        // explicit close still reports the failure to the caller
        assertThrows(PoolPoisonedException.class, closed::close);
    }

    private static void forget(Interned<?> handle) {
        assertFalse(handle.isDisposed());
    }

    private void internAndForget(String value) {
        Interned<String> handle = pool.intern(new String(value));
        assertEquals(value, handle.get());
    }
}
