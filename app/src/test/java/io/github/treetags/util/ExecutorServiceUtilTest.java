package io.github.treetags.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutorServiceUtilTest {

    @Test
    void threadsAreNamedDaemons() throws Exception {
        var pool = ExecutorServiceUtil.newFixedThreadExecutor(2, "test-worker-", 1L << 20);
        try {
            var thread = pool.submit(Thread::currentThread).get();
            assertTrue(thread.getName().startsWith("test-worker-"));
            assertTrue(thread.isDaemon());
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> ExecutorServiceUtil.newFixedThreadExecutor(0, "x", 0));
        assertThrows(IllegalArgumentException.class, () -> ExecutorServiceUtil.newFixedThreadExecutor(1, "x", -1));
    }
}
