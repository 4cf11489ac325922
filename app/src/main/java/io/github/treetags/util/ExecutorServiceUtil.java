package io.github.treetags.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public final class ExecutorServiceUtil {
    private static final Logger logger = LogManager.getLogger(ExecutorServiceUtil.class);

    private ExecutorServiceUtil() {}

    /**
     * Fixed pool of daemon platform threads, each created with the requested stack size. A stack size of 0 leaves the
     * choice to the JVM.
     */
    public static ExecutorService newFixedThreadExecutor(int parallelism, String threadPrefix, long stackSize) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (stackSize < 0) {
            throw new IllegalArgumentException("stackSize must be >= 0, got " + stackSize);
        }
        var factory = new ThreadFactory() {
            private final ThreadGroup group = Thread.currentThread().getThreadGroup();
            private int count = 0;

            @Override
            public synchronized Thread newThread(Runnable r) {
                var t = new Thread(group, r, threadPrefix + ++count, stackSize);
                t.setDaemon(true);
                t.setUncaughtExceptionHandler(
                        (thr, ex) -> logger.error("Uncaught exception in thread {}", thr.getName(), ex));
                return t;
            }
        };
        return Executors.newFixedThreadPool(parallelism, factory);
    }
}
