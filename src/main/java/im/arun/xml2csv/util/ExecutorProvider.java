package im.arun.xml2csv.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared bounded thread pool for converting independent inputs concurrently.
 */
public final class ExecutorProvider {
    private static volatile ExecutorService instance;
    private static volatile int poolSize;
    private static final Object LOCK = new Object();

    private ExecutorProvider() {}

    /**
     * Returns the shared executor, creating it with at most {@code maxThreads} workers
     * (never more than the number of available processors). The size of an executor that
     * already exists is kept.
     */
    public static ExecutorService getExecutor(int maxThreads) {
        if (instance == null) {
            synchronized (LOCK) {
                if (instance == null) {
                    poolSize = Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), maxThreads));
                    instance = Executors.newFixedThreadPool(poolSize, new ThreadFactory() {
                        private final AtomicInteger counter = new AtomicInteger(0);
                        @Override
                        public Thread newThread(Runnable r) {
                            Thread t = new Thread(r, "xml2csv-worker-" + counter.incrementAndGet());
                            t.setDaemon(true);
                            return t;
                        }
                    });
                }
            }
        }
        return instance;
    }

    public static int getPoolSize() {
        return poolSize;
    }

    /**
     * Shuts down the shared executor. Call this during application shutdown.
     */
    public static void shutdown() {
        synchronized (LOCK) {
            if (instance != null) {
                instance.shutdown();
                instance = null;
                poolSize = 0;
            }
        }
    }
}
