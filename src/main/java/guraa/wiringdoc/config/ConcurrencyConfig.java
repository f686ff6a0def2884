package guraa.wiringdoc.config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PreDestroy;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Configuration for the worker pool that crops rooms in parallel.
 */
@Slf4j
@Configuration
public class ConcurrencyConfig {

    private final int availableProcessors = Runtime.getRuntime().availableProcessors();

    @Value("${app.concurrency.room-threads:4}")
    @Getter @Setter
    private int roomThreads = Math.min(4, availableProcessors);

    @Value("${app.concurrency.shutdown-timeout-seconds:30}")
    @Getter @Setter
    private int shutdownTimeoutSeconds = 30;

    private ExecutorService roomProcessingExecutor;

    /**
     * Executor running one task per room: open sources, crop tracks, load data pages.
     */
    @Bean(name = "roomProcessingExecutor", destroyMethod = "")
    public ExecutorService roomProcessingExecutor() {
        int threads = Math.max(1, roomThreads);
        log.info("Creating room processing executor with {} threads", threads);
        roomProcessingExecutor = Executors.newFixedThreadPool(threads, createThreadFactory("room-", Thread.NORM_PRIORITY));
        return roomProcessingExecutor;
    }

    /**
     * Shut the room executor down, waiting for running rooms to finish.
     */
    @PreDestroy
    public void shutdown() {
        if (roomProcessingExecutor == null || roomProcessingExecutor.isShutdown()) {
            return;
        }
        try {
            log.debug("Shutting down room processing executor...");
            roomProcessingExecutor.shutdown();
            if (!roomProcessingExecutor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Room processing executor did not terminate in time, forcing shutdown");
                var remainingTasks = roomProcessingExecutor.shutdownNow();
                log.info("{} task(s) were canceled during forced shutdown", remainingTasks.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Room processing executor shutdown interrupted");
            roomProcessingExecutor.shutdownNow();
        }
    }

    /**
     * Create a thread factory with proper naming, priority and error handling.
     *
     * @param prefix Thread name prefix
     * @param priority Thread priority
     * @return A ThreadFactory
     */
    private ThreadFactory createThreadFactory(String prefix, int priority) {
        return new ThreadFactory() {
            private final AtomicInteger threadNumber = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + threadNumber.getAndIncrement());
                thread.setPriority(priority);
                thread.setDaemon(false);

                thread.setUncaughtExceptionHandler((t, e) ->
                        log.error("Uncaught exception in thread {}: {}", t.getName(), e.getMessage(), e));

                return thread;
            }
        };
    }
}
