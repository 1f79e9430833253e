package eu.virtualparadox.docingest.application.executor;

import eu.virtualparadox.docingest.application.config.IngestionProperties;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Supplier;

/**
 * Bounded, process-wide pool for extraction, OCR and chunking work.
 * <p>
 * The pool has a fixed number of threads and a bounded queue. Once the queue is full,
 * further submissions are rejected instead of piling up image buffers in memory.
 */
public class IngestionExecutor extends ThreadPoolTaskExecutor {

    public IngestionExecutor(final IngestionProperties.Workers workers) {
        setCorePoolSize(workers.poolSize());
        setMaxPoolSize(workers.poolSize());
        setQueueCapacity(workers.queueCapacity());
        setThreadNamePrefix("ingest-");
        setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        setWaitForTasksToCompleteOnShutdown(true);
        setAwaitTerminationSeconds(60);
    }

    /**
     * Runs {@code task} on the pool.
     *
     * @param task blocking work to run off the caller's thread
     * @return future completed with the task's result, or exceptionally with
     *         {@link TaskRejectedException} when the queue is full
     */
    public <T> CompletableFuture<T> supply(final Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, this);
        } catch (TaskRejectedException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
