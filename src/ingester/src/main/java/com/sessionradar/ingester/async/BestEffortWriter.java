package com.sessionradar.ingester.async;

import com.sessionradar.ingester.config.IngesterProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs side-effect writes (durable store, member roster) off the reconciliation thread.
 *
 * <p>Tasks are queued on a bounded single-thread executor. Callers never wait for completion; a
 * failing task is logged and counted, and a full queue drops the task. The next synchronizer run
 * repairs anything that was lost.
 */
@Component
public class BestEffortWriter {
  private static final Logger log = LoggerFactory.getLogger(BestEffortWriter.class);

  private final Executor executor;
  private final Counter failedCounter;
  private final Counter rejectedCounter;

  @Autowired
  public BestEffortWriter(IngesterProperties properties, MeterRegistry meterRegistry) {
    this(newExecutor(properties.durable().queueCapacity()), meterRegistry);
  }

  public BestEffortWriter(Executor executor, MeterRegistry meterRegistry) {
    this.executor = executor;
    this.failedCounter = Counter.builder("ingester.durable.writes.failed")
        .description("Best-effort writes that threw")
        .register(meterRegistry);
    this.rejectedCounter = Counter.builder("ingester.durable.writes.rejected")
        .description("Best-effort writes dropped because the queue was full")
        .register(meterRegistry);
  }

  /** Queues {@code task}; never throws and never blocks the caller. */
  public void submit(String description, Runnable task) {
    try {
      executor.execute(() -> {
        try {
          task.run();
        } catch (RuntimeException ex) {
          failedCounter.increment();
          log.warn("Best-effort write failed: {}", description, ex);
        }
      });
    } catch (RejectedExecutionException ex) {
      rejectedCounter.increment();
      log.warn("Best-effort write dropped, queue full: {}", description);
    }
  }

  /** Lets already queued writes finish, waiting a few seconds at most. */
  @PreDestroy
  public void stop() {
    if (!(executor instanceof ExecutorService service)) {
      return;
    }
    service.shutdown();
    try {
      if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Best-effort writer did not drain in time, {} writes abandoned",
            service.shutdownNow().size());
      }
    } catch (InterruptedException ex) {
      service.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ExecutorService newExecutor(int queueCapacity) {
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
        runnable -> {
          Thread thread = new Thread(runnable, "best-effort-writer");
          thread.setDaemon(true);
          return thread;
        },
        new ThreadPoolExecutor.AbortPolicy());
  }
}
