package io.xk6.prometheus.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the exporter's named daemon threads.
 * <p>All threads are daemons so an embedding engine can exit even if {@code stop()} is never called.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread scheduler used to emit flush ticks.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return scheduler that drops delayed tasks once shut down
   */
  public static ScheduledExecutorService newTicker(String prefix, UncaughtExceptionHandler handler) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, threadFactory(prefix, "xk6-ticker", handler));
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  /**
   * Builds a single worker thread; tasks run one at a time in submission order.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on the thread
   * @return single-thread executor
   */
  public static ExecutorService newSingleWorker(String prefix, UncaughtExceptionHandler handler) {
    return Executors.newSingleThreadExecutor(threadFactory(prefix, "xk6-worker", handler));
  }

  /**
   * Builds a fixed-size pool for HTTP request handling.
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newHttpPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        threadFactory(prefix, "xk6-http", handler));
  }

  /**
   * Creates an unstarted daemon thread.
   *
   * @param name thread name
   * @param task runnable to execute
   * @param handler uncaught exception handler
   * @return new daemon thread
   */
  public static Thread newDaemonThread(String name, Runnable task, UncaughtExceptionHandler handler) {
    Thread thread = new Thread(Objects.requireNonNull(task, "task"), name);
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler, (t, ex) -> {}));
    return thread;
  }

  private static ThreadFactory threadFactory(
      String prefix, String defaultPrefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
