package ca.gc.cra.prplan.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the worker pool that runs execution groups side by side.
 */
public final class ExecutorFactories {
  /** Thread-name prefix used when none is supplied. */
  public static final String DEFAULT_GROUP_PREFIX = "prplan-group";

  private ExecutorFactories() {}

  /**
   * Builds a pool with exactly one thread per execution group.
   * <p>Tasks are handed straight to a thread; submitting more than {@code groups} concurrent tasks is rejected
   * rather than queued, so a group never waits behind another.</p>
   *
   * @param groups number of groups that will run concurrently
   * @param prefix thread-name prefix; blank selects {@link #DEFAULT_GROUP_PREFIX}
   * @param handler uncaught exception handler installed on each worker thread; may be {@code null}
   * @return configured executor service
   * @throws IllegalArgumentException if {@code groups} is not positive
   */
  public static ExecutorService newGroupPool(int groups, String prefix, UncaughtExceptionHandler handler) {
    if (groups <= 0) {
      throw new IllegalArgumentException("groups must be positive");
    }
    return new ThreadPoolExecutor(
        groups,
        groups,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        namedThreads(prefix, handler),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Requests shutdown and waits for running groups to finish.
   *
   * @param executor pool to stop; must not be {@code null}
   * @param timeoutMillis maximum wait in milliseconds
   * @return {@code true} if every worker terminated within the timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public static boolean shutdownAndAwait(ExecutorService executor, long timeoutMillis)
      throws InterruptedException {
    Objects.requireNonNull(executor, "executor");
    executor.shutdown();
    return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
  }

  private static ThreadFactory namedThreads(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? DEFAULT_GROUP_PREFIX : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }
}
