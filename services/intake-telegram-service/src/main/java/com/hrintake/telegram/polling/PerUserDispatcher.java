package com.hrintake.telegram.polling;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs work on a shared pool while keeping tasks with the same key in submission order. Each key
 * has a chain of futures; a new task is appended to the tail of its key's chain.
 */
@Slf4j
public class PerUserDispatcher {

  private final Executor executor;
  private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  public PerUserDispatcher(Executor executor) {
    this.executor = executor;
  }

  public CompletableFuture<Void> submit(String key, Runnable task) {
    CompletableFuture<Void> next =
        tails.compute(
            key,
            (k, tail) -> {
              CompletableFuture<Void> previous =
                  tail == null ? CompletableFuture.completedFuture(null) : tail;
              // a failed link must not cancel the tasks queued behind it
              return previous
                  .handle((ignored, error) -> null)
                  .thenRunAsync(() -> runSafely(k, task), executor);
            });
    // forget the chain once it is drained so idle users do not pile up
    next.whenComplete((ignored, error) -> tails.remove(key, next));
    return next;
  }

  public int pendingKeys() {
    return tails.size();
  }

  /**
   * Waits until every submitted task has finished, or the grace period is over.
   *
   * @return true when everything finished in time
   */
  public boolean drain(Duration grace) {
    CompletableFuture<?>[] pending = tails.values().toArray(new CompletableFuture<?>[0]);
    try {
      CompletableFuture.allOf(pending).get(grace.toMillis(), TimeUnit.MILLISECONDS);
      return true;
    } catch (TimeoutException e) {
      log.warn("{} user queues still busy after {}", tails.size(), grace);
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } catch (ExecutionException e) {
      // task failures are logged in runSafely, so this only covers executor rejection
      log.error("Unexpected dispatcher failure while draining", e);
      return false;
    }
  }

  /** Drains and then stops the pool, if it is one. */
  public boolean shutdown(Duration grace) {
    boolean drained = drain(grace);
    if (executor instanceof ExecutorService service) {
      service.shutdown();
      try {
        if (!service.awaitTermination(1, TimeUnit.SECONDS)) {
          log.warn("Worker pool did not terminate in time");
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    return drained;
  }

  private static void runSafely(String key, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      log.error("Update processing failed for {}", key, e);
    } catch (Error e) {
      log.error("Update processing failed with an error for {}", key, e);
    }
  }
}
