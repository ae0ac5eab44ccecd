package dev.scriptorium.concurrent;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a blocking call against an external collaborator on an executor and waits at most a given
 * timeout for it. Every failure mode (exception, timeout, rejection, interruption) is translated
 * by the caller-supplied {@link FailureTranslator}; nothing is retried.
 *
 * <p>The call runs as a {@link FutureTask}, so a timeout interrupts the worker thread. A callee
 * that ignores interruption still holds its thread until it returns.
 */
public final class TimeBoundedCall {

  private TimeBoundedCall() {
    // utility class
  }

  /** Builds the exception thrown for a failed call. */
  @FunctionalInterface
  public interface FailureTranslator {
    RuntimeException translate(String message, Throwable cause);
  }

  /**
   * Executes {@code task} on {@code executor}, waiting at most {@code timeout}.
   *
   * @param description short description used in failure messages, e.g. {@code "embed query"}
   * @return the task's result
   * @throws RuntimeException the translated failure
   */
  public static <T> T call(
      Executor executor,
      Duration timeout,
      String description,
      Supplier<T> task,
      FailureTranslator failure) {
    FutureTask<T> future = new FutureTask<>(task::get);
    try {
      executor.execute(future);
    } catch (RejectedExecutionException e) {
      throw failure.translate(description + " rejected: executor saturated", e);
    }
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw failure.translate(description + " timed out after " + timeout.toMillis() + " ms", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw failure.translate(description + " failed: " + cause.getMessage(), cause);
    } catch (CancellationException e) {
      throw failure.translate(description + " was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw failure.translate(description + " interrupted", e);
    }
  }
}
