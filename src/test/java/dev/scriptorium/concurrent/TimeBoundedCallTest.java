package dev.scriptorium.concurrent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.scriptorium.error.IndexUnavailableException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TimeBoundedCallTest {

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static IndexUnavailableException unavailable(String message, Throwable cause) {
    return new IndexUnavailableException("vector-query", message, cause);
  }

  @Test
  void returnsResultOfTask() {
    String result =
        TimeBoundedCall.call(
            executor, Duration.ofSeconds(5), "probe", () -> "done", TimeBoundedCallTest::unavailable);

    assertThat(result).isEqualTo("done");
  }

  @Test
  void taskFailureIsTranslatedWithOriginalCause() {
    IllegalStateException failure = new IllegalStateException("connection refused");

    assertThatThrownBy(
            () ->
                TimeBoundedCall.call(
                    executor,
                    Duration.ofSeconds(5),
                    "vector query",
                    () -> {
                      throw failure;
                    },
                    TimeBoundedCallTest::unavailable))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessage("vector query failed: connection refused")
        .hasCause(failure);
  }

  @Test
  void slowTaskTimesOut() {
    CountDownLatch never = new CountDownLatch(1);

    assertThatThrownBy(
            () ->
                TimeBoundedCall.call(
                    executor,
                    Duration.ofMillis(50),
                    "vector query",
                    () -> {
                      try {
                        never.await();
                      } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                      }
                      return "late";
                    },
                    TimeBoundedCallTest::unavailable))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessage("vector query timed out after 50 ms")
        .hasCauseInstanceOf(TimeoutException.class);
  }

  @Test
  void timeoutInterruptsTheWorkerThread() throws InterruptedException {
    CountDownLatch never = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);

    assertThatThrownBy(
            () ->
                TimeBoundedCall.call(
                    executor,
                    Duration.ofMillis(50),
                    "embed query",
                    () -> {
                      try {
                        never.await();
                      } catch (InterruptedException e) {
                        interrupted.countDown();
                      }
                      return "late";
                    },
                    TimeBoundedCallTest::unavailable))
        .isInstanceOf(IndexUnavailableException.class);

    assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    String next =
        TimeBoundedCall.call(
            executor, Duration.ofSeconds(5), "embed query", () -> "free", TimeBoundedCallTest::unavailable);
    assertThat(next).isEqualTo("free");
  }

  @Test
  void rejectedSubmissionIsTranslated() {
    executor.shutdown();

    assertThatThrownBy(
            () ->
                TimeBoundedCall.call(
                    executor, Duration.ofSeconds(1), "insert", () -> "x", TimeBoundedCallTest::unavailable))
        .isInstanceOf(IndexUnavailableException.class)
        .hasMessageContaining("rejected")
        .hasCauseInstanceOf(RejectedExecutionException.class);
  }
}
