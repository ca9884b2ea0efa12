package io.intellixity.relata.persistence.spi.exec;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

final class DependentStepsTest {
  @Test
  void returnsResultsInStepOrder() {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      DependentSteps steps = new DependentSteps(pool);
      List<Supplier<Integer>> work = List.of(() -> 1, () -> 2, () -> 3);
      assertEquals(List.of(1, 2, 3), steps.runAll(work));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void awaitsEveryStepBeforeRethrowingFirstFailure() {
    AtomicInteger finished = new AtomicInteger();
    IllegalStateException first = new IllegalStateException("first");
    IllegalArgumentException second = new IllegalArgumentException("second");

    RuntimeException ex = assertThrows(RuntimeException.class, () -> DependentSteps.direct().awaitAll(List.of(
        () -> { throw first; },
        finished::incrementAndGet,
        () -> { throw second; })));

    assertSame(first, ex);
    assertEquals(1, finished.get());
    assertSame(second, ex.getSuppressed()[0]);
  }

  @Test
  void emptyIsNoop() {
    assertEquals(List.of(), DependentSteps.direct().runAll(List.of()));
  }
}
