package io.intellixity.relata.persistence.spi.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs steps that do not depend on each other's output concurrently and joins them.
 *
 * <p>Every step is awaited, even after a failure, so nothing is still running against the transaction
 * when the caller rolls back. The first failure in step order is rethrown, later ones are suppressed into it.</p>
 */
public final class DependentSteps {
  private final Executor executor;

  public DependentSteps(Executor executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  /** Runs on the calling thread. */
  public static DependentSteps direct() {
    return new DependentSteps(Runnable::run);
  }

  public <T> List<T> runAll(List<Supplier<T>> steps) {
    if (steps == null || steps.isEmpty()) return List.of();
    List<CompletableFuture<T>> futures = new ArrayList<>(steps.size());
    for (Supplier<T> s : steps) {
      futures.add(CompletableFuture.supplyAsync(s, executor));
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).handle((v, t) -> null).join();

    List<T> out = new ArrayList<>(futures.size());
    RuntimeException failure = null;
    for (CompletableFuture<T> f : futures) {
      try {
        out.add(f.join());
      } catch (CompletionException e) {
        RuntimeException cause = unwrap(e);
        if (failure == null) failure = cause;
        else if (failure != cause) failure.addSuppressed(cause);
      }
    }
    if (failure != null) throw failure;
    return out;
  }

  /** Side-effect-only variant of {@link #runAll(List)}. */
  public void awaitAll(List<Runnable> steps) {
    if (steps == null || steps.isEmpty()) return;
    List<Supplier<Object>> wrapped = new ArrayList<>(steps.size());
    for (Runnable r : steps) {
      wrapped.add(() -> {
        r.run();
        return Boolean.TRUE;
      });
    }
    runAll(wrapped);
  }

  private static RuntimeException unwrap(CompletionException e) {
    Throwable c = e.getCause() == null ? e : e.getCause();
    if (c instanceof RuntimeException re) return re;
    if (c instanceof Error err) throw err;
    return new IllegalStateException(c);
  }
}
