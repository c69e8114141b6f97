package nl.adgroot.bookingest.pages;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/** Caps the number of page transfers in flight. */
public class TransferPermits {

  private final Semaphore permits;
  private final int maxPermits;

  /**
   * @param maxConcurrent max concurrent transfers (>= 1)
   * @param fair whether the semaphore should be fair: FIFO
   */
  public TransferPermits(int maxConcurrent, boolean fair) {
    this.maxPermits = Math.max(1, maxConcurrent);
    this.permits = new Semaphore(maxPermits, fair);
  }

  public int maxPermits() {
    return maxPermits;
  }

  /** Blocks the calling thread until a permit is available. */
  public void acquire() {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for a transfer permit", e);
    }
  }

  /**
   * Acquires a permit asynchronously using the provided executor, which must be allowed to block.
   */
  public CompletableFuture<Void> acquireAsync(Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.runAsync(this::acquire, executor);
  }

  public void release() {
    permits.release();
  }

  /**
   * Runs {@code transfer} once a permit is held and releases the permit when the transfer's future
   * settles, whatever the outcome.
   */
  public <T> CompletableFuture<T> withPermit(Executor permitExecutor, Supplier<CompletableFuture<T>> transfer) {
    return acquireAsync(permitExecutor).thenCompose(v -> {
      CompletableFuture<T> f;
      try {
        f = transfer.get();
      } catch (RuntimeException e) {
        release();
        return CompletableFuture.failedFuture(e);
      }
      return f.whenComplete((r, ex) -> release());
    });
  }
}
