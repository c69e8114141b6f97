package nl.adgroot.bookingest;

import nl.adgroot.bookingest.errors.IngestionCancelledException;

/**
 * Cooperative cancellation for one ingestion run. Checked at stage boundaries and before each page
 * transfer; calls already in flight are left to finish.
 */
public final class CancellationToken {

  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  public void throwIfCancelled(String checkpoint) {
    if (isCancelled()) {
      throw new IngestionCancelledException(checkpoint);
    }
  }
}
