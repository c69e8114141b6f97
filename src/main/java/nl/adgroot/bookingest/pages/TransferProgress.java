package nl.adgroot.bookingest.pages;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/** Progress of one transfer phase (all downloads, or all uploads) of a run. */
public class TransferProgress {

  private final String phase;
  private final int total;
  private final AtomicInteger done = new AtomicInteger();
  private final AtomicInteger inFlight = new AtomicInteger();
  private final Instant startAll = Instant.now();

  public TransferProgress(String phase, int total) {
    this.phase = phase;
    this.total = total;
  }

  /** @return transfers in flight including this one */
  public int start() {
    return inFlight.incrementAndGet();
  }

  public void finish(boolean success) {
    inFlight.decrementAndGet();
    if (success) {
      done.incrementAndGet();
    }
  }

  public String formatStatus(long lastTransferMillis) {
    int d = done.get();
    int remaining = total - d;

    Duration elapsed = Duration.between(startAll, Instant.now());
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double throughput = d / elapsedSec;
    long etaSec = (throughput <= 0) ? 0 : (long) Math.ceil(remaining / throughput);
    double pct = total == 0 ? 100.0 : (d * 100.0) / total;

    return String.format(
        "%s %d/%d (%.2f%%) | last=%s | elapsed=%s | in-flight=%d | ETA=%s",
        phase, d, total, pct,
        fmtDuration(Duration.ofMillis(lastTransferMillis)),
        fmtDuration(elapsed),
        inFlight.get(),
        fmtDuration(Duration.ofSeconds(etaSec))
    );
  }

  static String fmtDuration(Duration d) {
    long s = d.getSeconds();
    long h = s / 3600;
    long m = (s % 3600) / 60;
    long sec = s % 60;
    if (h > 0) return String.format("%dh %02dm %02ds", h, m, sec);
    if (m > 0) return String.format("%dm %02ds", m, sec);
    if (s == 0 && d.toMillis() > 0) return d.toMillis() + "ms";
    return String.format("%ds", sec);
  }
}
