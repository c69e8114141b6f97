package nl.adgroot.bookingest;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import nl.adgroot.bookingest.config.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AppExecutors implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AppExecutors.class);

  private final ExecutorService permitPoolExecutor;

  private AppExecutors(ExecutorService permitPoolExecutor) {
    this.permitPoolExecutor = permitPoolExecutor;
  }

  public static AppExecutors create(AppConfig cfg) {
    return create(transferThreads(cfg));
  }

  /**
   * One permit thread per allowed transfer: a thread only blocks while every permit is held, and
   * permits are released by the threads completing the transfers.
   */
  public static AppExecutors create(int maxConcurrentTransfers) {
    ThreadFactory permitTf = new ThreadFactory() {
      private final AtomicInteger n = new AtomicInteger(1);

      @Override
      public Thread newThread(Runnable r) {
        Thread t = new Thread(r, "transfer-permit-" + n.getAndIncrement());
        t.setDaemon(true);
        return t;
      }
    };

    return new AppExecutors(Executors.newFixedThreadPool(Math.max(1, maxConcurrentTransfers), permitTf));
  }

  static int transferThreads(AppConfig cfg) {
    return Math.max(1, cfg.pages.maxConcurrentTransfers);
  }

  public ExecutorService permitPoolExecutor() {
    return permitPoolExecutor;
  }

  @Override
  public void close() throws InterruptedException {
    permitPoolExecutor.shutdown();
    await(permitPoolExecutor, "permitPoolExecutor");
  }

  private static void await(ExecutorService es, String name) throws InterruptedException {
    if (!es.awaitTermination(1, TimeUnit.MINUTES)) {
      es.shutdownNow();
      if (!es.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Executor did not terminate: {}", name);
      }
    }
  }
}
