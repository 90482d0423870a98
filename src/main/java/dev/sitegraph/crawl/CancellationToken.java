package dev.sitegraph.crawl;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a crawl run. The scheduler checks it before handing out each
 * frontier entry; fetches already in flight finish and their pages are kept.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A token nobody holds, for runs that cannot be cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /**
   * Request cancellation.
   *
   * @return false if cancellation was already requested
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
