package dev.sitegraph.crawl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.jspecify.annotations.Nullable;

/**
 * Traversal state of a single crawl run: FIFO queue of pending visits, the visited set and the
 * page budget.
 *
 * <p>The visited set is the only deduplication authority. A URL joins it when it is handed out by
 * {@link #poll()}, before its fetch starts, so two fetches of the same URL can never be in flight.
 * The budget counts recorded pages plus fetches in flight; {@link #poll()} refuses to hand out work
 * once that sum reaches {@code maxPages}, and a failed fetch gives its slot back through {@link
 * #complete(boolean)}.
 *
 * <p>All mutators are synchronized; one instance belongs to one run and is never shared. The
 * visited set is concurrent so that workers may consult it while the coordinator mutates it.
 */
public class CrawlFrontier {

  private final int maxPages;
  private final int maxDepth;
  private final Deque<FrontierEntry> queue = new ArrayDeque<>();
  private final Set<String> visited = ConcurrentHashMap.newKeySet();
  private final AtomicInteger recordedPages = new AtomicInteger();
  private int inFlight;

  public CrawlFrontier(int maxPages, int maxDepth) {
    if (maxPages < 1) {
      throw new IllegalArgumentException("maxPages must be >= 1, got: " + maxPages);
    }
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be >= 0, got: " + maxDepth);
    }
    this.maxPages = maxPages;
    this.maxDepth = maxDepth;
  }

  /** Push the seed at depth 0. */
  public synchronized void seed(String url) {
    queue.addLast(new FrontierEntry(url, 0, null));
  }

  /**
   * Enqueue a discovered link unless it was already visited. A URL may be queued more than once;
   * the visited check in {@link #poll()} is the authoritative guard.
   *
   * @return true if the entry was queued
   */
  public synchronized boolean offer(String url, int depth, @Nullable String parentUrl) {
    if (visited.contains(url)) {
      return false;
    }
    queue.addLast(new FrontierEntry(url, depth, parentUrl));
    return true;
  }

  /**
   * Hand out the next entry to fetch and mark it visited. Entries already visited or deeper than
   * {@code maxDepth} are discarded on the way.
   *
   * @return the next entry, or empty if the queue is drained or the page budget is taken
   */
  public synchronized Optional<FrontierEntry> poll() {
    while (!queue.isEmpty()) {
      if (recordedPages.get() + inFlight >= maxPages) {
        return Optional.empty();
      }
      FrontierEntry entry = queue.pollFirst();
      if (entry.depth() > maxDepth) {
        continue;
      }
      if (!visited.add(entry.url())) {
        continue;
      }
      inFlight++;
      return Optional.of(entry);
    }
    return Optional.empty();
  }

  /**
   * Mark a URL visited outside of {@link #poll()}, e.g. the target of a redirect.
   *
   * @return false if it was already visited
   */
  public boolean markVisited(String url) {
    return visited.add(url);
  }

  /**
   * Finish an entry handed out by {@link #poll()}.
   *
   * @param pageRecorded whether the fetch produced a page; a failed fetch frees its budget slot
   */
  public synchronized void complete(boolean pageRecorded) {
    if (inFlight == 0) {
      throw new IllegalStateException("complete() without a matching poll()");
    }
    inFlight--;
    if (pageRecorded) {
      recordedPages.incrementAndGet();
    }
  }

  /** Whether more pages may still be recorded. */
  public boolean hasBudget() {
    return recordedPages.get() < maxPages;
  }

  public synchronized int inFlight() {
    return inFlight;
  }

  /** Safe to call from worker threads. */
  public boolean isVisited(String url) {
    return visited.contains(url);
  }

  public int visitedCount() {
    return visited.size();
  }
}
