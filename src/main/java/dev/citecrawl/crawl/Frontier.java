package dev.citecrawl.crawl;

import dev.citecrawl.document.DocumentRef;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * FIFO work queue with exactly-once-per-id processing for a single crawl run.
 *
 * <p>An id is either queued (discovered, waiting) or visited (dequeued for processing), never
 * both. It becomes visited at the moment it is dequeued, not when discovered, and {@link
 * #dequeue()} is the only operation that adds to the visited set. Children are always enqueued
 * with their parent's distance + 1 after the parent was dequeued, so FIFO order yields strict
 * breadth-first levels.
 *
 * <p>Not thread-safe: a run has a single writer.
 */
public class Frontier {

  private final Deque<WorkItem> queue = new ArrayDeque<>();
  private final Set<String> queuedIds = new HashSet<>();
  private final Set<String> visited = new LinkedHashSet<>();

  /**
   * Append a work item unless its id was already visited or queued.
   *
   * @return true if the item was queued; false (and no state change) for a duplicate
   */
  public boolean enqueue(DocumentRef ref, int distance, String text) {
    if (contains(ref.id())) {
      return false;
    }
    queue.addLast(new WorkItem(ref, distance, text));
    queuedIds.add(ref.id());
    return true;
  }

  /**
   * Pop the head of the queue and mark its id visited.
   *
   * @return the head item, or empty if the queue is empty
   */
  public Optional<WorkItem> dequeue() {
    WorkItem item = queue.pollFirst();
    if (item == null) {
      return Optional.empty();
    }
    queuedIds.remove(item.id());
    visited.add(item.id());
    return Optional.of(item);
  }

  /** Whether the id was already visited or is waiting in the queue. */
  public boolean contains(String id) {
    return visited.contains(id) || queuedIds.contains(id);
  }

  public boolean isVisited(String id) {
    return visited.contains(id);
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int queuedCount() {
    return queue.size();
  }

  public int visitedCount() {
    return visited.size();
  }

  /** Visited ids in dequeue order. */
  public Set<String> visitedIds() {
    return Collections.unmodifiableSet(visited);
  }

  public static int remainingBudget(int processedCount, int maxTotal) {
    return Math.max(0, maxTotal - processedCount);
  }

  public static boolean hasCapacity(int processedCount, int maxTotal) {
    return remainingBudget(processedCount, maxTotal) > 0;
  }
}
