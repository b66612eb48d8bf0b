package ca.gc.cra.pacer.infrastructure.buffer;

import ca.gc.cra.pacer.domain.frame.CapturedFrame;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, thread-safe store of frames waiting for analysis.
 * <p>When an insert pushes the size above capacity, the entry with the lowest priority is evicted, ties broken by
 * the oldest capture timestamp and then by insertion order. {@link #takeNext()} serves the highest priority, most
 * recent entry, so freshness wins over arrival order.</p>
 *
 * @param <T> opaque frame handle type
 * @since PACER 0.1
 */
public final class PriorityFrameStore<T> {
  /** Capacity used when none is configured. */
  public static final int DEFAULT_CAPACITY = 5;

  private final List<StoredFrame<T>> entries;
  private final ReentrantLock lock = new ReentrantLock();
  private int capacity;
  private long nextSequence;

  /**
   * Creates a store with {@link #DEFAULT_CAPACITY}.
   */
  public PriorityFrameStore() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a store holding at most {@code capacity} frames.
   *
   * @param capacity maximum pending frames
   * @throws IllegalArgumentException when {@code capacity} is not positive
   */
  public PriorityFrameStore(int capacity) {
    this.capacity = requirePositive(capacity);
    this.entries = new ArrayList<>(capacity + 1);
  }

  /**
   * Inserts a frame that did not go through admission.
   *
   * @param frame frame to buffer
   * @return entry evicted to honour capacity (possibly the inserted one), or empty
   */
  public Optional<StoredFrame<T>> add(CapturedFrame<T> frame) {
    return add(frame, false);
  }

  /**
   * Inserts a frame.
   *
   * @param frame frame to buffer; must not be {@code null}
   * @param admitted whether the frame holds an admission slot that must be released if it is evicted
   * @return entry evicted to honour capacity (possibly the inserted one), or empty
   */
  public Optional<StoredFrame<T>> add(CapturedFrame<T> frame, boolean admitted) {
    Objects.requireNonNull(frame, "frame");
    lock.lock();
    try {
      entries.add(new StoredFrame<>(frame, nextSequence++, admitted));
      if (entries.size() <= capacity) {
        return Optional.empty();
      }
      return Optional.of(entries.remove(evictionIndex()));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns the highest priority, most recent entry.
   *
   * @return next entry, or empty when the store is empty
   */
  public Optional<StoredFrame<T>> takeNext() {
    lock.lock();
    try {
      if (entries.isEmpty()) {
        return Optional.empty();
      }
      int best = 0;
      for (int i = 1; i < entries.size(); i++) {
        if (servesBefore(entries.get(i), entries.get(best))) {
          best = i;
        }
      }
      return Optional.of(entries.remove(best));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of pending frames.
   *
   * @return size in {@code [0, capacity]}
   */
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the configured capacity.
   *
   * @return capacity
   */
  public int capacity() {
    lock.lock();
    try {
      return capacity;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Changes the capacity, evicting entries if the store is now over capacity.
   *
   * @param newCapacity new maximum; must be positive
   * @return evicted entries in eviction order
   * @throws IllegalArgumentException when {@code newCapacity} is not positive
   */
  public List<StoredFrame<T>> resize(int newCapacity) {
    requirePositive(newCapacity);
    lock.lock();
    try {
      capacity = newCapacity;
      List<StoredFrame<T>> evicted = new ArrayList<>();
      while (entries.size() > capacity) {
        evicted.add(entries.remove(evictionIndex()));
      }
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes every pending entry.
   *
   * @return removed entries in insertion order
   */
  public List<StoredFrame<T>> clear() {
    lock.lock();
    try {
      List<StoredFrame<T>> drained = new ArrayList<>(entries);
      entries.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  private int evictionIndex() {
    int victim = 0;
    for (int i = 1; i < entries.size(); i++) {
      if (evictsBefore(entries.get(i), entries.get(victim))) {
        victim = i;
      }
    }
    return victim;
  }

  private static boolean evictsBefore(StoredFrame<?> candidate, StoredFrame<?> current) {
    int byPriority = Integer.compare(candidate.priorityRank(), current.priorityRank());
    if (byPriority != 0) {
      return byPriority < 0;
    }
    int byTime = Long.compare(candidate.frame().timestampNanos(), current.frame().timestampNanos());
    if (byTime != 0) {
      return byTime < 0;
    }
    return candidate.sequence() < current.sequence();
  }

  private static boolean servesBefore(StoredFrame<?> candidate, StoredFrame<?> current) {
    int byPriority = Integer.compare(candidate.priorityRank(), current.priorityRank());
    if (byPriority != 0) {
      return byPriority > 0;
    }
    int byTime = Long.compare(candidate.frame().timestampNanos(), current.frame().timestampNanos());
    if (byTime != 0) {
      return byTime > 0;
    }
    return candidate.sequence() > current.sequence();
  }

  private static int requirePositive(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive (was " + capacity + ")");
    }
    return capacity;
  }

  /**
   * Store entry wrapping a frame with its insertion order.
   *
   * @param frame buffered frame
   * @param sequence insertion sequence number, unique per store
   * @param admitted whether the frame holds an admission slot
   * @param <T> frame handle type
   */
  public record StoredFrame<T>(CapturedFrame<T> frame, long sequence, boolean admitted) {
    int priorityRank() {
      return frame.priority().rank();
    }
  }
}
