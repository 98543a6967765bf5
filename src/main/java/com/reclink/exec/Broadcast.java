package com.reclink.exec;

/**
 * Read-only value replicated to every worker. Each worker reads its own copy.
 */
public interface Broadcast<T> {

  /**
   * The copy held by the calling worker.
   *
   * @throws IllegalStateException if the broadcast was destroyed
   */
  T value();

  /** Releases every copy. */
  void destroy();
}
