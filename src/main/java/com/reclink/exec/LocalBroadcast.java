package com.reclink.exec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.io.UncheckedIOException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Broadcast backed by a serialized snapshot. Every thread that reads the value
 * deserializes its own copy, so per-worker mutations stay on that worker.
 * The copies are dropped on {@link #destroy()}.
 */
final class LocalBroadcast<T extends Serializable> implements Broadcast<T> {

  private volatile byte[] bytes;
  private final ConcurrentHashMap<Thread, T> copies = new ConcurrentHashMap<>();

  LocalBroadcast(T value) {
    ByteArrayOutputStream bos = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bos)) {
      out.writeObject(value);
    } catch (IOException e) {
      throw new UncheckedIOException("cannot serialize broadcast value", e);
    }
    this.bytes = bos.toByteArray();
  }

  @Override
  public T value() {
    byte[] snapshot = bytes;
    if (snapshot == null) {
      throw new IllegalStateException("broadcast was destroyed");
    }
    return copies.computeIfAbsent(Thread.currentThread(), t -> deserialize(snapshot));
  }

  @SuppressWarnings("unchecked")
  private T deserialize(byte[] snapshot) {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(snapshot))) {
      return (T) in.readObject();
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read broadcast value", e);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("cannot read broadcast value", e);
    }
  }

  @Override
  public void destroy() {
    bytes = null;
    copies.clear();
  }

  /** Number of worker copies currently held. */
  int numCopies() {
    return copies.size();
  }
}
