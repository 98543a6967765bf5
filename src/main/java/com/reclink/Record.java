package com.reclink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A record read from one source file.
 *
 * The value type is {@code String} for raw records and {@code Integer} once
 * every value has been replaced by its value id.
 *
 * @param <V> attribute value type
 */
public final class Record<V> implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String id;
  private final String fileId;
  private final List<V> values;

  public Record(String id, String fileId, List<V> values) {
    this.id = Objects.requireNonNull(id, "id");
    this.fileId = Objects.requireNonNull(fileId, "fileId");
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  @SafeVarargs
  public static <V> Record<V> of(String id, String fileId, V... values) {
    List<V> list = new ArrayList<>(values.length);
    Collections.addAll(list, values);
    return new Record<>(id, fileId, list);
  }

  public String getId() {
    return id;
  }

  public String getFileId() {
    return fileId;
  }

  public List<V> getValues() {
    return values;
  }

  public V getValue(int attrId) {
    return values.get(attrId);
  }

  public int numValues() {
    return values.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof Record)) return false;
    Record<?> o = (Record<?>) obj;
    return id.equals(o.id) && fileId.equals(o.fileId) && values.equals(o.values);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, fileId, values);
  }

  @Override
  public String toString() {
    return "Record{id=" + id + ", fileId=" + fileId + ", values=" + values + "}";
  }
}
