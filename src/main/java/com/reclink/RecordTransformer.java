package com.reclink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Replaces the raw values of a record with their value ids.
 *
 * Holds no state besides the read-only indexes, so the same input record
 * always gives the same output whatever partition or thread handles it.
 */
public final class RecordTransformer implements Function<Record<String>, Record<Integer>>, Serializable {

  private static final long serialVersionUID = 1L;

  private final List<IndexedAttribute> indexedAttributes;

  public RecordTransformer(List<IndexedAttribute> indexedAttributes) {
    this.indexedAttributes = indexedAttributes;
  }

  /**
   * @throws SchemaMismatchException if the record has the wrong number of values
   * @throws UnseenValueException if a value is missing from its attribute's index
   */
  @Override
  public Record<Integer> apply(Record<String> record) {
    int numAttributes = indexedAttributes.size();
    if (record.numValues() != numAttributes) {
      throw new SchemaMismatchException(record.getId(), numAttributes, record.numValues());
    }
    List<Integer> ids = new ArrayList<>(numAttributes);
    for (int i = 0; i < numAttributes; i++) {
      AttributeIndex index = indexedAttributes.get(i).getIndex();
      String value = record.getValue(i);
      if (!index.contains(value)) {
        throw new UnseenValueException(indexedAttributes.get(i).getName(), value, record.getId());
      }
      ids.add(index.idOf(value));
    }
    return new Record<>(record.getId(), record.getFileId(), ids);
  }

  /** Lazily transforms a partition. */
  public Iterator<Record<Integer>> transformPartition(Iterator<Record<String>> partition) {
    return new Iterator<Record<Integer>>() {
      @Override
      public boolean hasNext() {
        return partition.hasNext();
      }

      @Override
      public Record<Integer> next() {
        return apply(partition.next());
      }
    };
  }
}
