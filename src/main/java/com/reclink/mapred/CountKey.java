package com.reclink.mapred;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.io.WritableComparable;
import org.apache.hadoop.io.WritableComparator;
import org.apache.hadoop.io.WritableUtils;

/**
 * Key of the statistics job: (slot, value).
 *
 * Slot {@link #FILE_SIZES} counts records per file id; slot {@code i >= 0}
 * counts the values of attribute {@code i}.
 *
 * Binary format: slot (4 bytes) followed by the value as {@link Text}.
 */
public class CountKey implements WritableComparable<CountKey> {

  public static final int FILE_SIZES = -1;

  private int slot;
  private final Text value = new Text();

  public CountKey() {}

  public CountKey(int slot, String value) {
    set(slot, value);
  }

  public void set(int slot, String value) {
    this.slot = slot;
    this.value.set(value);
  }

  public int getSlot() {
    return slot;
  }

  public String getValue() {
    return value.toString();
  }

  public boolean isFileSize() {
    return slot == FILE_SIZES;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    out.writeInt(slot);
    value.write(out);
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    slot = in.readInt();
    value.readFields(in);
  }

  @Override
  public int compareTo(CountKey o) {
    int cmp = Integer.compare(slot, o.slot);
    return cmp != 0 ? cmp : value.compareTo(o.value);
  }

  @Override
  public int hashCode() {
    return slot * 31 + value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof CountKey) {
      CountKey o = (CountKey) obj;
      return slot == o.slot && value.equals(o.value);
    }
    return false;
  }

  @Override
  public String toString() {
    return slot + ":" + value;
  }

  /**
   * Raw comparator for CountKey - avoids deserialization during sort.
   */
  public static class Comparator extends WritableComparator {

    public Comparator() {
      super(CountKey.class, true);
    }

    @Override
    public int compare(byte[] b1, int s1, int l1, byte[] b2, int s2, int l2) {
      int slot1 = readInt(b1, s1);
      int slot2 = readInt(b2, s2);
      int cmp = Integer.compare(slot1, slot2);
      if (cmp != 0) return cmp;
      try {
        int n1 = WritableUtils.decodeVIntSize(b1[s1 + 4]);
        int n2 = WritableUtils.decodeVIntSize(b2[s2 + 4]);
        int len1 = readVInt(b1, s1 + 4);
        int len2 = readVInt(b2, s2 + 4);
        return compareBytes(b1, s1 + 4 + n1, len1, b2, s2 + 4 + n2, len2);
      } catch (IOException e) {
        throw new IllegalArgumentException(e);
      }
    }
  }

  // Register the raw comparator
  static {
    WritableComparator.define(CountKey.class, new Comparator());
  }
}
