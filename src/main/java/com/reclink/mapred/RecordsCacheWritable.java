package com.reclink.mapred;

import com.reclink.AttributeIndex;
import com.reclink.BetaShapeParameters;
import com.reclink.IndexedAttribute;
import com.reclink.RecordsCache;
import com.reclink.SimilarityFn;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FSDataOutputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.Writable;
import org.apache.hadoop.io.WritableUtils;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Writable holder for a {@link RecordsCache}.
 *
 * Values are written in id order, so a cache read back on a worker has
 * exactly the ids of the cache that was written. Similarity functions are
 * stored by class name and re-instantiated with the reader's configuration.
 *
 * Format: numFiles, (fileId, size)*, numAttributes,
 * (name, similarity class, alpha, beta, maxClusterSize, domainSize, (value, count)*)*
 */
public class RecordsCacheWritable extends Configured implements Writable {

  private RecordsCache cache;

  public RecordsCacheWritable() {}

  public RecordsCacheWritable(Configuration conf) {
    super(conf);
  }

  public RecordsCacheWritable(RecordsCache cache) {
    this.cache = cache;
  }

  public RecordsCache get() {
    return cache;
  }

  public void set(RecordsCache cache) {
    this.cache = cache;
  }

  @Override
  public void write(DataOutput out) throws IOException {
    Map<String, Long> fileSizes = cache.getFileSizes();
    WritableUtils.writeVInt(out, fileSizes.size());
    for (Map.Entry<String, Long> e : fileSizes.entrySet()) {
      WritableUtils.writeString(out, e.getKey());
      WritableUtils.writeVLong(out, e.getValue());
    }

    WritableUtils.writeVInt(out, cache.numAttributes());
    for (IndexedAttribute attribute : cache.getIndexedAttributes()) {
      AttributeIndex index = attribute.getIndex();
      WritableUtils.writeString(out, attribute.getName());
      WritableUtils.writeString(out, attribute.getSimilarityFn().getClass().getName());
      out.writeDouble(attribute.getDistortionPrior().getAlpha());
      out.writeDouble(attribute.getDistortionPrior().getBeta());
      WritableUtils.writeVInt(out, index.maxClusterSize());
      WritableUtils.writeVInt(out, index.domainSize());
      long[] counts = index.counts();
      for (int id = 0; id < index.domainSize(); id++) {
        WritableUtils.writeString(out, index.valueOf(id));
        WritableUtils.writeVLong(out, counts[id]);
      }
    }
  }

  @Override
  public void readFields(DataInput in) throws IOException {
    int numFiles = WritableUtils.readVInt(in);
    Map<String, Long> fileSizes = new TreeMap<>();
    for (int i = 0; i < numFiles; i++) {
      fileSizes.put(WritableUtils.readString(in), WritableUtils.readVLong(in));
    }

    int numAttributes = WritableUtils.readVInt(in);
    List<IndexedAttribute> attributes = new ArrayList<>(numAttributes);
    for (int a = 0; a < numAttributes; a++) {
      String name = WritableUtils.readString(in);
      SimilarityFn similarityFn = newSimilarityFn(WritableUtils.readString(in), getConf());
      BetaShapeParameters prior = new BetaShapeParameters(in.readDouble(), in.readDouble());
      int maxClusterSize = WritableUtils.readVInt(in);
      int domainSize = WritableUtils.readVInt(in);
      String[] values = new String[domainSize];
      long[] counts = new long[domainSize];
      for (int id = 0; id < domainSize; id++) {
        values[id] = WritableUtils.readString(in);
        counts[id] = WritableUtils.readVLong(in);
      }
      AttributeIndex index = AttributeIndex.fromOrderedValues(
        name,
        values,
        counts,
        similarityFn,
        maxClusterSize
      );
      attributes.add(new IndexedAttribute(name, similarityFn, prior, index));
    }
    cache = new RecordsCache(attributes, fileSizes);
  }

  private static SimilarityFn newSimilarityFn(String className, Configuration conf)
      throws IOException {
    try {
      Class<? extends SimilarityFn> cls = Class
        .forName(className, true, RecordsCacheWritable.class.getClassLoader())
        .asSubclass(SimilarityFn.class);
      return ReflectionUtils.newInstance(cls, conf);
    } catch (ClassNotFoundException | ClassCastException e) {
      throw new IOException("cannot load similarity function " + className, e);
    }
  }

  /** Writes a cache to a file, replacing any existing one. */
  public static void writeTo(FileSystem fs, Path path, RecordsCache cache) throws IOException {
    try (FSDataOutputStream out = fs.create(path, true)) {
      new RecordsCacheWritable(cache).write(out);
    }
  }

  /**
   * Reads a cache from a file. Similarity functions implementing
   * {@link org.apache.hadoop.conf.Configurable} are configured with
   * {@code conf}, as they are by {@link AttributeSpecs}.
   */
  public static RecordsCache readFrom(Configuration conf, Path path) throws IOException {
    RecordsCacheWritable writable = new RecordsCacheWritable(conf);
    try (FSDataInputStream in = path.getFileSystem(conf).open(path)) {
      writable.readFields(in);
    }
    return writable.get();
  }
}
