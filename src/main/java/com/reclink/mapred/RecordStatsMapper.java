package com.reclink.mapred;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.hadoop.io.LongWritable;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.mapreduce.Counter;
import org.apache.hadoop.mapreduce.Mapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mapper for the statistics job.
 *
 * Counts records per file and values per attribute for its split. Uses
 * in-mapper combining: counts are aggregated locally and flushed when the
 * local maps grow too large and at the end of the split. A re-run attempt
 * starts from empty maps, and only the output of the committed attempt
 * reaches the reducers.
 *
 * Input: JSON record lines
 * Output: <(slot, value), count>
 */
public class RecordStatsMapper extends Mapper<LongWritable, Text, CountKey, LongWritable> {

  private static final Logger LOG = LoggerFactory.getLogger(RecordStatsMapper.class);

  // Reusable objects to avoid GC pressure
  private final RecordWritable record = new RecordWritable();
  private final CountKey outKey = new CountKey();
  private final LongWritable outVal = new LongWritable();

  // Configuration
  private int numAttributes;
  private int maxLocalEntries;

  // Counters
  private Counter processed, malformed, mismatched, emitted;

  // IN-MAPPER COMBINING: local aggregation maps
  private Map<String, long[]> fileCounts;
  private List<Map<String, long[]>> valueCounts;
  private int localEntries;
  private long totalTimeNs = 0;

  @Override
  protected void setup(Context ctx) {
    numAttributes = AttributeSpecs.fromConfiguration(ctx.getConfiguration()).size();
    maxLocalEntries = ctx.getConfiguration()
      .getInt(AttributeSpecs.MAX_LOCAL_ENTRIES_KEY, AttributeSpecs.DEFAULT_MAX_LOCAL_ENTRIES);
    processed = ctx.getCounter(IndexingMetrics.StatsMetrics.RECORDS_PROCESSED);
    malformed = ctx.getCounter(IndexingMetrics.StatsMetrics.RECORDS_MALFORMED);
    mismatched = ctx.getCounter(IndexingMetrics.StatsMetrics.RECORDS_SCHEMA_MISMATCH);
    emitted = ctx.getCounter(IndexingMetrics.StatsMetrics.COUNTS_EMITTED);
    fileCounts = new HashMap<>();
    valueCounts = new ArrayList<>(numAttributes);
    for (int i = 0; i < numAttributes; i++) {
      valueCounts.add(new HashMap<>());
    }
    localEntries = 0;
  }

  @Override
  protected void map(LongWritable key, Text val, Context ctx)
      throws IOException, InterruptedException {
    long startTime = System.nanoTime();
    String line = val.toString().trim();
    if (line.isEmpty()) {
      return;
    }

    if (!record.parseFromJson(line)) {
      malformed.increment(1);
      totalTimeNs += (System.nanoTime() - startTime);
      return;
    }

    // Rejected records fail the job in the driver, no retry
    if (record.numValues() != numAttributes) {
      if (mismatched.getValue() == 0) {
        LOG.warn(
          "Record '{}' has {} value(s), expected {}",
          record.getId(),
          record.numValues(),
          numAttributes
        );
      }
      mismatched.increment(1);
      totalTimeNs += (System.nanoTime() - startTime);
      return;
    }
    processed.increment(1);

    emit(fileCounts, record.getFileId());
    String[] values = record.getValues();
    for (int i = 0; i < numAttributes; i++) {
      emit(valueCounts.get(i), values[i]);
    }

    // Flush if maps are getting too large
    if (localEntries >= maxLocalEntries) {
      flush(ctx);
    }

    // Accumulate execution time
    totalTimeNs += (System.nanoTime() - startTime);
  }

  @Override
  protected void cleanup(Context ctx) throws IOException, InterruptedException {
    flush(ctx);
    // Convert accumulated time to milliseconds
    ctx.getCounter(IndexingMetrics.StatsMetrics.MAPPER_TIME_MS)
        .increment(totalTimeNs / 1_000_000);
  }

  /** Flush local maps to context */
  private void flush(Context ctx) throws IOException, InterruptedException {
    write(ctx, CountKey.FILE_SIZES, fileCounts);
    for (int i = 0; i < numAttributes; i++) {
      write(ctx, i, valueCounts.get(i));
    }
    localEntries = 0;
  }

  private void write(Context ctx, int slot, Map<String, long[]> counts)
      throws IOException, InterruptedException {
    for (Map.Entry<String, long[]> e : counts.entrySet()) {
      outKey.set(slot, e.getKey());
      outVal.set(e.getValue()[0]);
      ctx.write(outKey, outVal);
      emitted.increment(1);
    }
    counts.clear();
  }

  /** Aggregate locally instead of emitting immediately */
  private void emit(Map<String, long[]> counts, String value) {
    long[] agg = counts.get(value);
    if (agg == null) {
      agg = new long[1];
      counts.put(value, agg);
      localEntries++;
    }
    agg[0]++;
  }
}
