package com.reclink.mapred;

import java.io.IOException;
import org.apache.hadoop.io.LongWritable;
import org.apache.hadoop.mapreduce.Reducer;

/**
 * Reducer for the statistics job - one global count per (slot, value).
 *
 * Output: SequenceFile<CountKey, LongWritable>
 */
public class CountSumReducer extends Reducer<CountKey, LongWritable, CountKey, LongWritable> {

  private final LongWritable out = new LongWritable();

  @Override
  protected void reduce(CountKey key, Iterable<LongWritable> vals, Context ctx)
      throws IOException, InterruptedException {
    long count = 0;
    for (LongWritable v : vals) {
      count += v.get();
    }
    out.set(count);
    ctx.write(key, out);
    ctx.getCounter(IndexingMetrics.StatsMetrics.REDUCER_OUTPUT_COUNTS).increment(1);
  }
}
