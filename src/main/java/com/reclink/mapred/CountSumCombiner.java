package com.reclink.mapred;

import java.io.IOException;
import org.apache.hadoop.io.LongWritable;
import org.apache.hadoop.mapreduce.Reducer;

/**
 * Combiner for the statistics job - sums counts locally before shuffle.
 * Addition is associative and commutative, so it may run any number of times.
 */
public class CountSumCombiner extends Reducer<CountKey, LongWritable, CountKey, LongWritable> {

  private final LongWritable out = new LongWritable();

  @Override
  protected void reduce(CountKey key, Iterable<LongWritable> vals, Context ctx)
      throws IOException, InterruptedException {
    long count = 0;
    for (LongWritable v : vals) {
      count += v.get();
      ctx.getCounter(IndexingMetrics.StatsMetrics.COMBINER_INPUT_COUNTS).increment(1);
    }
    out.set(count);
    ctx.write(key, out);
    ctx.getCounter(IndexingMetrics.StatsMetrics.COMBINER_OUTPUT_COUNTS).increment(1);
  }
}
