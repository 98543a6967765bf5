package com.reclink.mapred;

import com.reclink.AttributeIndex;
import com.reclink.IndexedAttribute;
import com.reclink.RecordsCache;
import com.reclink.RecordsIndexException;
import com.reclink.SchemaMismatchException;
import com.reclink.UnseenValueException;
import java.io.IOException;
import java.net.URI;
import java.util.List;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.LongWritable;
import org.apache.hadoop.io.NullWritable;
import org.apache.hadoop.io.Text;
import org.apache.hadoop.mapreduce.Counter;
import org.apache.hadoop.mapreduce.CounterGroup;
import org.apache.hadoop.mapreduce.Job;
import org.apache.hadoop.mapreduce.Mapper;
import org.apache.hadoop.mapreduce.lib.input.FileInputFormat;
import org.apache.hadoop.mapreduce.lib.input.TextInputFormat;
import org.apache.hadoop.mapreduce.lib.output.FileOutputFormat;
import org.apache.hadoop.mapreduce.lib.output.TextOutputFormat;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Map-only job replacing raw attribute values by value ids.
 *
 * The cache written by {@link IndexRecords} is shipped to every task through
 * the job cache files and loaded once per task. Records are independent, so
 * the output does not depend on the input splits.
 *
 * Input: JSON record lines
 * Output: id;fileId;valueId;valueId;...
 *
 * Any unseen value or schema mismatch fails the whole transformation and the
 * output directory is removed.
 */
public class TransformRecords extends Configured implements Tool {

  /**
   * Mapper rewriting one record per input line.
   */
  public static class TransformMapper extends Mapper<LongWritable, Text, NullWritable, Text> {

    private static final Logger LOG = LoggerFactory.getLogger(TransformMapper.class);

    private final RecordWritable record = new RecordWritable();
    private final Text outValue = new Text();
    private final StringBuilder sb = new StringBuilder();

    private List<IndexedAttribute> attributes;
    private int[] ids;
    private Counter transformed, malformed, mismatched, unseen;
    private long totalTimeNs = 0;

    @Override
    protected void setup(Context ctx) throws IOException {
      URI[] cacheFiles = ctx.getCacheFiles();
      if (cacheFiles == null || cacheFiles.length == 0) {
        throw new IOException("no records cache in the job cache files");
      }
      RecordsCache cache = RecordsCacheWritable.readFrom(ctx.getConfiguration(), new Path(cacheFiles[0]));
      attributes = cache.getIndexedAttributes();
      ids = new int[attributes.size()];

      transformed = ctx.getCounter(IndexingMetrics.TransformMetrics.RECORDS_TRANSFORMED);
      malformed = ctx.getCounter(IndexingMetrics.TransformMetrics.RECORDS_MALFORMED);
      mismatched = ctx.getCounter(IndexingMetrics.TransformMetrics.RECORDS_SCHEMA_MISMATCH);
      unseen = ctx.getCounter(IndexingMetrics.TransformMetrics.RECORDS_WITH_UNSEEN_VALUES);
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
      if (record.numValues() != attributes.size()) {
        mismatched.increment(1);
        totalTimeNs += (System.nanoTime() - startTime);
        return;
      }

      // Never substitute an id for an unseen value: count it and drop the record
      String[] values = record.getValues();
      boolean complete = true;
      for (int i = 0; i < values.length; i++) {
        AttributeIndex index = attributes.get(i).getIndex();
        if (index.contains(values[i])) {
          ids[i] = index.idOf(values[i]);
        } else {
          String name = attributes.get(i).getName();
          if (ctx.getCounter(IndexingMetrics.UNSEEN_VALUES_GROUP, name).getValue() == 0) {
            LOG.warn("Record '{}' has unseen value '{}' for attribute '{}'", record.getId(), values[i], name);
          }
          ctx.getCounter(IndexingMetrics.UNSEEN_VALUES_GROUP, name).increment(1);
          complete = false;
        }
      }
      if (!complete) {
        unseen.increment(1);
        totalTimeNs += (System.nanoTime() - startTime);
        return;
      }

      sb.setLength(0);
      sb.append(record.getId()).append(';').append(record.getFileId());
      for (int id : ids) {
        sb.append(';').append(id);
      }
      outValue.set(sb.toString());
      ctx.write(NullWritable.get(), outValue);
      transformed.increment(1);
      totalTimeNs += (System.nanoTime() - startTime);
    }

    @Override
    protected void cleanup(Context ctx) {
      ctx.getCounter(IndexingMetrics.TransformMetrics.MAPPER_TIME_MS)
          .increment(totalTimeNs / 1_000_000);
    }
  }

  /**
   * Runs the transform job.
   *
   * @return number of records written
   * @throws SchemaMismatchException if any record does not have one value per attribute
   * @throws UnseenValueException if any value is missing from its attribute's index
   * @throws IOException if the job fails
   */
  public static long transform(Configuration conf, Path input, Path cacheFile, Path output)
      throws IOException, InterruptedException, ClassNotFoundException {
    FileSystem fs = output.getFileSystem(conf);
    if (fs.exists(output)) {
      fs.delete(output, true);
    }
    int numAttributes = RecordsCacheWritable.readFrom(conf, cacheFile).numAttributes();

    Job job = Job.getInstance(conf, "Records transform");
    job.setJarByClass(TransformRecords.class);
    job.addCacheFile(cacheFile.toUri());

    job.setMapperClass(TransformMapper.class);
    job.setNumReduceTasks(0);
    job.setOutputKeyClass(NullWritable.class);
    job.setOutputValueClass(Text.class);

    job.setInputFormatClass(TextInputFormat.class);
    job.setOutputFormatClass(TextOutputFormat.class);
    FileInputFormat.addInputPath(job, input);
    FileOutputFormat.setOutputPath(job, output);

    if (!job.waitForCompletion(true)) {
      throw new IOException("transform job failed: " + job.getStatus().getFailureInfo());
    }

    long mismatched = job.getCounters()
      .findCounter(IndexingMetrics.TransformMetrics.RECORDS_SCHEMA_MISMATCH).getValue();
    if (mismatched > 0) {
      fs.delete(output, true);
      throw SchemaMismatchException.rejected(mismatched, numAttributes);
    }
    CounterGroup unseen = job.getCounters().getGroup(IndexingMetrics.UNSEEN_VALUES_GROUP);
    for (Counter counter : unseen) {
      if (counter.getValue() > 0) {
        fs.delete(output, true);
        throw UnseenValueException.unseenInPass(counter.getName(), counter.getValue());
      }
    }
    return job.getCounters()
      .findCounter(IndexingMetrics.TransformMetrics.RECORDS_TRANSFORMED).getValue();
  }

  @Override
  public int run(String[] args) throws Exception {
    if (args.length != 3) {
      System.err.println("Usage: TransformRecords <input> <cacheFile> <output>");
      System.err.println("  input:      JSON record lines");
      System.err.println("  cacheFile:  records cache written by IndexRecords");
      System.err.println("  output:     Output directory for integer-coded records");
      return 1;
    }

    long startTime = System.currentTimeMillis();
    System.out.println("=== Starting Records Transform ===");

    long written;
    try {
      written = transform(getConf(), new Path(args[0]), new Path(args[1]), new Path(args[2]));
    } catch (RecordsIndexException e) {
      System.err.println("ERROR: " + e.getMessage());
      return 1;
    }

    long durationMs = System.currentTimeMillis() - startTime;
    System.out.println("\n=== Transform Completed ===");
    System.out.printf("Records written: %d%n", written);
    System.out.printf("Execution time:  %.2f sec%n", durationMs / 1000.0);
    return 0;
  }

  public static void main(String[] args) throws Exception {
    System.exit(ToolRunner.run(new TransformRecords(), args));
  }
}
