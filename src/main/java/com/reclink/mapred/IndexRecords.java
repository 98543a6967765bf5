package com.reclink.mapred;

import com.reclink.Attribute;
import com.reclink.EmptyDomainException;
import com.reclink.RecordsCache;
import com.reclink.RecordsIndexException;
import com.reclink.SchemaMismatchException;
import com.reclink.StatusListener;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.fs.FileStatus;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.io.LongWritable;
import org.apache.hadoop.io.SequenceFile;
import org.apache.hadoop.mapreduce.Job;
import org.apache.hadoop.mapreduce.lib.input.FileInputFormat;
import org.apache.hadoop.mapreduce.lib.input.TextInputFormat;
import org.apache.hadoop.mapreduce.lib.output.FileOutputFormat;
import org.apache.hadoop.mapreduce.lib.output.SequenceFileOutputFormat;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;

/**
 * Builds a {@link RecordsCache} with one MapReduce pass over the raw records.
 *
 * The job counts records per file and values per attribute
 * (RecordStatsMapper, CountSumCombiner, CountSumReducer). Once it has
 * completed, the driver reads the committed counts, indexes every attribute
 * and writes the cache for {@link TransformRecords} and the inference engine.
 *
 * OUTPUT:
 * - <workDir>/counts/part-r-* : SequenceFile<CountKey, LongWritable>
 * - <workDir>/records-cache.bin : the cache
 */
public class IndexRecords extends Configured implements Tool {

  public static final String COUNTS_DIR = "counts";
  public static final String CACHE_FILE = "records-cache.bin";

  /**
   * Runs the statistics job and writes the cache to {@code workDir}.
   *
   * @throws SchemaMismatchException if any record does not have one value per attribute
   * @throws EmptyDomainException if the input holds no valid record
   * @throws IOException if the job fails
   */
  public static RecordsCache buildCache(
    Configuration conf,
    Path input,
    Path workDir,
    int numReducers,
    StatusListener status
  ) throws IOException, InterruptedException, ClassNotFoundException {
    List<Attribute> attributes = AttributeSpecs.fromConfiguration(conf);
    int numAttributes = attributes.size();
    int maxClusterSize = AttributeSpecs.maxClusterSize(conf);
    FileSystem fs = workDir.getFileSystem(conf);

    // Fast fail on the first record, before any task is launched
    RecordWritable first = firstRecord(input.getFileSystem(conf), input);
    if (first == null) {
      throw new EmptyDomainException(attributes.get(0).getName());
    }
    if (first.numValues() != numAttributes) {
      throw new SchemaMismatchException(first.getId(), numAttributes, first.numValues());
    }

    Path countsPath = new Path(workDir, COUNTS_DIR);
    if (fs.exists(countsPath)) {
      fs.delete(countsPath, true);
    }

    Job job = Job.getInstance(conf, "Records statistics");
    job.setJarByClass(IndexRecords.class);

    job.setMapperClass(RecordStatsMapper.class);
    job.setMapOutputKeyClass(CountKey.class);
    job.setMapOutputValueClass(LongWritable.class);
    job.setCombinerClass(CountSumCombiner.class);
    job.setReducerClass(CountSumReducer.class);
    job.setNumReduceTasks(numReducers);
    job.setOutputKeyClass(CountKey.class);
    job.setOutputValueClass(LongWritable.class);

    job.setInputFormatClass(TextInputFormat.class);
    job.setOutputFormatClass(SequenceFileOutputFormat.class);
    FileInputFormat.addInputPath(job, input);
    FileOutputFormat.setOutputPath(job, countsPath);

    status.emit("Gathering statistics from source data files.");
    if (!job.waitForCompletion(true)) {
      throw new IOException("statistics job failed: " + job.getStatus().getFailureInfo());
    }

    long mismatched = job.getCounters()
      .findCounter(IndexingMetrics.StatsMetrics.RECORDS_SCHEMA_MISMATCH).getValue();
    if (mismatched > 0) {
      throw SchemaMismatchException.rejected(mismatched, numAttributes);
    }

    // Counts are readable only now that every task has committed
    Map<String, Long> fileSizes = new HashMap<>();
    List<Map<String, Long>> valueCounts = new ArrayList<>(numAttributes);
    for (int i = 0; i < numAttributes; i++) {
      valueCounts.add(new HashMap<>());
    }
    readCounts(fs, countsPath, conf, fileSizes, valueCounts);

    long total = 0;
    for (long size : fileSizes.values()) {
      total += size;
    }
    status.emit(
      String.format(
        "Finished gathering statistics from %d records across %d file(s).",
        total,
        fileSizes.size()
      )
    );

    RecordsCache cache = RecordsCache.assemble(
      attributes,
      valueCounts,
      fileSizes,
      maxClusterSize,
      status
    );
    RecordsCacheWritable.writeTo(fs, new Path(workDir, CACHE_FILE), cache);
    return cache;
  }

  private static void readCounts(
    FileSystem fs,
    Path countsPath,
    Configuration conf,
    Map<String, Long> fileSizes,
    List<Map<String, Long>> valueCounts
  ) throws IOException {
    FileStatus[] parts = fs.globStatus(new Path(countsPath, "part-r-*"));
    if (parts == null) {
      return;
    }
    CountKey key = new CountKey();
    LongWritable count = new LongWritable();
    for (FileStatus part : parts) {
      try (
        SequenceFile.Reader reader = new SequenceFile.Reader(
          conf,
          SequenceFile.Reader.file(part.getPath())
        )
      ) {
        while (reader.next(key, count)) {
          Map<String, Long> target = key.isFileSize()
            ? fileSizes
            : valueCounts.get(key.getSlot());
          target.merge(key.getValue(), count.get(), Long::sum);
        }
      }
    }
  }

  /**
   * First well-formed record of the input, or null if there is none.
   */
  static RecordWritable firstRecord(FileSystem fs, Path input) throws IOException {
    List<Path> files = new ArrayList<>();
    if (fs.getFileStatus(input).isDirectory()) {
      for (FileStatus status : fs.listStatus(input)) {
        String name = status.getPath().getName();
        if (status.isFile() && !name.startsWith("_") && !name.startsWith(".")) {
          files.add(status.getPath());
        }
      }
      files.sort(null);
    } else {
      files.add(input);
    }

    RecordWritable record = new RecordWritable();
    for (Path file : files) {
      try (
        BufferedReader reader = new BufferedReader(
          new InputStreamReader(fs.open(file), StandardCharsets.UTF_8)
        )
      ) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (record.parseFromJson(line.trim())) {
            return record;
          }
        }
      }
    }
    return null;
  }

  /**
   * Main execution method for the indexing job.
   */
  @Override
  public int run(String[] args) throws Exception {
    if (args.length < 2 || args.length > 3) {
      System.err.println("Usage: IndexRecords <input> <workDir> [numReducers]");
      System.err.println("  input:        JSON record lines");
      System.err.println("  workDir:      Output directory for counts and the records cache");
      System.err.println("  numReducers:  optional, default is 1");
      System.err.println();
      System.err.println("Attributes are read from -D" + AttributeSpecs.ATTRIBUTES_KEY + "=a,b,...");
      return 1;
    }

    int numReducers = 1;
    if (args.length == 3) {
      try {
        numReducers = Integer.parseInt(args[2]);
        if (numReducers < 1) {
          System.err.println("Error: numReducers must be >= 1");
          return 1;
        }
      } catch (NumberFormatException e) {
        System.err.println("Error: numReducers must be an integer");
        return 1;
      }
    }

    Configuration conf = getConf();
    Path input = new Path(args[0]);
    Path workDir = new Path(args[1]);

    System.out.println("=== Starting Records Indexing ===");
    System.out.println("Input:         " + input);
    System.out.println("Work dir:      " + workDir);
    System.out.println("Num reducers:  " + numReducers);
    System.out.println();

    long t0 = System.currentTimeMillis();
    RecordsCache cache;
    try {
      cache = buildCache(conf, input, workDir, numReducers, System.out::println);
    } catch (RecordsIndexException e) {
      System.err.println("ERROR: " + e.getMessage());
      return 1;
    }
    long t1 = System.currentTimeMillis();

    System.out.println("\n=== Indexing Completed ===");
    System.out.printf("Total time:      %.1f seconds%n", (t1 - t0) / 1000.0);
    System.out.printf("Records:         %d%n", cache.numRecords());
    System.out.printf("Files:           %d%n", cache.getFileSizes().size());
    for (int i = 0; i < cache.numAttributes(); i++) {
      System.out.printf(
        "Attribute %-20s %d distinct value(s)%n",
        "'" + cache.getIndexedAttribute(i).getName() + "':",
        cache.getIndexedAttribute(i).getIndex().domainSize()
      );
    }
    System.out.println("\nCache: " + new Path(workDir, CACHE_FILE));
    return 0;
  }

  public static void main(String[] args) throws Exception {
    System.exit(ToolRunner.run(new IndexRecords(), args));
  }
}
