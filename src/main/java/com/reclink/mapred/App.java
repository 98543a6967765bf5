package com.reclink.mapred;

import org.apache.hadoop.util.ProgramDriver;

public class App {

  public static void main(String[] args) throws Exception {
    ProgramDriver pgd = new ProgramDriver();
    int exitCode = -1;
    try {
      pgd.addClass(
        "index",
        IndexRecords.class,
        "gather record statistics and build the records cache"
      );
      pgd.addClass(
        "transform",
        TransformRecords.class,
        "replace raw attribute values by value ids using a records cache"
      );
      exitCode = pgd.run(args);
    } catch (Throwable e1) {
      e1.printStackTrace();
    }
    System.exit(exitCode);
  }
}
