package com.jentfoo.imagebatch;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints one line per completed file.  When run as a recurring task it also logs an estimate of 
 * how far along the run is.
 */
public class ProgressReporter implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(ProgressReporter.class);

  private final int totalCount;
  private final PrintStream out;
  private final AtomicInteger processedCount;

  public ProgressReporter(int totalCount, PrintStream out) {
    this(totalCount, 0, out);
  }

  public ProgressReporter(int totalCount, int alreadyProcessed, PrintStream out) {
    this.totalCount = totalCount;
    this.out = out;
    this.processedCount = new AtomicInteger(alreadyProcessed);
  }

  public int getProcessedCount() {
    return processedCount.get();
  }

  public void update(ConversionResult result) {
    int count = processedCount.incrementAndGet();
    String status;
    if (result.isFailed()) {
      status = "FAIL";
    } else if (result.isSkipped()) {
      status = "SKIP";
    } else {
      status = "OK  ";
    }

    out.println("[" + count + "/" + totalCount + "] " + status + " " + 
                  result.getOriginalFile().getName());
  }

  @Override
  public void run() {
    int count = processedCount.get();
    if (totalCount > 0 && count < totalCount) {
      log.info("Estimated % done: {}% - ( {} out of {} )", percentDone(count), count, totalCount);
    }
  }

  public void finish() {
    out.println("Finished " + processedCount.get() + " of " + totalCount + " files");
  }

  private String percentDone(int count) {
    String percent = Double.toString((count / (double)totalCount) * 100);

    return percent.substring(0, Math.min(percent.length(), 5));
  }
}
