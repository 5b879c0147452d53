package com.jentfoo.imagebatch;

import java.io.PrintStream;
import java.util.Locale;
import java.util.Map;

public class StatisticsReport {
  private static final int RULE_WIDTH = 50;

  private final PrintStream out;

  public StatisticsReport(PrintStream out) {
    this.out = out;
  }

  public void print(ConversionStatistics stats) {
    stats.calculate();

    out.println();
    out.println("CONVERSION REPORT");
    out.println(repeat('=', RULE_WIDTH));
    out.println("Converted: " + stats.getConvertedFiles());
    out.println("Skipped: " + stats.getSkippedFiles());
    out.println("Failed: " + stats.getFailedFiles());
    out.println("Total processed: " + stats.getTotalFiles());

    if (stats.getTotalSizeBefore() > 0) {
      out.println();
      out.println("SIZE ANALYSIS");
      out.println("Original size: " + formatBytes(stats.getTotalSizeBefore()));
      out.println("New size: " + formatBytes(stats.getTotalSizeAfter()));
      if (stats.getSpaceSaved() > 0) {
        out.println(String.format(Locale.ROOT, "Space saved: %s (%.1f%% reduction)", 
                                  formatBytes(stats.getSpaceSaved()), 
                                  (1 - stats.getCompressionRatio()) * 100));
      } else if (stats.getSpaceSaved() < 0) {
        out.println("Size increased: " + formatBytes(-stats.getSpaceSaved()));
      }
    }

    out.println();
    out.println("PERFORMANCE");
    out.println("Total time: " + stats.getTotalDurationMillis() + "ms");
    out.println("Average per file: " + stats.getAverageDurationMillis() + "ms");
    if (stats.getConvertedFiles() > 0 && stats.getTotalDurationMillis() > 0) {
      double rate = stats.getConvertedFiles() / (stats.getTotalDurationMillis() / 1000d);
      out.println(String.format(Locale.ROOT, "Processing rate: %.1f files/sec", rate));
    }

    if (! stats.getFailureReasons().isEmpty()) {
      out.println();
      out.println("FAILURE ANALYSIS");
      for (Map.Entry<String, Integer> e : stats.getFailureReasons().entrySet()) {
        out.println("  * " + e.getKey() + ": " + e.getValue() + " files");
      }
    }
  }

  public static String formatBytes(long bytes) {
    final int unit = 1024;
    if (bytes < unit) {
      return bytes + " B";
    }

    long div = unit;
    int exp = 0;
    for (long n = bytes / unit; n >= unit; n /= unit) {
      div *= unit;
      exp++;
    }

    return String.format(Locale.ROOT, "%.1f %cB", bytes / (double)div, "KMGTPE".charAt(exp));
  }

  private static String repeat(char c, int count) {
    StringBuilder sb = new StringBuilder(count);
    for (int i = 0; i < count; i++) {
      sb.append(c);
    }
    return sb.toString();
  }
}
