package com.jentfoo.imagebatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running totals over the results of a run.  Fed by the single thread consuming results, so it 
 * is not thread safe.  Derived values are only available after {@link #calculate()}.
 */
public class ConversionStatistics {
  private int totalFiles = 0;
  private int convertedFiles = 0;
  private int skippedFiles = 0;
  private int failedFiles = 0;
  private long totalSizeBefore = 0;
  private long totalSizeAfter = 0;
  private long totalDurationMillis = 0;
  private final Map<String, Integer> failureReasons = new LinkedHashMap<String, Integer>();

  private boolean calculated = false;
  private long averageDurationMillis = 0;
  private long spaceSaved = 0;
  private double compressionRatio = 0;

  public void addResult(ConversionResult result) {
    if (calculated) {
      throw new IllegalStateException("Statistics already calculated");
    }

    totalFiles++;
    totalDurationMillis += result.getDurationMillis();

    if (result.isFailed()) {
      failedFiles++;
      String reason = result.getFailureMessage();
      Integer count = failureReasons.get(reason);
      failureReasons.put(reason, count == null ? 1 : count + 1);
    } else if (result.isSkipped()) {
      skippedFiles++;
    } else {
      convertedFiles++;
      totalSizeBefore += result.getOriginalSize();
      totalSizeAfter += result.getNewSize();
    }
  }

  /**
   * Computes the average duration, space saved and compression ratio.  Only the first call has 
   * an effect.
   */
  public void calculate() {
    if (calculated) {
      return;
    }
    calculated = true;

    if (totalFiles > 0) {
      averageDurationMillis = totalDurationMillis / totalFiles;
    }
    spaceSaved = totalSizeBefore - totalSizeAfter;
    if (totalSizeBefore > 0) {
      compressionRatio = totalSizeAfter / (double)totalSizeBefore;
    }
  }

  public boolean isCalculated() {
    return calculated;
  }

  public int getTotalFiles() {
    return totalFiles;
  }

  public int getConvertedFiles() {
    return convertedFiles;
  }

  public int getSkippedFiles() {
    return skippedFiles;
  }

  public int getFailedFiles() {
    return failedFiles;
  }

  public long getTotalSizeBefore() {
    return totalSizeBefore;
  }

  public long getTotalSizeAfter() {
    return totalSizeAfter;
  }

  public long getTotalDurationMillis() {
    return totalDurationMillis;
  }

  public Map<String, Integer> getFailureReasons() {
    return Collections.unmodifiableMap(failureReasons);
  }

  public long getAverageDurationMillis() {
    verifyCalculated();
    return averageDurationMillis;
  }

  /**
   * @return bytes saved, negative when the converted files grew
   */
  public long getSpaceSaved() {
    verifyCalculated();
    return spaceSaved;
  }

  /**
   * @return new bytes over original bytes, zero when nothing was converted
   */
  public double getCompressionRatio() {
    verifyCalculated();
    return compressionRatio;
  }

  private void verifyCalculated() {
    if (! calculated) {
      throw new IllegalStateException("Statistics not calculated yet");
    }
  }
}
