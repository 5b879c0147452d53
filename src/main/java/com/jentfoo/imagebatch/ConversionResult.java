package com.jentfoo.imagebatch;

import java.io.File;

public class ConversionResult {
  private final File originalFile;
  private final File newFile;
  private final long originalSize;
  private final long newSize;
  private final long durationMillis;
  private final Exception failure;

  public ConversionResult(File originalFile, File newFile, 
                          long originalSize, long newSize, 
                          long durationMillis, Exception failure) {
    this.originalFile = originalFile;
    this.newFile = newFile;
    this.originalSize = originalSize;
    this.newSize = newSize;
    this.durationMillis = durationMillis;
    this.failure = failure;
  }

  public File getOriginalFile() {
    return originalFile;
  }

  public File getNewFile() {
    return newFile;
  }

  public long getOriginalSize() {
    return originalSize;
  }

  public long getNewSize() {
    return newSize;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  public Exception getFailure() {
    return failure;
  }

  public boolean isFailed() {
    return failure != null;
  }

  // already in the target format, or a dry run
  public boolean isSkipped() {
    return failure == null && newSize == 0;
  }

  public String getFailureMessage() {
    if (failure == null) {
      return null;
    } else if (failure.getMessage() == null) {
      return failure.getClass().getSimpleName();
    } else {
      return failure.getMessage();
    }
  }

  @Override
  public String toString() {
    if (failure != null) {
      return "FAIL " + originalFile + ": " + getFailureMessage();
    } else if (isSkipped()) {
      return "SKIP " + originalFile;
    } else {
      return "OK " + originalFile + " -> " + newFile + 
               " (" + originalSize + " -> " + newSize + " bytes)";
    }
  }
}
