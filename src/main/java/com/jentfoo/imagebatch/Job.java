package com.jentfoo.imagebatch;

import java.io.File;

public class Job {
  private final File sourceFile;
  private final String targetFormat;
  private final File outputFile;

  public Job(File sourceFile, String targetFormat) {
    this(sourceFile, targetFormat, null);
  }

  /**
   * @param outputFile pre-resolved destination, or {@code null} to write beside the source
   */
  public Job(File sourceFile, String targetFormat, File outputFile) {
    if (sourceFile == null) {
      throw new IllegalArgumentException("Must provide source file");
    } else if (targetFormat == null || targetFormat.isEmpty()) {
      throw new IllegalArgumentException("Must provide target format");
    }

    this.sourceFile = sourceFile;
    this.targetFormat = FileUtils.normalizeFormat(targetFormat);
    this.outputFile = outputFile;
  }

  public File getSourceFile() {
    return sourceFile;
  }

  public String getTargetFormat() {
    return targetFormat;
  }

  public File getOutputFile() {
    return outputFile;
  }

  @Override
  public String toString() {
    return sourceFile.getPath() + " -> " + targetFormat;
  }
}
