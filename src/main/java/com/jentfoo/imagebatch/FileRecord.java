package com.jentfoo.imagebatch;

import java.io.File;

/**
 * A candidate image found while collecting the input tree.
 */
public class FileRecord {
  private final File file;
  private final String relativePath;
  private final File directory;
  private final String extension;
  private final long size;

  public FileRecord(File file, String relativePath, 
                    File directory, String extension, long size) {
    this.file = file;
    this.relativePath = relativePath;
    this.directory = directory;
    this.extension = extension;
    this.size = size;
  }

  public File getFile() {
    return file;
  }

  public String getRelativePath() {
    return relativePath;
  }

  public File getDirectory() {
    return directory;
  }

  public String getExtension() {
    return extension;
  }

  public long getSize() {
    return size;
  }

  @Override
  public String toString() {
    return relativePath;
  }
}
