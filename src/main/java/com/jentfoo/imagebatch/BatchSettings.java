package com.jentfoo.imagebatch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Layout options for collecting input files and placing outputs.  Mapped from the {@code batch} 
 * section of the config file (snake case keys).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BatchSettings {
  private boolean recursiveSearch = true;
  private int maxDepth = 0;
  private boolean preserveStructure = true;
  private String outputDir = "";
  private boolean skipEmptyDirectories = true;
  private boolean followSymlinks = false;

  public boolean isRecursiveSearch() {
    return recursiveSearch;
  }

  public void setRecursiveSearch(boolean recursiveSearch) {
    this.recursiveSearch = recursiveSearch;
  }

  /**
   * @return deepest allowed number of separators in a path relative to the input root, zero for 
   *           no limit
   */
  public int getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  public boolean isPreserveStructure() {
    return preserveStructure;
  }

  public void setPreserveStructure(boolean preserveStructure) {
    this.preserveStructure = preserveStructure;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir == null ? "" : outputDir;
  }

  public boolean hasOutputDir() {
    return outputDir != null && ! outputDir.trim().isEmpty();
  }

  public boolean isSkipEmptyDirectories() {
    return skipEmptyDirectories;
  }

  public void setSkipEmptyDirectories(boolean skipEmptyDirectories) {
    this.skipEmptyDirectories = skipEmptyDirectories;
  }

  public boolean isFollowSymlinks() {
    return followSymlinks;
  }

  public void setFollowSymlinks(boolean followSymlinks) {
    this.followSymlinks = followSymlinks;
  }
}
