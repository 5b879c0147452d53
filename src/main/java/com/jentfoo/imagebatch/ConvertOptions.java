package com.jentfoo.imagebatch;

public class ConvertOptions {
  public static final int DEFAULT_QUALITY = 80;

  private final int quality;
  private final int maxDimension;
  private final boolean keepOriginal;
  private final boolean dryRun;
  private final boolean backup;

  public ConvertOptions(int quality, int maxDimension, 
                        boolean keepOriginal, boolean dryRun, boolean backup) {
    if (quality < 1 || quality > 100) {
      throw new IllegalArgumentException("Quality must be between 1 and 100: " + quality);
    } else if (maxDimension < 0) {
      throw new IllegalArgumentException("Max dimension can not be negative: " + maxDimension);
    }

    this.quality = quality;
    this.maxDimension = maxDimension;
    this.keepOriginal = keepOriginal;
    this.dryRun = dryRun;
    this.backup = backup;
  }

  public int getQuality() {
    return quality;
  }

  // zero for no limit
  public int getMaxDimension() {
    return maxDimension;
  }

  public boolean isKeepOriginal() {
    return keepOriginal;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public boolean isBackup() {
    return backup;
  }

  public String getSettingsHash() {
    return quality + "_" + maxDimension;
  }
}
