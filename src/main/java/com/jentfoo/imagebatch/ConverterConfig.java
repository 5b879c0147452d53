package com.jentfoo.imagebatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * User defaults stored in {@code config.yaml}.  Command line flags override these per run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {
  public static final List<String> DEFAULT_EXTENSIONS = 
      Arrays.asList("png", "jpg", "jpeg", "webp");

  private String defaultFormat = "png";
  private int quality = ConvertOptions.DEFAULT_QUALITY;
  private int workers = Runtime.getRuntime().availableProcessors();
  private int maxDimension = 0;
  private String logLevel = "info";
  private List<String> extensions = new ArrayList<String>(DEFAULT_EXTENSIONS);
  private Map<String, Map<String, Object>> outputSettings = defaultOutputSettings();
  private boolean autoBackup = false;
  private boolean resumeEnabled = true;
  private boolean keepOriginal = false;
  private boolean dryRun = false;
  private double rateLimit = 0;
  private BatchSettings batch = new BatchSettings();

  private static Map<String, Map<String, Object>> defaultOutputSettings() {
    Map<String, Map<String, Object>> result = new LinkedHashMap<String, Map<String, Object>>();

    Map<String, Object> png = new LinkedHashMap<String, Object>();
    png.put("compression", "best_speed");
    result.put("png", png);
    for (String jpegExt : Arrays.asList("jpg", "jpeg")) {
      Map<String, Object> jpeg = new LinkedHashMap<String, Object>();
      jpeg.put("quality", ConvertOptions.DEFAULT_QUALITY);
      result.put(jpegExt, jpeg);
    }
    Map<String, Object> webp = new LinkedHashMap<String, Object>();
    webp.put("quality", ConvertOptions.DEFAULT_QUALITY);
    webp.put("lossless", false);
    result.put("webp", webp);

    return result;
  }

  public String getDefaultFormat() {
    return defaultFormat;
  }

  public void setDefaultFormat(String defaultFormat) {
    this.defaultFormat = defaultFormat;
  }

  public int getQuality() {
    return quality;
  }

  public void setQuality(int quality) {
    this.quality = quality;
  }

  public int getWorkers() {
    return workers;
  }

  public void setWorkers(int workers) {
    this.workers = workers;
  }

  public int getMaxDimension() {
    return maxDimension;
  }

  public void setMaxDimension(int maxDimension) {
    this.maxDimension = maxDimension;
  }

  public String getLogLevel() {
    return logLevel;
  }

  public void setLogLevel(String logLevel) {
    this.logLevel = logLevel;
  }

  public List<String> getExtensions() {
    return extensions;
  }

  public void setExtensions(List<String> extensions) {
    this.extensions = extensions;
  }

  public Map<String, Map<String, Object>> getOutputSettings() {
    return outputSettings;
  }

  public void setOutputSettings(Map<String, Map<String, Object>> outputSettings) {
    this.outputSettings = outputSettings;
  }

  public boolean isAutoBackup() {
    return autoBackup;
  }

  public void setAutoBackup(boolean autoBackup) {
    this.autoBackup = autoBackup;
  }

  public boolean isResumeEnabled() {
    return resumeEnabled;
  }

  public void setResumeEnabled(boolean resumeEnabled) {
    this.resumeEnabled = resumeEnabled;
  }

  public boolean isKeepOriginal() {
    return keepOriginal;
  }

  public void setKeepOriginal(boolean keepOriginal) {
    this.keepOriginal = keepOriginal;
  }

  public boolean isDryRun() {
    return dryRun;
  }

  public void setDryRun(boolean dryRun) {
    this.dryRun = dryRun;
  }

  public double getRateLimit() {
    return rateLimit;
  }

  public void setRateLimit(double rateLimit) {
    this.rateLimit = rateLimit;
  }

  public BatchSettings getBatch() {
    return batch;
  }

  public void setBatch(BatchSettings batch) {
    this.batch = batch == null ? new BatchSettings() : batch;
  }

  /**
   * Quality for the format from {@code output_settings}, falling back to the global quality.
   */
  public int qualityFor(String format) {
    if (outputSettings != null) {
      Map<String, Object> settings = outputSettings.get(FileUtils.normalizeFormat(format));
      if (settings != null && settings.get("quality") instanceof Number) {
        return ((Number)settings.get("quality")).intValue();
      }
    }
    return quality;
  }
}
