package com.jentfoo.imagebatch;

import java.io.File;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.apache.commons.codec.digest.DigestUtils;

public class ConversionCache {
  private final ConcurrentMap<String, CacheEntry> entries;

  public ConversionCache() {
    entries = new ConcurrentHashMap<String, CacheEntry>();
  }

  public static String fingerprint(File sourceFile, String format, String settingsHash) {
    return DigestUtils.md5Hex(sourceFile.getAbsolutePath() + 
                                FileUtils.normalizeFormat(format) + 
                                settingsHash);
  }

  public CacheEntry get(String fingerprint) {
    return entries.get(fingerprint);
  }

  public void put(String fingerprint, CacheEntry entry) {
    entries.put(fingerprint, entry);
  }

  public void invalidate(String fingerprint) {
    entries.remove(fingerprint);
  }

  public int size() {
    return entries.size();
  }

  // stale entries are invalidated
  public CacheEntry getValid(String fingerprint, long sourceLastModified, String settingsHash) {
    CacheEntry entry = entries.get(fingerprint);
    if (entry == null) {
      return null;
    } else if (entry.isValid(sourceLastModified, settingsHash)) {
      return entry;
    } else {
      entries.remove(fingerprint, entry);
      return null;
    }
  }

  public static class CacheEntry {
    private final File outputFile;
    private final long outputSize;
    private final long sourceLastModified;
    private final String settingsHash;

    public CacheEntry(File outputFile, long outputSize, 
                      long sourceLastModified, String settingsHash) {
      this.outputFile = outputFile;
      this.outputSize = outputSize;
      this.sourceLastModified = sourceLastModified;
      this.settingsHash = settingsHash;
    }

    public File getOutputFile() {
      return outputFile;
    }

    public long getOutputSize() {
      return outputSize;
    }

    public long getSourceLastModified() {
      return sourceLastModified;
    }

    public String getSettingsHash() {
      return settingsHash;
    }

    public boolean isValid(long currentSourceLastModified, String currentSettingsHash) {
      if (currentSourceLastModified > sourceLastModified) {
        return false;
      } else if (! outputFile.exists()) {
        return false;
      } else {
        return settingsHash.equals(currentSettingsHash);
      }
    }
  }
}
