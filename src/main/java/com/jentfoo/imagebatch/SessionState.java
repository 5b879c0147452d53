package com.jentfoo.imagebatch;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.codec.binary.Hex;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Progress of one conversion run, persisted after every completed file so an interrupted run can 
 * be resumed.  Only mutated by the thread consuming results.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionState {
  private static final int SESSION_ID_BYTES = 8;
  private static final SecureRandom RANDOM = new SecureRandom();

  private List<String> processedFiles = new ArrayList<String>();
  private Instant startTime;
  private String inputDir;
  private String targetFormat;
  private int totalFiles;
  private String sessionId;

  // for jackson
  public SessionState() {
  }

  public SessionState(String inputDir, String targetFormat, int totalFiles) {
    this.inputDir = inputDir;
    this.targetFormat = targetFormat;
    this.totalFiles = totalFiles;
    this.startTime = Instant.now();
    this.sessionId = generateSessionId();
  }

  public static String generateSessionId() {
    byte[] bytes = new byte[SESSION_ID_BYTES];
    RANDOM.nextBytes(bytes);
    return Hex.encodeHexString(bytes);
  }

  public void addProcessedFile(String path) {
    processedFiles.add(path);
  }

  @JsonIgnore
  public Set<String> getProcessedFileSet() {
    return new HashSet<String>(processedFiles);
  }

  @JsonIgnore
  public int getProcessedCount() {
    return processedFiles.size();
  }

  public List<String> getProcessedFiles() {
    return Collections.unmodifiableList(processedFiles);
  }

  public void setProcessedFiles(List<String> processedFiles) {
    if (processedFiles == null) {
      this.processedFiles = new ArrayList<String>();
    } else {
      this.processedFiles = new ArrayList<String>(processedFiles);
    }
  }

  public Instant getStartTime() {
    return startTime;
  }

  public void setStartTime(Instant startTime) {
    this.startTime = startTime;
  }

  public String getInputDir() {
    return inputDir;
  }

  public void setInputDir(String inputDir) {
    this.inputDir = inputDir;
  }

  public String getTargetFormat() {
    return targetFormat;
  }

  public void setTargetFormat(String targetFormat) {
    this.targetFormat = targetFormat;
  }

  public int getTotalFiles() {
    return totalFiles;
  }

  public void setTotalFiles(int totalFiles) {
    this.totalFiles = totalFiles;
  }

  public String getSessionId() {
    return sessionId;
  }

  public void setSessionId(String sessionId) {
    this.sessionId = sessionId;
  }
}
