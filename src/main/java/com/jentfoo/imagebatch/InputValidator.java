package com.jentfoo.imagebatch;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class InputValidator {
  public static final Set<String> SUPPORTED_FORMATS = 
      Collections.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList("png", "jpg", "jpeg", 
                                                                          "webp", "bmp")));

  public static void validateInputs(String inputDir, String targetFormat) throws ValidationException {
    if (inputDir == null || inputDir.trim().isEmpty()) {
      throw new ValidationException("inputDir", "input directory is required");
    }

    File dir = new File(inputDir);
    if (! dir.exists()) {
      throw new ValidationException("inputDir", "input directory " + inputDir + " does not exist");
    } else if (! dir.isDirectory()) {
      throw new ValidationException("inputDir", "input path " + inputDir + " is not a directory");
    } else if (! dir.canRead() || dir.list() == null) {
      throw new ValidationException("inputDir", 
                                    "input directory " + inputDir + " does not have read permission");
    } else if (! isSafePath(dir.getAbsolutePath())) {
      throw new ValidationException("inputDir", "input directory " + inputDir + " contains path traversal");
    }

    validateFormat(targetFormat);
  }

  public static void validateFormat(String targetFormat) throws ValidationException {
    if (targetFormat == null || targetFormat.trim().isEmpty()) {
      throw new ValidationException("targetFormat", "target format is required");
    } else if (! SUPPORTED_FORMATS.contains(FileUtils.normalizeFormat(targetFormat))) {
      throw new ValidationException("targetFormat", 
                                    "target format " + targetFormat + " is not supported");
    }
  }

  /**
   * Checks the format is supported and is one of the configured extensions.  BMP is always 
   * accepted as a target even though it is not collected by default.
   */
  public static void validateTargetFormat(String targetFormat, 
                                          Collection<String> extensions) throws ValidationException {
    validateFormat(targetFormat);

    String format = FileUtils.normalizeFormat(targetFormat);
    if (format.equals("bmp")) {
      return;
    }
    for (String extension : extensions) {
      if (FileUtils.isSameFormat(extension, format)) {
        return;
      }
    }
    throw new ValidationException("targetFormat", 
                                  "target format " + targetFormat + " is not a configured extension");
  }

  public static void validateOptions(int quality, int workers, 
                                     int maxDimension, double rateLimit) throws ValidationException {
    if (quality < 1 || quality > 100) {
      throw new ValidationException("quality", "quality must be between 1 and 100: " + quality);
    } else if (workers < 1) {
      throw new ValidationException("workers", "at least one worker is required: " + workers);
    } else if (maxDimension < 0) {
      throw new ValidationException("maxDimension", "max dimension can not be negative: " + maxDimension);
    } else if (rateLimit < 0) {
      throw new ValidationException("rateLimit", "rate limit can not be negative: " + rateLimit);
    }
  }

  /**
   * Rejects paths which still contain a {@code ..} segment once cleaned.
   */
  public static boolean isSafePath(String path) {
    Path cleaned;
    try {
      cleaned = Paths.get(path).normalize();
    } catch (InvalidPathException e) {
      return false;
    }

    for (Path segment : cleaned) {
      if (segment.toString().equals("..")) {
        return false;
      }
    }
    return true;
  }

  public static boolean hasSufficientSpace(File dir, long requiredBytes) {
    File existing = dir.getAbsoluteFile();
    while (existing != null && ! existing.exists()) {
      existing = existing.getParentFile();
    }
    if (existing == null) {
      return false;
    }

    return existing.getUsableSpace() > requiredBytes;
  }
}
