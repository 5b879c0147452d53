package com.jentfoo.imagebatch;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.util.Clock;

/**
 * Converts a single image: stat, cache check, decode, optional resize, optional backup, encode, 
 * then removal of the original unless it should be kept.  Safe to share between workers.
 */
public class ImageConverter implements ConverterInterface {
  private static final Logger log = LoggerFactory.getLogger(ImageConverter.class);
  private static final String BACKUP_FOLDER_NAME = "backup";
  private static final String BACKUP_SUFFIX = ".bak";

  private final ConvertOptions options;
  private final ImageCodec codec;
  private final ConversionCache cache;

  public ImageConverter(ConvertOptions options) {
    this(options, new ImageIoCodec(), new ConversionCache());
  }

  public ImageConverter(ConvertOptions options, ImageCodec codec, ConversionCache cache) {
    this.options = options;
    this.codec = codec;
    this.cache = cache;
  }

  public ConversionCache getCache() {
    return cache;
  }

  @Override
  public ConversionResult convert(Job job) {
    long startTime = Clock.accurateForwardProgressingMillis();
    File sourceFile = job.getSourceFile();
    String format = job.getTargetFormat();

    if (! sourceFile.isFile()) {
      return failed(sourceFile, null, 0, startTime, 
                    new ConversionException("failed to stat file: " + sourceFile.getPath() + 
                                              " does not exist"));
    }
    long originalSize = sourceFile.length();
    long sourceLastModified = sourceFile.lastModified();

    if (FileUtils.isSameFormat(FileUtils.getExtension(sourceFile.getName()), format)) {
      log.debug("Already in {} format: {}", format, sourceFile);
      return new ConversionResult(sourceFile, null, originalSize, 0, 
                                  elapsedSince(startTime), null);
    }

    File newFile = job.getOutputFile();
    if (newFile == null) {
      newFile = FileUtils.makeNewFile(sourceFile.getAbsoluteFile().getParentFile(), 
                                      sourceFile, format);
    }

    String settingsHash = options.getSettingsHash();
    String fingerprint = ConversionCache.fingerprint(sourceFile, format, settingsHash);
    ConversionCache.CacheEntry cached = cache.getValid(fingerprint, sourceLastModified, settingsHash);
    if (cached != null) {
      log.debug("Using cached conversion for: {}", sourceFile);
      return new ConversionResult(sourceFile, cached.getOutputFile(), 
                                  originalSize, cached.getOutputSize(), 
                                  elapsedSince(startTime), null);
    }

    try {
      if (options.isDryRun()) {
        boolean resize = options.getMaxDimension() > 0 && needsResize(readDimensions(sourceFile));
        log.info("[DRY-RUN] Would convert: {} -> {}{}", 
                 sourceFile, newFile, resize ? " (resized)" : "");

        return new ConversionResult(sourceFile, newFile, originalSize, 0, 
                                    elapsedSince(startTime), null);
      }

      if (options.isBackup()) {
        try {
          createBackup(sourceFile);
        } catch (IOException e) {
          throw new ConversionException("backup failed", e);
        }
      }

      writeConvertedImage(sourceFile, newFile, format);

      if (! newFile.isFile()) {
        throw new ConversionException("failed to stat output file: " + newFile.getPath());
      }
      long newSize = newFile.length();
      cache.put(fingerprint, 
                new ConversionCache.CacheEntry(newFile, newSize, sourceLastModified, settingsHash));

      if (! options.isKeepOriginal() && ! sourceFile.delete()) {
        // new file is kept even though the job is reported as failed
        return new ConversionResult(sourceFile, newFile, originalSize, newSize, 
                                    elapsedSince(startTime), 
                                    new ConversionException("failed to remove original: " + 
                                                              sourceFile.getPath()));
      }

      return new ConversionResult(sourceFile, newFile, originalSize, newSize, 
                                  elapsedSince(startTime), null);
    } catch (ConversionException e) {
      return failed(sourceFile, newFile, originalSize, startTime, e);
    } catch (RuntimeException e) {
      return failed(sourceFile, newFile, originalSize, startTime, 
                    new ConversionException("failed to convert image", e));
    }
  }

  protected void writeConvertedImage(File sourceFile, File newFile, 
                                     String format) throws ConversionException {
    Dimension originalSize = null;
    if (options.getMaxDimension() > 0) {
      originalSize = readDimensions(sourceFile);
    }

    BufferedImage image;
    try {
      image = codec.decode(sourceFile);
    } catch (IOException e) {
      throw new ConversionException("failed to decode image", e);
    }

    if (originalSize != null && needsResize(originalSize)) {
      Dimension targetSize = scaledDimension(originalSize, options.getMaxDimension());
      log.debug("Resizing {} from {}x{} to {}x{}", sourceFile, 
                originalSize.width, originalSize.height, targetSize.width, targetSize.height);
      try {
        image = codec.resize(image, targetSize.width, targetSize.height);
      } catch (IOException e) {
        throw new ConversionException("failed to resize image", e);
      }
    }

    File tempFile = null;
    boolean moved = false;
    try {
      tempFile = FileUtils.makeTempFile(newFile);
      codec.encode(image, format, options.getQuality(), tempFile);
      FileUtils.moveIntoPlace(tempFile, newFile);
      moved = true;
    } catch (IOException e) {
      throw new ConversionException("failed to encode image", e);
    } finally {
      if (! moved && tempFile != null && tempFile.exists() && ! tempFile.delete()) {
        log.warn("Could not delete temp file: {}", tempFile.getAbsolutePath());
      }
    }
  }

  private Dimension readDimensions(File sourceFile) throws ConversionException {
    try {
      return codec.readDimensions(sourceFile);
    } catch (IOException e) {
      throw new ConversionException("failed to read image header", e);
    }
  }

  private boolean needsResize(Dimension size) {
    int maxDimension = options.getMaxDimension();
    return maxDimension > 0 && 
             (size.width > maxDimension || size.height > maxDimension);
  }

  /**
   * Scales so the larger side becomes {@code maxDimension}, the other side keeps the aspect 
   * ratio.
   */
  public static Dimension scaledDimension(Dimension size, int maxDimension) {
    if (size.width > size.height) {
      int height = (int)Math.round(size.height * (double)maxDimension / size.width);
      return new Dimension(maxDimension, Math.max(1, height));
    } else {
      int width = (int)Math.round(size.width * (double)maxDimension / size.height);
      return new Dimension(Math.max(1, width), maxDimension);
    }
  }

  public static File backupFileFor(File sourceFile) {
    File backupFolder = new File(sourceFile.getAbsoluteFile().getParentFile(), BACKUP_FOLDER_NAME);

    return new File(backupFolder, sourceFile.getName() + BACKUP_SUFFIX);
  }

  private static void createBackup(File sourceFile) throws IOException {
    File backupFile = backupFileFor(sourceFile);
    FileUtils.atomicCopyFile(sourceFile, backupFile);

    log.debug("Backed up {} to {}", sourceFile, backupFile);
  }

  private static ConversionResult failed(File sourceFile, File newFile, long originalSize, 
                                         long startTime, ConversionException failure) {
    return new ConversionResult(sourceFile, newFile, originalSize, 0, 
                                elapsedSince(startTime), failure);
  }

  private static long elapsedSince(long startTime) {
    return Clock.accurateForwardProgressingMillis() - startTime;
  }
}
