package com.jentfoo.imagebatch;

import static org.junit.jupiter.api.Assertions.*;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ImageConverterTest {
  @TempDir
  File tempDir;

  private static ConvertOptions options(boolean keepOriginal) {
    return new ConvertOptions(ConvertOptions.DEFAULT_QUALITY, 0, keepOriginal, false, false);
  }

  @Test
  public void convertRemovesOriginalTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    long originalSize = source.length();

    ConversionResult result = new ImageConverter(options(false)).convert(new Job(source, "jpg"));

    assertFalse(result.isFailed(), result.getFailureMessage());
    assertFalse(result.isSkipped());
    assertFalse(source.exists());
    File expected = new File(tempDir, "photo.jpg");
    assertEquals(expected.getAbsoluteFile(), result.getNewFile().getAbsoluteFile());
    assertTrue(expected.isFile());
    assertEquals(expected.length(), result.getNewSize());
    assertEquals(originalSize, result.getOriginalSize());
    assertEquals(16, TestImages.read(expected).getWidth());
  }

  @Test
  public void convertKeepOriginalTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.jpg");

    ConversionResult result = new ImageConverter(options(true)).convert(new Job(source, "png"));

    assertFalse(result.isFailed(), result.getFailureMessage());
    assertTrue(source.isFile());
    assertTrue(new File(tempDir, "photo.png").isFile());
  }

  @Test
  public void convertToRequestedOutputFileTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    File output = new File(new File(tempDir, "out"), "renamed.bmp");

    ConversionResult result = new ImageConverter(options(true)).convert(new Job(source, "bmp", output));

    assertFalse(result.isFailed(), result.getFailureMessage());
    assertTrue(output.isFile());
    assertEquals(output, result.getNewFile());
    // no temp files left beside the output
    assertEquals(1, output.getParentFile().list().length);
  }

  @Test
  public void alreadyInFormatIsSkippedTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.jpeg");
    long size = source.length();
    long modified = source.lastModified();

    ConversionResult result = new ImageConverter(options(false)).convert(new Job(source, "jpg"));

    assertFalse(result.isFailed());
    assertTrue(result.isSkipped());
    assertNull(result.getNewFile());
    assertEquals(0, result.getNewSize());
    assertTrue(source.isFile());
    assertEquals(size, source.length());
    assertEquals(modified, source.lastModified());
    assertEquals(1, tempDir.list().length);
  }

  @Test
  public void dryRunWritesNothingTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png", 40, 20);
    ConvertOptions options = new ConvertOptions(50, 10, false, true, true);

    ConversionResult result = new ImageConverter(options).convert(new Job(source, "jpg"));

    assertFalse(result.isFailed());
    assertTrue(result.isSkipped());
    assertEquals(new File(tempDir, "photo.jpg").getAbsoluteFile(), result.getNewFile().getAbsoluteFile());
    assertEquals(0, result.getNewSize());
    assertTrue(source.isFile());
    assertEquals(1, tempDir.list().length);
  }

  @Test
  public void resizeKeepsAspectRatioTest() throws IOException {
    File wide = TestImages.write(tempDir, "wide.png", 40, 20);
    File tall = TestImages.write(tempDir, "tall.png", 20, 40);
    File small = TestImages.write(tempDir, "small.png", 8, 6);
    ImageConverter converter = new ImageConverter(new ConvertOptions(90, 10, false, false, false));

    assertFalse(converter.convert(new Job(wide, "bmp")).isFailed());
    assertFalse(converter.convert(new Job(tall, "bmp")).isFailed());
    assertFalse(converter.convert(new Job(small, "bmp")).isFailed());

    BufferedImage wideResult = TestImages.read(new File(tempDir, "wide.bmp"));
    assertEquals(10, wideResult.getWidth());
    assertEquals(5, wideResult.getHeight());
    BufferedImage tallResult = TestImages.read(new File(tempDir, "tall.bmp"));
    assertEquals(5, tallResult.getWidth());
    assertEquals(10, tallResult.getHeight());
    BufferedImage smallResult = TestImages.read(new File(tempDir, "small.bmp"));
    assertEquals(8, smallResult.getWidth());
    assertEquals(6, smallResult.getHeight());
  }

  @Test
  public void scaledDimensionTest() {
    assertEquals(new Dimension(100, 67), ImageConverter.scaledDimension(new Dimension(300, 200), 100));
    assertEquals(new Dimension(50, 100), ImageConverter.scaledDimension(new Dimension(200, 400), 100));
    assertEquals(new Dimension(100, 100), ImageConverter.scaledDimension(new Dimension(500, 500), 100));
    assertEquals(new Dimension(100, 1), ImageConverter.scaledDimension(new Dimension(5000, 2), 100));
  }

  @Test
  public void backupCopiesOriginalTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    byte[] originalBytes = Files.readAllBytes(source.toPath());
    ConvertOptions options = new ConvertOptions(80, 0, false, false, true);

    ConversionResult result = new ImageConverter(options).convert(new Job(source, "jpg"));

    assertFalse(result.isFailed(), result.getFailureMessage());
    File backup = new File(new File(tempDir, "backup"), "photo.png.bak");
    assertEquals(backup.getAbsoluteFile(), ImageConverter.backupFileFor(source).getAbsoluteFile());
    assertTrue(backup.isFile());
    assertArrayEquals(originalBytes, Files.readAllBytes(backup.toPath()));
    assertFalse(source.exists());
  }

  @Test
  public void originalNotRemovedKeepsNewFileTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    ImageConverter converter = new ImageConverter(options(false)) {
      @Override
      protected void writeConvertedImage(File sourceFile, File newFile, 
                                         String format) throws ConversionException {
        super.writeConvertedImage(sourceFile, newFile, format);
        // something else removed the original, so the converter can not
        assertTrue(sourceFile.delete());
      }
    };

    ConversionResult result = converter.convert(new Job(source, "bmp"));

    assertTrue(result.isFailed());
    assertTrue(result.getFailureMessage().startsWith("failed to remove original"), 
               result.getFailureMessage());
    assertNotNull(result.getNewFile());
    assertTrue(result.getNewFile().isFile());
    assertTrue(result.getNewSize() > 0);
    assertEquals(result.getNewFile().length(), result.getNewSize());
  }

  @Test
  public void missingSourceFailsTest() {
    File source = new File(tempDir, "missing.png");

    ConversionResult result = new ImageConverter(options(false)).convert(new Job(source, "jpg"));

    assertTrue(result.isFailed());
    assertFalse(result.isSkipped());
    assertTrue(result.getFailureMessage().startsWith("failed to stat file"), result.getFailureMessage());
  }

  @Test
  public void undecodableSourceFailsTest() throws IOException {
    File source = new File(tempDir, "broken.png");
    Files.write(source.toPath(), new byte[] { 'n', 'o', 't', ' ', 'a', 'n', ' ', 'i', 'm', 'g' });

    ConversionResult result = new ImageConverter(options(false)).convert(new Job(source, "jpg"));

    assertTrue(result.isFailed());
    assertTrue(result.getFailureMessage().startsWith("failed to decode image"), result.getFailureMessage());
    assertTrue(source.isFile());
    assertFalse(new File(tempDir, "broken.jpg").exists());
    assertEquals(1, tempDir.list().length);
  }

  @Test
  public void cachedConversionIsReusedTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    CountingCodec codec = new CountingCodec();
    ImageConverter converter = new ImageConverter(options(true), codec, new ConversionCache());

    ConversionResult first = converter.convert(new Job(source, "jpg"));
    ConversionResult second = converter.convert(new Job(source, "jpg"));

    assertEquals(1, codec.encodeCount.get());
    assertEquals(1, converter.getCache().size());
    assertEquals(first.getNewSize(), second.getNewSize());
    assertEquals(first.getNewFile(), second.getNewFile());
  }

  @Test
  public void cacheInvalidatedWhenOutputRemovedTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    CountingCodec codec = new CountingCodec();
    ImageConverter converter = new ImageConverter(options(true), codec, new ConversionCache());

    ConversionResult first = converter.convert(new Job(source, "jpg"));
    assertTrue(first.getNewFile().delete());
    ConversionResult second = converter.convert(new Job(source, "jpg"));

    assertFalse(second.isFailed(), second.getFailureMessage());
    assertEquals(2, codec.encodeCount.get());
    assertTrue(second.getNewFile().isFile());
  }

  @Test
  public void cacheInvalidatedWhenSourceChangesTest() throws IOException {
    File source = TestImages.write(tempDir, "photo.png");
    CountingCodec codec = new CountingCodec();
    ImageConverter converter = new ImageConverter(options(true), codec, new ConversionCache());

    converter.convert(new Job(source, "jpg"));
    assertTrue(source.setLastModified(source.lastModified() + 60 * 1000));
    converter.convert(new Job(source, "jpg"));

    assertEquals(2, codec.encodeCount.get());
  }

  private static class CountingCodec extends ImageIoCodec {
    private final AtomicInteger encodeCount = new AtomicInteger();

    @Override
    public void encode(BufferedImage image, String format, 
                       int quality, File destFile) throws IOException {
      encodeCount.incrementAndGet();
      super.encode(image, format, quality, destFile);
    }
  }
}
