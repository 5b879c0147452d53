package com.jentfoo.imagebatch;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import net.coobird.thumbnailator.Thumbnails;

/**
 * {@link ImageCodec} backed by the ImageIO plugin registry.  PNG, JPEG and BMP come with the JDK, 
 * WebP is provided by the webp-imageio plugin when it is on the class path.
 */
public class ImageIoCodec implements ImageCodec {
  @Override
  public Dimension readDimensions(File sourceFile) throws IOException {
    ImageInputStream iis = ImageIO.createImageInputStream(sourceFile);
    if (iis == null) {
      throw new IOException("Can not open file: " + sourceFile.getAbsolutePath());
    }
    try {
      Iterator<ImageReader> it = ImageIO.getImageReaders(iis);
      if (! it.hasNext()) {
        throw new IOException("Unknown image format: " + sourceFile.getName());
      }
      ImageReader reader = it.next();
      try {
        reader.setInput(iis, true, true);
        return new Dimension(reader.getWidth(0), reader.getHeight(0));
      } finally {
        reader.dispose();
      }
    } finally {
      iis.close();
    }
  }

  @Override
  public BufferedImage decode(File sourceFile) throws IOException {
    BufferedImage image = ImageIO.read(sourceFile);
    if (image == null) {
      throw new IOException("No image reader for: " + sourceFile.getName());
    }
    return image;
  }

  @Override
  public BufferedImage resize(BufferedImage image, int width, int height) throws IOException {
    return Thumbnails.of(image)
                     .forceSize(width, height)
                     .asBufferedImage();
  }

  @Override
  public boolean canEncode(String format) {
    return ImageIO.getImageWritersByFormatName(writerFormatName(format)).hasNext();
  }

  @Override
  public void encode(BufferedImage image, String format, 
                     int quality, File destFile) throws IOException {
    String formatName = writerFormatName(format);
    Iterator<ImageWriter> it = ImageIO.getImageWritersByFormatName(formatName);
    if (! it.hasNext()) {
      throw new IOException("Unsupported format: " + format);
    }
    if (formatName.equals("jpeg") || formatName.equals("bmp")) {
      image = flattenAlpha(image);
    }

    ImageWriter writer = it.next();
    ImageOutputStream ios = null;
    try {
      ImageWriteParam param = writer.getDefaultWriteParam();
      if (isLossy(formatName) && param.canWriteCompressed()) {
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        String[] types = param.getCompressionTypes();
        if (types != null && types.length > 0 && param.getCompressionType() == null) {
          // webp lists "Lossy" first
          param.setCompressionType(types[0]);
        }
        param.setCompressionQuality(quality / 100f);
      }

      ios = ImageIO.createImageOutputStream(destFile);
      if (ios == null) {
        throw new IOException("Can not write file: " + destFile.getAbsolutePath());
      }
      writer.setOutput(ios);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      try {
        if (ios != null) {
          ios.close();
        }
      } finally {
        writer.dispose();
      }
    }
  }

  private static boolean isLossy(String formatName) {
    return formatName.equals("jpeg") || formatName.equals("webp");
  }

  private static String writerFormatName(String format) {
    String result = FileUtils.normalizeFormat(format);
    if (result.equals("jpg")) {
      return "jpeg";
    }
    return result;
  }

  private static BufferedImage flattenAlpha(BufferedImage image) {
    if (! image.getColorModel().hasAlpha()) {
      return image;
    }

    BufferedImage result = new BufferedImage(image.getWidth(), image.getHeight(), 
                                             BufferedImage.TYPE_INT_RGB);
    Graphics2D g = result.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, image.getWidth(), image.getHeight());
      g.drawImage(image, 0, 0, null);
    } finally {
      g.dispose();
    }
    return result;
  }
}
