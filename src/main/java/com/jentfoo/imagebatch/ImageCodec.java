package com.jentfoo.imagebatch;

import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

public interface ImageCodec {
  /**
   * Reads the image dimensions from the file header without decoding the pixel data.
   */
  public Dimension readDimensions(File sourceFile) throws IOException;

  public BufferedImage decode(File sourceFile) throws IOException;

  public BufferedImage resize(BufferedImage image, int width, int height) throws IOException;

  /**
   * Encodes the image into the given format.  Quality (1-100) applies to lossy formats only.
   */
  public void encode(BufferedImage image, String format, 
                     int quality, File destFile) throws IOException;

  public boolean canEncode(String format);
}
