package com.jentfoo.imagebatch;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;

import javax.imageio.ImageIO;

/**
 * Writes small images with the formats the JDK can encode without plugins.
 */
public class TestImages {
  public static File write(File folder, String name, int width, int height) throws IOException {
    File file = new File(folder, name);
    FileUtils.ensureParentExists(file);

    String format = FileUtils.getExtension(name);
    BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(Color.BLUE);
      g.fillRect(0, 0, width, height);
      g.setColor(Color.ORANGE);
      g.fillOval(0, 0, width / 2 + 1, height / 2 + 1);
    } finally {
      g.dispose();
    }

    if (! ImageIO.write(image, format.equals("jpg") ? "jpeg" : format, file)) {
      throw new IOException("No writer for: " + format);
    }
    return file;
  }

  public static File write(File folder, String name) throws IOException {
    return write(folder, name, 16, 12);
  }

  public static BufferedImage read(File file) throws IOException {
    BufferedImage result = ImageIO.read(file);
    if (result == null) {
      throw new IOException("Could not read image: " + file);
    }
    return result;
  }
}
