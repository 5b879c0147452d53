package com.jentfoo.imagebatch;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

public class FileUtils {
  private static final int BUFFER_SIZE = 32 * 1024;
  private static final String TEMP_FILE_PREFIX = ".tmp_";

  public static File makeNewFile(File destFolder, File sourceFile,
                                 String desiredExtension) {
    String newName = replaceExt(sourceFile.getName(), desiredExtension);

    return new File(destFolder, newName);
  }

  public static String replaceExt(String name, String desiredExtension) {
    if (! desiredExtension.startsWith(".")) {
      desiredExtension = "." + desiredExtension;
    }

    int nameStart = name.lastIndexOf(File.separatorChar) + 1;
    int index = name.lastIndexOf('.');
    if (index > nameStart) {
      return name.substring(0, index) + desiredExtension;
    } else {
      return name + desiredExtension;
    }
  }

  /**
   * Returns the lower case extension of the name, without the leading dot.  An empty string is
   * returned for names without an extension (including dot files like {@code .hidden}).
   */
  public static String getExtension(String name) {
    int index = name.lastIndexOf('.');
    if (index > 0 && index < name.length() - 1) {
      return name.substring(index + 1).toLowerCase(Locale.ROOT);
    } else {
      return "";
    }
  }

  public static String normalizeFormat(String format) {
    String result = format.trim().toLowerCase(Locale.ROOT);
    if (result.startsWith(".")) {
      result = result.substring(1);
    }
    return result;
  }

  // jpg and jpeg name the same format
  public static boolean isSameFormat(String extension, String format) {
    String a = normalizeFormat(extension);
    String b = normalizeFormat(format);
    if (a.equals(b)) {
      return true;
    }

    return (a.equals("jpg") && b.equals("jpeg")) ||
             (a.equals("jpeg") && b.equals("jpg"));
  }

  public static void ensureParentExists(File file) throws IOException {
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && ! parent.isDirectory()) {
      if (! parent.mkdirs() && ! parent.isDirectory()) {
        throw new IOException("Could not make directory: " + parent.getAbsolutePath());
      }
    }
  }

  public static File makeTempFile(File destFile) throws IOException {
    ensureParentExists(destFile);

    return File.createTempFile(TEMP_FILE_PREFIX + destFile.getName(), null,
                               destFile.getAbsoluteFile().getParentFile());
  }

  /**
   * Moves the temp file over the destination.  An atomic rename is used when the file system
   * supports it.
   */
  public static void moveIntoPlace(File tempFile, File destFile) throws IOException {
    try {
      Files.move(tempFile.toPath(), destFile.toPath(),
                 StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tempFile.toPath(), destFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
  }

  /**
   * Copies the source into a temp file beside the destination, syncs it, then renames it into
   * place.  The destination is either absent or complete, never partially written.
   */
  public static void atomicCopyFile(File sourceFile,
                                    File destFile) throws IOException {
    File tempFile = makeTempFile(destFile);
    boolean moved = false;
    try {
      copyFile(sourceFile, tempFile);
      moveIntoPlace(tempFile, destFile);
      moved = true;
    } finally {
      if (! moved && tempFile.exists() && ! tempFile.delete()) {
        tempFile.deleteOnExit();
      }
    }
  }

  public static void copyFile(File sourceFile,
                              File destFile) throws IOException {
    InputStream in = null;
    FileOutputStream out = null;
    try {
      in = new FileInputStream(sourceFile);
      out = new FileOutputStream(destFile);

      byte[] buf = new byte[BUFFER_SIZE];
      int len;
      while ((len = in.read(buf)) > 0){
        out.write(buf, 0, len);
      }
      out.flush();
      out.getFD().sync();
    } finally {
      try {
        if (in != null) {
          in.close();
        }
      } finally {
        if (out != null) {
          out.close();
        }
      }
    }
  }
}
