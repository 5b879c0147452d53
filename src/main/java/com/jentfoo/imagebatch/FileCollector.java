package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the images to convert under an input root.  Only a failure to open the root itself is 
 * reported as an error, any other file or folder which can not be read is skipped with a 
 * warning.
 */
public class FileCollector {
  private static final Logger log = LoggerFactory.getLogger(FileCollector.class);

  private final BatchSettings settings;
  private final Set<String> extensions;

  public FileCollector(BatchSettings settings, Collection<String> extensions) {
    this.settings = settings;
    this.extensions = new HashSet<String>();
    for (String ext : extensions) {
      this.extensions.add(FileUtils.normalizeFormat(ext));
    }
  }

  public List<FileRecord> collect(File inputRoot) throws IOException {
    File root = inputRoot.getAbsoluteFile();
    if (! root.isDirectory()) {
      throw new IOException("Input folder is not a folder: " + root.getPath());
    }

    if (settings.isRecursiveSearch()) {
      return collectRecursively(root);
    } else {
      return collectNonRecursive(root);
    }
  }

  protected List<FileRecord> collectNonRecursive(File root) throws IOException {
    File[] children = root.listFiles();
    if (children == null) {
      throw new IOException("Could not read folder: " + root.getPath());
    }

    List<FileRecord> result = new ArrayList<FileRecord>(children.length);
    for (int i = 0; i < children.length; i++) {
      File child = children[i];
      if (! settings.isFollowSymlinks() && Files.isSymbolicLink(child.toPath())) {
        continue;
      } else if (! child.isFile()) {
        continue;
      } else if (! InputValidator.isSafePath(child.getPath())) {
        log.warn("Skipping invalid path: {}", child.getPath());
        continue;
      }

      String ext = FileUtils.getExtension(child.getName());
      if (extensions.contains(ext)) {
        result.add(new FileRecord(child, child.getName(), root, ext, child.length()));
      }
    }

    return result;
  }

  protected List<FileRecord> collectRecursively(File root) throws IOException {
    final List<FileRecord> result = new ArrayList<FileRecord>();
    final Path start = walkStart(root);
    final Path excluded = excludedOutputFolder(start);

    Files.walkFileTree(start, walkOptions(), Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (dir.equals(start)) {
          return FileVisitResult.CONTINUE;
        } else if (excluded != null && dir.toAbsolutePath().normalize().startsWith(excluded)) {
          return FileVisitResult.SKIP_SUBTREE;
        } else if (! InputValidator.isSafePath(dir.toString())) {
          log.warn("Skipping invalid path: {}", dir);
          return FileVisitResult.SKIP_SUBTREE;
        } else if (settings.getMaxDepth() > 0 && 
                   depth(start.relativize(dir).toString()) + 1 > settings.getMaxDepth()) {
          // nothing below this folder can be within the limit
          return FileVisitResult.SKIP_SUBTREE;
        }

        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isSymbolicLink() || ! attrs.isRegularFile()) {
          return FileVisitResult.CONTINUE;
        } else if (! InputValidator.isSafePath(file.toString())) {
          log.warn("Skipping invalid path: {}", file);
          return FileVisitResult.CONTINUE;
        }

        String ext = FileUtils.getExtension(file.getFileName().toString());
        if (! extensions.contains(ext)) {
          return FileVisitResult.CONTINUE;
        }

        String relativePath = start.relativize(file).toString();
        if (settings.getMaxDepth() > 0 && depth(relativePath) > settings.getMaxDepth()) {
          return FileVisitResult.CONTINUE;
        }

        File f = file.toFile();
        result.add(new FileRecord(f, relativePath, f.getParentFile(), ext, attrs.size()));

        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
        if (file.equals(start)) {
          throw exc;
        }

        log.warn("Error accessing path {}: {}", file, exc.toString());
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
        if (exc != null) {
          log.warn("Error reading folder {}: {}", dir, exc.toString());
        }
        return FileVisitResult.CONTINUE;
      }
    });

    return result;
  }

  /**
   * Lists the folders under the root (relative to it) that a recursive collection would walk, 
   * whether or not they contain any images.
   */
  public List<String> collectDirectories(File inputRoot) throws IOException {
    if (! settings.isRecursiveSearch()) {
      return Collections.emptyList();
    }

    final List<String> result = new ArrayList<String>();
    final Path start = walkStart(inputRoot.getAbsoluteFile());
    final Path excluded = excludedOutputFolder(start);
    Files.walkFileTree(start, walkOptions(), Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (dir.equals(start)) {
          return FileVisitResult.CONTINUE;
        } else if (excluded != null && dir.toAbsolutePath().normalize().startsWith(excluded)) {
          return FileVisitResult.SKIP_SUBTREE;
        }

        String relativePath = start.relativize(dir).toString();
        if (! InputValidator.isSafePath(relativePath) || 
            (settings.getMaxDepth() > 0 && depth(relativePath) >= settings.getMaxDepth())) {
          return FileVisitResult.SKIP_SUBTREE;
        }

        result.add(relativePath);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        log.warn("Error accessing path {}: {}", file, exc.toString());
        return FileVisitResult.CONTINUE;
      }
    });

    return result;
  }

  public static Map<File, List<FileRecord>> groupByDirectory(List<FileRecord> files) {
    Map<File, List<FileRecord>> result = new LinkedHashMap<File, List<FileRecord>>();
    for (FileRecord record : files) {
      List<FileRecord> group = result.get(record.getDirectory());
      if (group == null) {
        group = new ArrayList<FileRecord>();
        result.put(record.getDirectory(), group);
      }
      group.add(record);
    }

    return result;
  }

  public static Map<File, Integer> countByDirectory(List<FileRecord> files) {
    Map<File, Integer> result = new LinkedHashMap<File, Integer>();
    for (Map.Entry<File, List<FileRecord>> e : groupByDirectory(files).entrySet()) {
      result.put(e.getKey(), e.getValue().size());
    }

    return result;
  }

  public static int depth(String relativePath) {
    int count = 0;
    for (int i = 0; i < relativePath.length(); i++) {
      if (relativePath.charAt(i) == File.separatorChar) {
        count++;
      }
    }
    return count;
  }

  private Set<FileVisitOption> walkOptions() {
    if (settings.isFollowSymlinks()) {
      return EnumSet.of(FileVisitOption.FOLLOW_LINKS);
    } else {
      return EnumSet.noneOf(FileVisitOption.class);
    }
  }

  private static Path walkStart(File root) throws IOException {
    Path result = root.toPath();
    if (Files.isSymbolicLink(result)) {
      // the root is walked even when links are not followed
      result = result.toRealPath();
    }
    return result;
  }

  // an output folder nested in the input tree must not have its outputs collected again
  private Path excludedOutputFolder(Path start) {
    if (! settings.hasOutputDir()) {
      return null;
    }

    Path outputFolder = new File(settings.getOutputDir()).toPath().toAbsolutePath().normalize();
    Path normalizedStart = start.toAbsolutePath().normalize();
    if (outputFolder.startsWith(normalizedStart) && ! outputFolder.equals(normalizedStart)) {
      return outputFolder;
    } else {
      return null;
    }
  }
}
