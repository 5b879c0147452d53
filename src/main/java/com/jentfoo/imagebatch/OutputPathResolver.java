package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Decides where the converted copy of a file is written.  In priority order: mirrored under a 
 * custom output folder, in place beside the source when preserving structure, or flattened into 
 * the input root.
 */
public class OutputPathResolver {
  private final BatchSettings settings;

  public OutputPathResolver(BatchSettings settings) {
    this.settings = settings;
  }

  public File resolve(File inputRoot, File sourceFile, String targetFormat) {
    File root = inputRoot.getAbsoluteFile();
    String newRelativePath = FileUtils.replaceExt(relativePath(root, sourceFile.getAbsoluteFile()), 
                                                  FileUtils.normalizeFormat(targetFormat));

    if (settings.hasOutputDir()) {
      return new File(new File(settings.getOutputDir()).getAbsoluteFile(), newRelativePath);
    } else if (settings.isPreserveStructure()) {
      return new File(root, newRelativePath);
    } else {
      return new File(root, new File(newRelativePath).getName());
    }
  }

  /**
   * Resolves the destination and makes sure its parent folder exists.
   */
  public File resolveAndPrepare(File inputRoot, File sourceFile, 
                                String targetFormat) throws IOException {
    File result = resolve(inputRoot, sourceFile, targetFormat);
    FileUtils.ensureParentExists(result);

    return result;
  }

  /**
   * Recreates the given input folders (relative to the input root) under the output folder.  Does 
   * nothing unless a custom output folder is configured.
   */
  public void mirrorDirectories(List<String> relativeDirectories) throws IOException {
    if (! settings.hasOutputDir()) {
      return;
    }

    File outputRoot = new File(settings.getOutputDir()).getAbsoluteFile();
    for (String relativeDir : relativeDirectories) {
      File dir = new File(outputRoot, relativeDir);
      if (! dir.isDirectory() && ! dir.mkdirs() && ! dir.isDirectory()) {
        throw new IOException("Could not make folder: " + dir.getPath());
      }
    }
  }

  private static String relativePath(File root, File sourceFile) {
    Path rootPath = root.toPath().normalize();
    Path sourcePath = sourceFile.toPath().normalize();
    if (sourcePath.startsWith(rootPath) && ! sourcePath.equals(rootPath)) {
      return rootPath.relativize(sourcePath).toString();
    } else {
      return sourceFile.getName();
    }
  }
}
