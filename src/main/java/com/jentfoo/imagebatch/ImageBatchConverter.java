package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ImageBatchConverter {
  private static final Logger log = LoggerFactory.getLogger(ImageBatchConverter.class);
  private static final long SHUTDOWN_WAIT_IN_MILLIS = 5 * 1000;

  public static void main(String args[]) {
    try {
      System.exit(parseArgsAndRun(args));
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsage(System.err);
      
      System.exit(1);
    } catch (ValidationException e) {
      System.err.println("Invalid input: " + e.getMessage());
      printUsage(System.err);
      
      System.exit(1);
    } catch (IOException e) {
      System.err.println("Error: " + e.getMessage());
      
      System.exit(1);
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: ");
    out.println("java -jar ImageBatchConverter.jar -p <folder> [-t <format>] [options]");
    out.println("  -p, --path <folder>     folder of images to convert (required unless --resume)");
    out.println("  -t, --to <format>       target format: " + InputValidator.SUPPORTED_FORMATS);
    out.println("  -o, --output <folder>   write converted images under this folder");
    out.println("  -q, --quality <1-100>   output quality for lossy formats");
    out.println("      --max-size <px>     scale images down so neither side exceeds this size");
    out.println("  -w, --workers <n>       number of parallel conversions");
    out.println("      --rate-limit <n>    maximum conversions started per second");
    out.println("      --keep              keep the original files");
    out.println("      --backup            copy originals into a backup folder first");
    out.println("      --dry-run           show what would be converted without writing anything");
    out.println("      --resume            continue the last interrupted session");
    out.println("      --no-recursive      only convert images directly in the folder");
    out.println("      --max-depth <n>     limit how deep sub folders are searched");
    out.println("      --flatten           do not recreate the folder structure in the output");
    out.println("      --follow-symlinks   follow symbolic links while searching");
    out.println("      --log-file          also log to " + 
                  new File(StateDirectories.getLogFolder(), LoggingConfigurator.LOG_FILE_NAME).getPath());
    out.println("  -v, --verbose           debug logging");
    out.println("  -h, --help              show this help");
  }

  private static int parseArgsAndRun(String args[]) throws ValidationException, IOException {
    Arguments arguments = Arguments.parse(args);
    if (arguments.help) {
      printUsage(System.out);
      
      return 0;
    }

    ConverterConfig config = new ConfigStore(StateDirectories.getConfigFolder()).load();
    LoggingConfigurator.configure(arguments.verbose ? "debug" : config.getLogLevel(), 
                                  arguments.logFile);

    CheckpointStore checkpointStore = null;
    if (config.isResumeEnabled() || arguments.resume) {
      checkpointStore = new JsonCheckpointStore(StateDirectories.getStateFolder());
    }

    String inputDir = arguments.path;
    String targetFormat = arguments.targetFormat == null ? config.getDefaultFormat() : arguments.targetFormat;
    SessionState resumeFrom = null;
    if (arguments.resume) {
      resumeFrom = checkpointStore.load();
      if (resumeFrom == null) {
        System.out.println("No previous session found to resume");
        
        return 0;
      }
      
      System.out.println("Resuming session started at " + resumeFrom.getStartTime());
      System.out.println("  Input: " + resumeFrom.getInputDir());
      System.out.println("  Format: " + resumeFrom.getTargetFormat());
      System.out.println("  Progress: " + resumeFrom.getProcessedCount() + "/" + resumeFrom.getTotalFiles());
      inputDir = resumeFrom.getInputDir();
      targetFormat = resumeFrom.getTargetFormat();
    } else if (inputDir == null) {
      throw new IllegalArgumentException("Must supply the folder to convert with -p");
    }

    BatchSettings batchSettings = config.getBatch();
    if (arguments.outputDir != null) {
      batchSettings.setOutputDir(arguments.outputDir);
    }
    if (arguments.noRecursive) {
      batchSettings.setRecursiveSearch(false);
    }
    if (arguments.maxDepth != null) {
      batchSettings.setMaxDepth(arguments.maxDepth);
    }
    if (arguments.flatten) {
      batchSettings.setPreserveStructure(false);
    }
    if (arguments.followSymlinks) {
      batchSettings.setFollowSymlinks(true);
    }

    int quality = arguments.quality == null ? config.qualityFor(targetFormat) : arguments.quality;
    int workers = arguments.workers == null ? config.getWorkers() : arguments.workers;
    int maxDimension = arguments.maxDimension == null ? config.getMaxDimension() : arguments.maxDimension;
    double rateLimit = arguments.rateLimit == null ? config.getRateLimit() : arguments.rateLimit;
    boolean keepOriginal = arguments.keepOriginal || config.isKeepOriginal();
    boolean dryRun = arguments.dryRun || config.isDryRun();
    boolean backup = arguments.backup || config.isAutoBackup();

    InputValidator.validateInputs(inputDir, targetFormat);
    InputValidator.validateTargetFormat(targetFormat, config.getExtensions());
    InputValidator.validateOptions(quality, workers, maxDimension, rateLimit);
    ImageIoCodec codec = new ImageIoCodec();
    if (! codec.canEncode(targetFormat)) {
      throw new ValidationException("targetFormat", "no image writer available for " + targetFormat);
    }

    if (dryRun) {
      System.out.println("DRY RUN: no files will be written or removed");
    }

    ConvertOptions options = new ConvertOptions(quality, maxDimension, keepOriginal, dryRun, backup);
    ImageConverter converter = new ImageConverter(options, codec, new ConversionCache());
    final BatchSession session = new BatchSession(batchSettings, config.getExtensions(), converter, 
                                                  checkpointStore, workers, rateLimit, 
                                                  dryRun, System.out);

    Thread shutdownHook = new Thread(new Runnable() {
      @Override
      public void run() {
        session.cancel();
        try {
          if (! session.awaitFinished(SHUTDOWN_WAIT_IN_MILLIS, TimeUnit.MILLISECONDS)) {
            System.err.println("Conversions still running at exit, last session state is kept");
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    shutdownHook.setName("Conversion shutdown hook");
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    ConversionStatistics statistics;
    try {
      statistics = session.run(new File(inputDir), targetFormat, resumeFrom);
    } finally {
      try {
        Runtime.getRuntime().removeShutdownHook(shutdownHook);
      } catch (IllegalStateException e) {
        log.debug("JVM already shutting down, hook left in place");
      }
    }

    new StatisticsReport(System.out).print(statistics);
    
    return 0;
  }

  private static class Arguments {
    private String path = null;
    private String targetFormat = null;
    private String outputDir = null;
    private Integer quality = null;
    private Integer maxDimension = null;
    private Integer workers = null;
    private Double rateLimit = null;
    private Integer maxDepth = null;
    private boolean keepOriginal = false;
    private boolean dryRun = false;
    private boolean backup = false;
    private boolean resume = false;
    private boolean logFile = false;
    private boolean verbose = false;
    private boolean noRecursive = false;
    private boolean flatten = false;
    private boolean followSymlinks = false;
    private boolean help = false;

    private static Arguments parse(String args[]) {
      Arguments result = new Arguments();
      for (int i = 0; i < args.length; i++) {
        String arg = args[i];
        if (arg.equals("-p") || arg.equals("--path")) {
          result.path = value(args, ++i, arg);
        } else if (arg.equals("-t") || arg.equals("--to")) {
          result.targetFormat = value(args, ++i, arg);
        } else if (arg.equals("-o") || arg.equals("--output")) {
          result.outputDir = value(args, ++i, arg);
        } else if (arg.equals("-q") || arg.equals("--quality")) {
          result.quality = Integer.parseInt(value(args, ++i, arg));
        } else if (arg.equals("--max-size")) {
          result.maxDimension = Integer.parseInt(value(args, ++i, arg));
        } else if (arg.equals("-w") || arg.equals("--workers")) {
          result.workers = Integer.parseInt(value(args, ++i, arg));
        } else if (arg.equals("--rate-limit")) {
          result.rateLimit = Double.parseDouble(value(args, ++i, arg));
        } else if (arg.equals("--max-depth")) {
          result.maxDepth = Integer.parseInt(value(args, ++i, arg));
        } else if (arg.equals("--keep")) {
          result.keepOriginal = true;
        } else if (arg.equals("--dry-run")) {
          result.dryRun = true;
        } else if (arg.equals("--backup")) {
          result.backup = true;
        } else if (arg.equals("--resume")) {
          result.resume = true;
        } else if (arg.equals("--log-file")) {
          result.logFile = true;
        } else if (arg.equals("-v") || arg.equals("--verbose")) {
          result.verbose = true;
        } else if (arg.equals("--no-recursive")) {
          result.noRecursive = true;
        } else if (arg.equals("--flatten")) {
          result.flatten = true;
        } else if (arg.equals("--follow-symlinks")) {
          result.followSymlinks = true;
        } else if (arg.equals("-h") || arg.equals("--help")) {
          result.help = true;
        } else {
          throw new IllegalArgumentException("Unknown argument: " + arg);
        }
      }
      
      return result;
    }

    private static String value(String args[], int index, String flag) {
      if (index >= args.length) {
        throw new IllegalArgumentException("Missing value for " + flag);
      }
      return args[index];
    }
  }
}
