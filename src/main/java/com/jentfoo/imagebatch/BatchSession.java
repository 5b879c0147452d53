package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.threadly.concurrent.PriorityScheduler;
import org.threadly.concurrent.TaskPriority;
import org.threadly.util.Clock;
import org.threadly.util.ExceptionUtils;

/**
 * Runs one conversion session: collects the input files, feeds them to a {@link WorkerPool} from 
 * a single dispatcher, and consumes the results on the calling thread.  Each result is counted 
 * in the statistics and appended to the checkpoint, which is saved after every file and cleared 
 * once the run completes.
 */
public class BatchSession {
  private static final Logger log = LoggerFactory.getLogger(BatchSession.class);
  private static final long DEFAULT_IDLE_TIMEOUT_IN_MILLIS = 30 * 1000;
  private static final long RESULT_POLL_INTERVAL_IN_MILLIS = 250;
  private static final long PROGRESS_LOG_INTERVAL_IN_MILLIS = 10 * 1000;
  // dispatcher and progress logger
  private static final int EXTRA_THREAD_COUNT = 2;

  private final BatchSettings batchSettings;
  private final FileCollector collector;
  private final OutputPathResolver pathResolver;
  private final ConverterInterface converter;
  private final CheckpointStore checkpointStore;
  private final int workerCount;
  private final double rateLimit;
  private final boolean dryRun;
  private final PrintStream out;
  private final CountDownLatch finishedLatch;
  private volatile long idleTimeoutMillis;
  private volatile WorkerPool activePool;
  private volatile boolean cancelRequested;

  /**
   * @param checkpointStore store for resume state, or {@code null} if runs should not be resumable
   * @param dryRun {@code true} to leave the output location untouched
   */
  public BatchSession(BatchSettings batchSettings, Collection<String> extensions, 
                      ConverterInterface converter, CheckpointStore checkpointStore, 
                      int workerCount, double rateLimit, 
                      boolean dryRun, PrintStream out) {
    this.batchSettings = batchSettings;
    this.collector = new FileCollector(batchSettings, extensions);
    this.pathResolver = new OutputPathResolver(batchSettings);
    this.converter = converter;
    this.checkpointStore = checkpointStore;
    this.workerCount = workerCount;
    this.rateLimit = rateLimit;
    this.dryRun = dryRun;
    this.out = out;
    this.finishedLatch = new CountDownLatch(1);
    this.idleTimeoutMillis = DEFAULT_IDLE_TIMEOUT_IN_MILLIS;
    this.activePool = null;
    this.cancelRequested = false;
  }

  public void setIdleTimeoutMillis(long idleTimeoutMillis) {
    this.idleTimeoutMillis = idleTimeoutMillis;
  }

  /**
   * Cancels the running session.  Workers stop starting conversions and the checkpoint is left 
   * in place so the session can be resumed.
   */
  public void cancel() {
    cancelRequested = true;
    WorkerPool pool = activePool;
    if (pool != null) {
      pool.cancel();
    }
  }

  public boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
    return finishedLatch.await(timeout, unit);
  }

  public ConversionStatistics run(File inputRoot, String targetFormat) throws IOException {
    return run(inputRoot, targetFormat, null);
  }

  /**
   * @param resumeFrom session to continue, files it already processed are skipped; 
   *                     {@code null} to start a new session
   */
  public ConversionStatistics run(File inputRoot, String targetFormat, 
                                  SessionState resumeFrom) throws IOException {
    try {
      return doRun(inputRoot.getAbsoluteFile(), FileUtils.normalizeFormat(targetFormat), resumeFrom);
    } finally {
      finishedLatch.countDown();
    }
  }

  private ConversionStatistics doRun(File inputRoot, String targetFormat, 
                                     SessionState resumeFrom) throws IOException {
    ConversionStatistics statistics = new ConversionStatistics();
    List<FileRecord> files = collector.collect(inputRoot);

    SessionState state;
    if (resumeFrom == null) {
      state = new SessionState(inputRoot.getAbsolutePath(), targetFormat, files.size());
    } else {
      state = resumeFrom;
      files = withoutProcessed(files, state.getProcessedFileSet());
      log.info("Resuming session {}, {} files left", state.getSessionId(), files.size());
    }

    if (files.isEmpty()) {
      out.println("No supported image files to convert in: " + inputRoot.getPath());
      if (resumeFrom != null) {
        clearState();
      }
      return statistics;
    }
    out.println("Found " + files.size() + " image files to process");
    if (log.isDebugEnabled()) {
      for (Map.Entry<File, Integer> e : FileCollector.countByDirectory(files).entrySet()) {
        log.debug("{} files in {}", e.getValue(), e.getKey());
      }
    }

    prepareOutputLocation(inputRoot, files);
    saveState(state);

    PriorityScheduler scheduler = new PriorityScheduler(workerCount + EXTRA_THREAD_COUNT);
    boolean completed = false;
    try {
      WorkerPool pool = new WorkerPool(scheduler, converter, workerCount, rateLimit);
      ProgressReporter progress = new ProgressReporter(Math.max(state.getTotalFiles(), 
                                                                state.getProcessedCount() + files.size()), 
                                                       state.getProcessedCount(), out);
      activePool = pool;
      if (cancelRequested) {
        pool.cancel();
      }

      pool.start();
      scheduler.execute(new Dispatcher(pool, inputRoot, targetFormat, files));
      scheduler.scheduleWithFixedDelay(progress, PROGRESS_LOG_INTERVAL_IN_MILLIS, 
                                       PROGRESS_LOG_INTERVAL_IN_MILLIS, TaskPriority.Low);

      consumeResults(pool, files.size(), state, statistics, progress);

      scheduler.remove(progress);
      progress.finish();
      completed = ! pool.isCancelled();
    } finally {
      activePool = null;
      scheduler.shutdownNow();
    }

    if (completed) {
      clearState();
      log.info("Conversion completed successfully");
    } else {
      log.warn("Conversion cancelled, session {} can be resumed", state.getSessionId());
    }

    return statistics;
  }

  private void consumeResults(WorkerPool pool, int expectedCount, SessionState state, 
                              ConversionStatistics statistics, ProgressReporter progress) {
    int receivedCount = 0;
    long lastResultTime = Clock.accurateForwardProgressingMillis();
    while (! pool.isFinished()) {
      ConversionResult result;
      try {
        result = pool.pollResult(RESULT_POLL_INTERVAL_IN_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        pool.shutdown();
        return;
      }

      if (result == null) {
        long idleTime = Clock.accurateForwardProgressingMillis() - lastResultTime;
        if (idleTime >= idleTimeoutMillis) {
          // large files can take a while, keep waiting
          log.warn("No result for {} seconds, waiting on {} conversions to finish", 
                   idleTime / 1000, expectedCount - receivedCount);
          lastResultTime = Clock.accurateForwardProgressingMillis();
        }
        continue;
      }

      lastResultTime = Clock.accurateForwardProgressingMillis();
      receivedCount++;
      handleResult(result, state, statistics, progress);
    }
  }

  private void handleResult(ConversionResult result, SessionState state, 
                            ConversionStatistics statistics, ProgressReporter progress) {
    statistics.addResult(result);
    progress.update(result);

    if (result.isFailed()) {
      log.error("Conversion failed: {} - {}", result.getOriginalFile(), result.getFailureMessage());
    } else if (result.isSkipped()) {
      log.debug("Skipped: {}", result.getOriginalFile());
    } else {
      log.info("Converted: {} -> {}", result.getOriginalFile(), result.getNewFile());
    }

    state.addProcessedFile(result.getOriginalFile().getAbsolutePath());
    saveState(state);
  }

  private void prepareOutputLocation(File inputRoot, List<FileRecord> files) throws IOException {
    if (dryRun) {
      return;
    }

    if (batchSettings.hasOutputDir()) {
      File outputRoot = new File(batchSettings.getOutputDir()).getAbsoluteFile();
      if (! outputRoot.isDirectory() && ! outputRoot.mkdirs()) {
        throw new IOException("Could not make output folder: " + outputRoot.getPath());
      }
      if (! batchSettings.isSkipEmptyDirectories()) {
        pathResolver.mirrorDirectories(collector.collectDirectories(inputRoot));
      }
    }

    long totalSize = 0;
    for (FileRecord record : files) {
      totalSize += record.getSize();
    }
    File outputRoot = batchSettings.hasOutputDir() ? new File(batchSettings.getOutputDir()) : inputRoot;
    if (! InputValidator.hasSufficientSpace(outputRoot, totalSize)) {
      log.warn("Less than {} free in {}, conversions may fail", 
               StatisticsReport.formatBytes(totalSize), outputRoot.getAbsolutePath());
    }
  }

  private void saveState(SessionState state) {
    if (checkpointStore == null) {
      return;
    }
    try {
      checkpointStore.save(state);
    } catch (IOException e) {
      log.warn("Failed to save session state: {}", e.toString());
    }
  }

  private void clearState() {
    if (checkpointStore == null) {
      return;
    }
    try {
      checkpointStore.clear();
    } catch (IOException e) {
      log.warn("Failed to clear session state: {}", e.toString());
    }
  }

  private static List<FileRecord> withoutProcessed(List<FileRecord> files, Set<String> processed) {
    List<FileRecord> result = new ArrayList<FileRecord>(files.size());
    for (FileRecord record : files) {
      if (! processed.contains(record.getFile().getAbsolutePath())) {
        result.add(record);
      }
    }
    return result;
  }

  private class Dispatcher implements Runnable {
    private final WorkerPool pool;
    private final File inputRoot;
    private final String targetFormat;
    private final List<FileRecord> files;

    private Dispatcher(WorkerPool pool, File inputRoot, 
                       String targetFormat, List<FileRecord> files) {
      this.pool = pool;
      this.inputRoot = inputRoot;
      this.targetFormat = targetFormat;
      this.files = files;
    }

    @Override
    public void run() {
      Set<File> assignedOutputs = new HashSet<File>();
      try {
        for (FileRecord record : files) {
          File outputFile = resolveOutput(record.getFile());
          if (! assignedOutputs.add(outputFile)) {
            log.warn("{} is also the destination of another file in this run, it will be overwritten", 
                     outputFile);
          }

          if (! pool.submit(new Job(record.getFile(), targetFormat, outputFile))) {
            log.debug("Pool stopped accepting jobs, {} not dispatched", record.getFile());
            break;
          }
        }
      } catch (RuntimeException e) {
        ExceptionUtils.handleException(e);
        pool.cancel();
      } finally {
        pool.stop();
      }
    }

    private File resolveOutput(File sourceFile) {
      if (dryRun) {
        return pathResolver.resolve(inputRoot, sourceFile, targetFormat);
      }

      try {
        return pathResolver.resolveAndPrepare(inputRoot, sourceFile, targetFormat);
      } catch (IOException e) {
        // the converter reports the failure once it tries to write there
        log.warn("Could not prepare output for {}: {}", sourceFile, e.toString());
        return pathResolver.resolve(inputRoot, sourceFile, targetFormat);
      }
    }
  }
}
