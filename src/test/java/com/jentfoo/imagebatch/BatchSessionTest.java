package com.jentfoo.imagebatch;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

public class BatchSessionTest {
  @TempDir
  File tempDir;
  private File inputRoot;
  private BatchSettings settings;
  private RecordingCheckpointStore checkpointStore;
  private PrintStream out;

  @BeforeEach
  public void setup() throws IOException {
    inputRoot = new File(tempDir, "photos");
    settings = new BatchSettings();
    checkpointStore = new RecordingCheckpointStore();
    out = new PrintStream(new ByteArrayOutputStream(), true, "UTF-8");

    TestImages.write(inputRoot, "a.png");
    TestImages.write(new File(inputRoot, "trip"), "b.jpg");
    TestImages.write(new File(inputRoot, "trip"), "c.png");
    new File(inputRoot, "empty").mkdirs();
  }

  private BatchSession makeSession(ConvertOptions options) {
    return makeSession(new ImageConverter(options), options.isDryRun());
  }

  private BatchSession makeSession(ConverterInterface converter, boolean dryRun) {
    return new BatchSession(settings, ConverterConfig.DEFAULT_EXTENSIONS, converter, 
                            checkpointStore, 2, 0, dryRun, out);
  }

  private static ListAppender<ILoggingEvent> captureSessionLog() {
    ListAppender<ILoggingEvent> appender = new ListAppender<ILoggingEvent>();
    appender.start();
    ((Logger)LoggerFactory.getLogger(BatchSession.class)).addAppender(appender);
    return appender;
  }

  private static void releaseSessionLog(ListAppender<ILoggingEvent> appender) {
    ((Logger)LoggerFactory.getLogger(BatchSession.class)).detachAppender(appender);
    appender.stop();
  }

  private static int countWarnings(ListAppender<ILoggingEvent> appender, String text) {
    int count = 0;
    for (ILoggingEvent event : appender.list) {
      if (event.getLevel() == Level.WARN && event.getFormattedMessage().contains(text)) {
        count++;
      }
    }
    return count;
  }

  private static ConvertOptions options(boolean keepOriginal, boolean dryRun) {
    return new ConvertOptions(80, 0, keepOriginal, dryRun, false);
  }

  @Test
  public void convertTreeInPlaceTest() throws IOException {
    ConversionStatistics stats = makeSession(options(false, false)).run(inputRoot, "jpg");

    assertEquals(3, stats.getTotalFiles());
    assertEquals(2, stats.getConvertedFiles());
    assertEquals(1, stats.getSkippedFiles());
    assertEquals(0, stats.getFailedFiles());
    assertTrue(new File(inputRoot, "a.jpg").isFile());
    assertFalse(new File(inputRoot, "a.png").exists());
    assertTrue(new File(new File(inputRoot, "trip"), "b.jpg").isFile());
    assertTrue(new File(new File(inputRoot, "trip"), "c.jpg").isFile());
    // completed sessions leave no checkpoint behind
    assertTrue(checkpointStore.saveCount > 0);
    assertNull(checkpointStore.load());
  }

  @Test
  public void convertIntoOutputFolderTest() throws IOException {
    File outputRoot = new File(tempDir, "converted");
    settings.setOutputDir(outputRoot.getPath());
    settings.setSkipEmptyDirectories(false);

    ConversionStatistics stats = makeSession(options(true, false)).run(inputRoot, "bmp");

    assertEquals(3, stats.getConvertedFiles());
    assertTrue(new File(outputRoot, "a.bmp").isFile());
    assertTrue(new File(new File(outputRoot, "trip"), "b.bmp").isFile());
    assertTrue(new File(new File(outputRoot, "trip"), "c.bmp").isFile());
    assertTrue(new File(outputRoot, "empty").isDirectory());
    assertTrue(new File(inputRoot, "a.png").isFile());
  }

  @Test
  public void dryRunTest() throws IOException {
    ConversionStatistics stats = makeSession(options(false, true)).run(inputRoot, "bmp");

    assertEquals(3, stats.getTotalFiles());
    assertEquals(3, stats.getSkippedFiles());
    assertFalse(new File(inputRoot, "a.bmp").exists());
    assertTrue(new File(inputRoot, "a.png").isFile());
  }

  @Test
  public void dryRunLeavesOutputFolderUntouchedTest() throws IOException {
    File outputRoot = new File(tempDir, "converted");
    settings.setOutputDir(outputRoot.getPath());
    settings.setSkipEmptyDirectories(false);

    ConversionStatistics stats = makeSession(options(false, true)).run(inputRoot, "bmp");

    assertEquals(3, stats.getSkippedFiles());
    assertFalse(outputRoot.exists());
    assertTrue(new File(new File(inputRoot, "trip"), "c.png").isFile());
  }

  @Test
  public void slowConversionsKeepWaitingTest() throws IOException {
    final ImageConverter imageConverter = new ImageConverter(options(true, false));
    ConverterInterface slowConverter = new ConverterInterface() {
      @Override
      public ConversionResult convert(Job job) {
        try {
          Thread.sleep(300);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return imageConverter.convert(job);
      }
    };
    BatchSession session = makeSession(slowConverter, false);
    session.setIdleTimeoutMillis(50);

    ListAppender<ILoggingEvent> log = captureSessionLog();
    ConversionStatistics stats;
    try {
      stats = session.run(inputRoot, "bmp");
    } finally {
      releaseSessionLog(log);
    }

    assertEquals(3, stats.getTotalFiles());
    assertEquals(3, stats.getConvertedFiles());
    assertEquals(0, stats.getFailedFiles());
    assertTrue(countWarnings(log, "No result for") > 0);
    assertEquals(3, checkpointStore.lastSaved.getProcessedCount());
    assertNull(checkpointStore.load());
  }

  @Test
  public void sharedDestinationWarnsTest() throws IOException {
    TestImages.write(new File(inputRoot, "trip"), "a.png");
    settings.setPreserveStructure(false);

    ListAppender<ILoggingEvent> log = captureSessionLog();
    ConversionStatistics stats;
    try {
      stats = makeSession(options(true, false)).run(inputRoot, "bmp");
    } finally {
      releaseSessionLog(log);
    }

    assertEquals(4, stats.getConvertedFiles());
    assertEquals(1, countWarnings(log, "also the destination of another file"));
    assertTrue(new File(inputRoot, "a.bmp").isFile());
  }

  @Test
  public void failuresAreCountedTest() throws IOException {
    Files.write(new File(inputRoot, "broken.png").toPath(), new byte[] { 1, 2, 3, 4 });

    ConversionStatistics stats = makeSession(options(true, false)).run(inputRoot, "jpg");
    stats.calculate();

    assertEquals(4, stats.getTotalFiles());
    assertEquals(1, stats.getFailedFiles());
    assertEquals(1, stats.getFailureReasons().size());
    assertTrue(stats.getFailureReasons().keySet().iterator().next().startsWith("failed to decode image"));
    assertTrue(new File(inputRoot, "broken.png").isFile());
  }

  @Test
  public void noImagesTest(@TempDir File emptyRoot) throws IOException {
    ConversionStatistics stats = makeSession(options(false, false)).run(emptyRoot, "png");

    assertEquals(0, stats.getTotalFiles());
    assertEquals(0, checkpointStore.saveCount);
  }

  @Test
  public void resumeSkipsProcessedFilesTest() throws IOException {
    SessionState previous = new SessionState(inputRoot.getAbsolutePath(), "jpg", 3);
    previous.addProcessedFile(new File(inputRoot, "a.png").getAbsolutePath());
    String sessionId = previous.getSessionId();

    ConversionStatistics stats = makeSession(options(true, false)).run(inputRoot, "jpg", previous);

    assertEquals(2, stats.getTotalFiles());
    assertFalse(new File(inputRoot, "a.jpg").exists());
    assertTrue(new File(new File(inputRoot, "trip"), "c.jpg").isFile());
    assertEquals(sessionId, checkpointStore.lastSaved.getSessionId());
    assertEquals(3, checkpointStore.lastSaved.getProcessedCount());
    assertEquals(3, checkpointStore.lastSaved.getTotalFiles());
    assertNull(checkpointStore.load());
  }

  @Test
  public void cancelledSessionKeepsCheckpointTest() throws Exception {
    BatchSession session = makeSession(options(true, false));
    session.cancel();

    ConversionStatistics stats = session.run(inputRoot, "jpg");

    assertTrue(session.awaitFinished(1, TimeUnit.SECONDS));
    assertEquals(0, stats.getTotalFiles());
    SessionState remaining = checkpointStore.load();
    assertNotNull(remaining);
    assertEquals(3, remaining.getTotalFiles());
    assertEquals(0, remaining.getProcessedCount());
  }

  @Test
  public void checkpointTracksEveryResultTest() throws IOException {
    makeSession(options(true, false)).run(inputRoot, "bmp");

    // one save before dispatch and one per result
    assertEquals(4, checkpointStore.saveCount);
    assertEquals(3, checkpointStore.lastSaved.getProcessedCount());
    assertTrue(checkpointStore.lastSaved.getProcessedFileSet()
                                        .contains(new File(inputRoot, "a.png").getAbsolutePath()));
  }

  private static class RecordingCheckpointStore implements CheckpointStore {
    private SessionState current = null;
    private SessionState lastSaved = null;
    private int saveCount = 0;

    @Override
    public void save(SessionState state) {
      saveCount++;
      current = state;
      lastSaved = state;
    }

    @Override
    public SessionState load() {
      return current;
    }

    @Override
    public void clear() {
      current = null;
    }
  }
}
