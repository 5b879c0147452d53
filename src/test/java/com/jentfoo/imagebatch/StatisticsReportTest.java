package com.jentfoo.imagebatch;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class StatisticsReportTest {
  @Test
  public void formatBytesTest() {
    assertEquals("0 B", StatisticsReport.formatBytes(0));
    assertEquals("1023 B", StatisticsReport.formatBytes(1023));
    assertEquals("1.0 KB", StatisticsReport.formatBytes(1024));
    assertEquals("1.5 KB", StatisticsReport.formatBytes(1536));
    assertEquals("1.0 MB", StatisticsReport.formatBytes(1024 * 1024));
    assertEquals("2.5 GB", StatisticsReport.formatBytes(1024L * 1024 * 1024 * 5 / 2));
  }

  @Test
  public void printReportTest() throws Exception {
    ConversionStatistics stats = new ConversionStatistics();
    stats.addResult(new ConversionResult(new File("a.png"), new File("a.webp"), 2048, 1024, 100, null));
    stats.addResult(new ConversionResult(new File("b.png"), null, 10, 0, 0, null));
    stats.addResult(new ConversionResult(new File("c.png"), null, 10, 0, 20, 
                                         new ConversionException("failed to decode image: bad")));
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");

    new StatisticsReport(out).print(stats);

    String report = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    assertTrue(stats.isCalculated());
    assertTrue(report.contains("Converted: 1"));
    assertTrue(report.contains("Skipped: 1"));
    assertTrue(report.contains("Failed: 1"));
    assertTrue(report.contains("Total processed: 3"));
    assertTrue(report.contains("Original size: 2.0 KB"));
    assertTrue(report.contains("Space saved: 1.0 KB (50.0% reduction)"));
    assertTrue(report.contains("failed to decode image: bad: 1 files"));
  }
}
