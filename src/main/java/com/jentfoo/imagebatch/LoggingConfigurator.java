package com.jentfoo.imagebatch;

import java.io.File;
import java.io.IOException;

import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Applies the configured log level, and optionally a log file, on top of {@code logback.xml}.
 */
public class LoggingConfigurator {
  public static final String LOG_FILE_NAME = "imagebatch.log";
  private static final String FILE_APPENDER_NAME = "FILE";
  private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{20} - %msg%n";

  public static void configure(String level, boolean logToFile) throws IOException {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (! (factory instanceof LoggerContext)) {
      return;
    }

    LoggerContext context = (LoggerContext)factory;
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    root.setLevel(Level.toLevel(level, Level.INFO));

    if (logToFile && root.getAppender(FILE_APPENDER_NAME) == null) {
      File logFile = new File(StateDirectories.getLogFolder(), LOG_FILE_NAME);
      FileUtils.ensureParentExists(logFile);

      PatternLayoutEncoder encoder = new PatternLayoutEncoder();
      encoder.setContext(context);
      encoder.setPattern(FILE_PATTERN);
      encoder.start();

      FileAppender<ILoggingEvent> appender = new FileAppender<ILoggingEvent>();
      appender.setContext(context);
      appender.setName(FILE_APPENDER_NAME);
      appender.setFile(logFile.getAbsolutePath());
      appender.setAppend(true);
      appender.setEncoder(encoder);
      appender.start();

      root.addAppender(appender);
    }
  }
}
