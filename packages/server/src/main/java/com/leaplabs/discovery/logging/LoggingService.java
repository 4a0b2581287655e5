package com.leaplabs.discovery.logging;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.io.File;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and to adjust Logback at runtime. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure: logging: level: root: INFO com.leaplabs.discovery: DEBUG okhttp3:
   * WARN
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    try {
      LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      if (levels != null) {
        Iterator<String> it = levels.getKeys();
        while (it.hasNext()) {
          String key = it.next();
          if ("root".equalsIgnoreCase(key)) continue;
          String lvl = levels.getString(key, null);
          if (lvl == null || lvl.isBlank()) continue;
          setLevel(ctx.getLogger(key), lvl);
        }
      }
    } catch (Exception e) {
      log.warn(
          "Failed to apply logging configuration from YAML; falling back to logback.xml settings",
          e);
    }
  }

  /**
   * Detach console appenders and log to a rolling file instead. Used by the stdio transport, where
   * stdout carries MCP protocol frames and must stay clean.
   */
  public static void switchToFileOnly(String directory) {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

    for (Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders(); it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(directory == null || directory.isBlank() ? "logs" : directory);
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "discovery-mcp.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "discovery-mcp.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info("Console logging disabled; file logging enabled at {}", fileAppender.getFile());
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
