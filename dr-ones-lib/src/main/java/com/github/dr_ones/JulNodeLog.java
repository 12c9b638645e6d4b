// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import org.jetbrains.annotations.TestOnly;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// A [NodeLog] that writes to JUL. Status lines are logged at INFO as `[NODE n] message` and error lines at WARNING
/// as `[NODE n] Error: message`. It can be switched off and on at runtime and redirected to a file.
public class JulNodeLog implements NodeLog, AutoCloseable {
  public static final String LOGGER_NAME = "com.github.dr_ones.node";

  private final Logger logger;
  private final AtomicBoolean enabled;
  private volatile Handler fileHandler;

  public JulNodeLog(Logger logger, boolean enabled) {
    this.logger = logger;
    this.enabled = new AtomicBoolean(enabled);
  }

  public JulNodeLog() {
    this(Logger.getLogger(LOGGER_NAME), true);
  }

  /// Builds a log from the given settings. If a log file is configured it is opened in append mode.
  ///
  /// @throws UncheckedIOException if the log file cannot be opened.
  public static JulNodeLog create(NodeLogConfig config) {
    final var logger = Logger.getLogger(LOGGER_NAME);
    logger.setLevel(config.level());
    final var log = new JulNodeLog(logger, config.enabled());
    config.logFile().ifPresent(path -> {
      try {
        log.redirectTo(path);
      } catch (IOException e) {
        throw new UncheckedIOException("could not open node log file " + path, e);
      }
    });
    return log;
  }

  @Override
  public void status(NodeId nodeId, String message) {
    if (enabled.get()) {
      logger.info(() -> "[NODE " + nodeId + "] " + message);
    }
  }

  @Override
  public void error(NodeId nodeId, String message) {
    if (enabled.get()) {
      logger.warning(() -> "[NODE " + nodeId + "] Error: " + message);
    }
  }

  public void enable() {
    enabled.set(true);
  }

  public void disable() {
    enabled.set(false);
  }

  public boolean isEnabled() {
    return enabled.get();
  }

  /// Sends all further lines to the file, written as UTF-8, and no longer to the parent (console) handlers. Calling
  /// it again moves the output to the new file.
  public synchronized void redirectTo(Path file) throws IOException {
    // FileHandler takes a pattern so a literal '%' in the path must be doubled
    final var handler = new FileHandler(file.toString().replace("%", "%%"), true);
    handler.setEncoding(StandardCharsets.UTF_8.name());
    handler.setFormatter(new SimpleFormatter() {
      @Override
      public String format(LogRecord record) {
        return String.format("%s%n", record.getMessage());
      }
    });
    handler.setLevel(Level.ALL);
    closeFileHandler();
    logger.addHandler(handler);
    logger.setUseParentHandlers(false);
    fileHandler = handler;
  }

  private void closeFileHandler() {
    final var current = fileHandler;
    if (current != null) {
      logger.removeHandler(current);
      current.close();
      fileHandler = null;
    }
  }

  /// Closes any log file and returns output to the console.
  @Override
  public synchronized void close() {
    if (fileHandler != null) {
      closeFileHandler();
      logger.setUseParentHandlers(true);
    }
  }

  @TestOnly
  Logger logger() {
    return logger;
  }
}
