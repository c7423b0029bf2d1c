// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import java.util.Optional;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/// Sends all logging to stdout as `[LEVEL] message`. The level comes from the `LOG_LEVEL` environment variable and
/// defaults to INFO.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler() {{
        setOutputStream(System.out);
      }};

      Level level = level(System.getenv("LOG_LEVEL"));
      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          return LoggerConfig.format(record);
        }
      });
    } catch (RuntimeException e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize() {
    // triggers the static block
  }

  static Level level(String name) {
    return Level.parse(Optional.ofNullable(name).filter(s -> !s.isBlank()).orElse("INFO").trim());
  }

  static String format(LogRecord record) {
    final var sb = new StringBuilder(String.format("[%s] %s%n", record.getLevel().getName(), record.getMessage()));
    if (record.getThrown() != null) {
      sb.append(String.format("  caused by %s%n", record.getThrown()));
    }
    return sb.toString();
  }
}
