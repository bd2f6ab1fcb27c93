// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import java.util.Optional;
import java.util.logging.*;

/// Routes test logging to stdout at the level named by the `LOG_LEVEL` environment variable.
public class LoggerConfig {

  static {
    Logger rootLogger = Logger.getLogger("");
    for (Handler handler : rootLogger.getHandlers()) {
      rootLogger.removeHandler(handler);
    }

    ConsoleHandler consoleHandler = new ConsoleHandler() {{
      setOutputStream(System.out);
    }};
    final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL")).orElse("WARNING");
    Level level = Level.parse(levelString);
    consoleHandler.setLevel(level);
    rootLogger.setLevel(level);
    rootLogger.addHandler(consoleHandler);
    consoleHandler.setFormatter(new SimpleFormatter() {
      @Override
      public String format(LogRecord record) {
        return String.format("[%s] %s %s%n",
            record.getLevel().getName(),
            Thread.currentThread().getName(),
            record.getMessage());
      }
    });
  }

  public static void initialize() {
    // triggers the static block
  }
}
