// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/// Routes java.util.logging output of the tests to a single one line per record console handler.
/// The level comes from the system property `java.util.logging.ConsoleHandler.level` and defaults to WARNING.
/// Run with `-Djava.util.logging.ConsoleHandler.level=FINER` to see the codec's trace output.
public final class LoggingControl {

  private LoggingControl() {
  }

  public static void setupCleanLogging() {
    final String levelName = System.getProperty("java.util.logging.ConsoleHandler.level", "WARNING");
    Level level;
    try {
      level = Level.parse(levelName);
    } catch (IllegalArgumentException e) {
      System.err.println("Invalid log level '" + levelName + "', using WARNING");
      level = Level.WARNING;
    }

    final Logger root = Logger.getLogger("");
    root.setLevel(level);
    for (Handler handler : root.getHandlers()) {
      root.removeHandler(handler);
    }

    final ConsoleHandler console = new ConsoleHandler();
    console.setLevel(level);
    console.setFormatter(new Formatter() {
      @Override
      public String format(LogRecord record) {
        return String.format("%-7s %s %s%n", record.getLevel(), record.getLoggerName(), formatMessage(record));
      }
    });
    root.addHandler(console);
  }
}
