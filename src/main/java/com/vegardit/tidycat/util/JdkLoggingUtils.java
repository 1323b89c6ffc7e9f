/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import java.io.IOException;
import java.util.Date;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.AnsiRenderer;

import net.sf.jstuff.core.exception.Exceptions;
import net.sf.jstuff.core.logging.LoggerConfig;
import net.sf.jstuff.core.logging.jul.DualPrintStreamHandler;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.logging.jul.Loggers;
import net.sf.jstuff.core.logging.jul.PrintStreamHandler;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class JdkLoggingUtils {

   /**
    * Renders jansi markup like <code>@|magenta text|@</code> contained in log messages.
    */
   public static class AnsiFormatter extends Formatter {

      protected String ansiRender(final @Nullable String text) {
         return text == null ? "null" : AnsiRenderer.render(text);
      }

      protected String ansiRender(final String template, final Object... args) {
         return String.format(AnsiRenderer.render(template), args);
      }

      @Override
      public synchronized String format(final LogRecord entry) {
         final var msg = ansiRender(entry.getMessage());
         final var recordTime = new Date(entry.getMillis());

         switch (entry.getLevel().intValue()) {
            case Levels.INFO_INT:
               return ansiRender("@|green %1$tT|@ %2$s%n", recordTime, msg);

            case Levels.WARNING_INT:
               return ansiRender("@|yellow %1$tT WARN: %2$s%n|@", recordTime, msg);

            case Levels.SEVERE_INT:
               return entry.getThrown() == null //
                  ? ansiRender("@|red %1$tT ERROR: %2$s%n|@", recordTime, msg) //
                  : ansiRender("@|red %1$tT ERROR: %2$s %3$s|@", recordTime, msg, Exceptions.getStackTrace(entry.getThrown()));

            default:
               return String.format("%1$tT %2$-6s: %3$s%n", recordTime, entry.getLevel().getLocalizedName(), msg);
         }
      }
   }

   private static final Formatter PLAIN_FORMATTER = new Formatter() {
      @Override
      public synchronized String format(final LogRecord entry) {
         final var recordTime = new Date(entry.getMillis());
         final var msg = stripAnsiMarkup(entry.getMessage());
         return String.format("%1$tF %1$tT %2$-6s: %3$s%n", recordTime, entry.getLevel().getLocalizedName(), msg);
      }
   };

   private static @Nullable Handler consoleHandler;

   public static FileHandler addFileHandler(final String fileNamePattern) throws IOException {
      synchronized (Loggers.ROOT_LOGGER) {
         final var handler = new FileHandler(fileNamePattern, 0, 1, true);
         handler.setFormatter(PLAIN_FORMATTER);
         Loggers.ROOT_LOGGER.addHandler(handler);
         return handler;
      }
   }

   /**
    * Replaces all console handlers of the root logger with one using the given formatter.
    *
    * @param useStdErr if true warnings and errors are written to stderr
    */
   public static void configureConsoleHandler(final boolean useStdErr, final Formatter consoleFormatter) {
      synchronized (Loggers.ROOT_LOGGER) {
         if (useStdErr && consoleHandler instanceof DualPrintStreamHandler)
            return;

         LoggerConfig.setCompactExceptionLogging(false);
         Loggers.ROOT_LOGGER.setUseParentHandlers(false);
         for (final Handler handler : Loggers.ROOT_LOGGER.getHandlers()) {
            if (!(handler instanceof FileHandler)) {
               Loggers.ROOT_LOGGER.removeHandler(handler);
            }
         }
         final Handler handler = useStdErr //
            ? new DualPrintStreamHandler(System.out, System.err, consoleFormatter)
            : new PrintStreamHandler(System.out, consoleFormatter);
         consoleHandler = handler;
         Loggers.ROOT_LOGGER.addHandler(handler);
      }
   }

   /**
    * Raises the root log level to the given level if it is currently coarser.
    */
   public static void ensureRootLogLevel(final Level requiredLevel) {
      synchronized (Loggers.ROOT_LOGGER) {
         if (Levels.getRootLevel().intValue() > requiredLevel.intValue()) {
            Levels.setRootLevel(requiredLevel);
         }
      }
   }

   static String stripAnsiMarkup(final @Nullable String msg) {
      if (msg == null)
         return "null";
      return msg.replaceAll("(@\\|[a-z,]+\\s)|(\\|@)", "");
   }

   /**
    * Executes the given code block with the root logger set to at least the required granularity.
    */
   public static void withRootLogLevel(final Level requiredLevel, final Runnable code) {
      synchronized (Loggers.ROOT_LOGGER) {
         final var currentLevel = Levels.getRootLevel();
         if (currentLevel.intValue() > requiredLevel.intValue()) {
            Levels.setRootLevel(requiredLevel);
            try {
               code.run();
            } finally {
               Levels.setRootLevel(currentLevel);
            }
         } else {
            code.run();
         }
      }
   }

   private JdkLoggingUtils() {
   }
}
