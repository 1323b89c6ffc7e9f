/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.*;

import java.io.IOException;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.LogRecord;

import org.eclipse.jdt.annotation.Nullable;
import org.fusesource.jansi.Ansi;
import org.fusesource.jansi.AnsiRenderer;

import com.vegardit.tidycat.command.AbstractCommand;
import com.vegardit.tidycat.command.LoggingOptionsMixin;
import com.vegardit.tidycat.command.rules.RulesListCommand;
import com.vegardit.tidycat.command.tidy.TidyCommand;
import com.vegardit.tidycat.command.undo.UndoCommand;
import com.vegardit.tidycat.command.undo.UndoDeleteCommand;
import com.vegardit.tidycat.command.undo.UndoListCommand;
import com.vegardit.tidycat.util.JdkLoggingUtils;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.io.StringPrintWriter;
import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.RunLast;
import picocli.CommandLine.Unmatched;
import picocli.CommandLine.UnmatchedArgumentException;
import picocli.jansi.graalvm.AnsiConsole;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "tidycat", //
   description = "The tidy and sweet Downloads folder organizer.", //
   synopsisSubcommandLabel = "COMMAND", //
   subcommands = { //
      TidyCommand.class, //
      RulesListCommand.class, //
      UndoListCommand.class, //
      UndoCommand.class, //
      UndoDeleteCommand.class //
   } //
)
public class TidyCatMain extends AbstractCommand {

   public static class LoggingOptions extends LoggingOptionsMixin {
      @Unmatched
      List<String> ignored = lateNonNull();
   }

   private static final Logger LOG = Logger.create();

   @Nullable
   private static FileHandler configureLogging(final String[] args) throws IOException {
      final var loggingOptions = new LoggingOptions();
      CommandLine.populateCommand(loggingOptions, args);
      JdkLoggingUtils.configureConsoleHandler(!loggingOptions.logErrorsToStdOut, new JdkLoggingUtils.AnsiFormatter() {

         final String replaceLastLine = new Ansi().cursorUpLine().eraseLine().toString();

         @Nullable
         String lastMessage = null;

         @Override
         protected String ansiRender(final String text, final Object... args) {
            if (lastMessage != null && lastMessage.startsWith("Scanning "))
               return replaceLastLine + super.ansiRender(text, args);
            return super.ansiRender(text, args);
         }

         @Override
         public synchronized String format(final LogRecord entry) {
            try {
               return super.format(entry);
            } finally {
               lastMessage = entry.getMessage();
            }
         }
      });

      final var logFile = loggingOptions.logFile;
      if (logFile == null)
         return null;
      return JdkLoggingUtils.addFileHandler(logFile.toAbsolutePath().toString());
   }

   /**
    * Creates the command line handler including the exception handlers that report problems via the logger.
    */
   public static CommandLine createCommandLine() {
      final var handler = new CommandLine(new TidyCatMain());
      handler.setCaseInsensitiveEnumValuesAllowed(true);
      handler.setExecutionStrategy(new RunLast());
      handler.setHelpFactory((commandSpec, colorScheme) -> new Help(commandSpec, colorScheme) {

         @Nullable
         @Override
         public String headerHeading(final Object @Nullable... params) {
            return AnsiRenderer.render(super.headerHeading(params));
         }
      });

      /*
       * custom exception handlers that use a logger instead of directly writing to stdout/stderr
       */
      handler.setParameterExceptionHandler((ex, args) -> {
         if (args.length == 0) {
            CommandLine.usage(handler, System.err);
            System.err.println();
            LOG.error(ex.getMessage());
         } else {
            LOG.error(ex.getMessage());
            try (var sw = new StringPrintWriter()) {
               UnmatchedArgumentException.printSuggestions(ex, sw);
               final var suggestions = sw.toString();
               if (Strings.isNotBlank(suggestions)) {
                  LOG.info(Strings.trim(suggestions));
               }
            }
            LOG.info("Execute 'tidycat --help' for usage help.");
         }
         return EXIT_ERRORS;
      });
      handler.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
         ex = asNonNullUnsafe(ex);
         if (LOG.isDebugEnabled() || ex instanceof UnsupportedOperationException || ex instanceof NullPointerException) {
            LOG.error(ex); // log with stacktrace
         } else {
            LOG.error(ex.getMessage());
         }
         return EXIT_FATAL;
      });
      return handler;
   }

   public static void main(final String[] args) throws Exception {
      Thread.currentThread().setName("main");

      // evaluate the logging options before any other component starts throwing exceptions,
      // see https://github.com/remkop/picocli/issues/1295
      final var fileHandler = configureLogging(args);

      // enable ANSI coloring
      AnsiConsole.systemInstall();

      final var exitCode = createCommandLine().execute(args);
      if (fileHandler != null) {
         fileHandler.close();
      }
      System.exit(exitCode);
   }

   @Override
   protected int execute() throws Exception {
      throw new ParameterException(commandSpec.commandLine(), "Missing required subcommand.");
   }
}
