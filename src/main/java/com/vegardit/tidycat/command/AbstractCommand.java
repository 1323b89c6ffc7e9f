/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.util.concurrent.Callable;
import java.util.logging.Level;

import com.vegardit.tidycat.command.AbstractCommand.VersionProvider;

import net.sf.jstuff.core.logging.Logger;
import net.sf.jstuff.core.logging.jul.Levels;
import net.sf.jstuff.core.reflection.Types;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Base class of all commands. Provides the banner, verbosity options and signal handling.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command( //
   headerHeading = "" //
      + "                                     /\\_/\\%n" //
      + "  __  _     __               __     ( o.o )%n" //
      + " / /_(_)___/ /_ ______ ___ _/ /_     > ^ <%n" //
      + "/ __/ / _  / // / __/ _ `/ __/     / * \\%n" //
      + "\\__/_/\\_,_/\\_, /\\__/\\_,_/\\__/     (..)~(..)%n" //
      + "          /___/%n" //
      + "      https://github.com/vegardit/tidycat%n" //
      + "%n", //
   mixinStandardHelpOptions = true, //
   descriptionHeading = "%n", //
   commandListHeading = "%nCommands%n", //
   parameterListHeading = "%nPositional parameters:%n", //
   optionListHeading = "%nOptions:%n", //
   requiredOptionMarker = '*', //
   usageHelpAutoWidth = true, //
   separator = " ", //
   showDefaultValues = true, //
   sortOptions = true, //
   versionProvider = VersionProvider.class //
)
public abstract class AbstractCommand implements Callable<Integer> {

   public static final class VersionProvider implements IVersionProvider {
      @Override
      public String[] getVersion() throws Exception {
         return new String[] {Types.getVersion(AbstractCommand.class)};
      }
   }

   /** the command completed and all operations succeeded */
   public static final int EXIT_OK = 0;

   /** the command completed but some operations failed, or the command line was invalid */
   public static final int EXIT_ERRORS = 1;

   /** the command could not be executed, e.g. because of invalid configuration */
   public static final int EXIT_FATAL = 2;

   private static final Logger LOG = Logger.create();

   @Spec
   protected CommandSpec commandSpec = lateNonNull();

   /**
    * logging options are not further evaluated, since it is already done in main entry point
    */
   @Mixin
   private LoggingOptionsMixin loggingOptions = lateNonNull();

   private int verbosity = 0;

   public boolean isQuiet() {
      return verbosity == -1;
   }

   public int getVerbosity() {
      return verbosity;
   }

   @Override
   public final Integer call() throws Exception {
      // Runtime.getRuntime().addShutdownHook() is not working reliable
      try {
         sun.misc.Signal.handle(new sun.misc.Signal("INT"), signal -> {
            LOG.warn("Canceling operation due to SIGINT(2) signal (CTRL+C) received...");
            System.exit(128 + 2);
         });
      } catch (final IllegalArgumentException ex) {
         LOG.debug("Cannot install SIGINT handler: %s", ex.getMessage());
      }
      try {
         sun.misc.Signal.handle(new sun.misc.Signal("TERM"), signal -> {
            LOG.warn("Canceling operation due to SIGTERM(15) signal received...");
            System.exit(128 + 15);
         });
      } catch (final IllegalArgumentException ex) {
         LOG.debug("Cannot install SIGTERM handler: %s", ex.getMessage());
      }

      final int exitCode = execute();

      LOG.info("");
      if (exitCode == EXIT_OK) {
         LOG.info("The operation completed successfully.");
      } else {
         LOG.warn("The operation completed with errors.");
      }
      return exitCode;
   }

   /**
    * @return the exit code
    */
   protected abstract int execute() throws Exception;

   @Option(names = {"-q", "--quiet"}, description = "Quiet mode.")
   private void setQuiet(final boolean flag) {
      if (flag) {
         Levels.setRootLevel(Level.SEVERE);
         verbosity = -1;
      }
   }

   @Option(names = {"-v", "--verbose"}, description = {"Specify multiple -v options to increase verbosity.",
      "For example `-v -v -v` or `-vvv`."})
   private void setVerbosity(final boolean[] flags) {
      switch (flags.length) {
         case 0:
            Levels.setRootLevel(Level.INFO);
            break;
         case 1:
            Levels.setRootLevel(Level.FINE);
            break;
         case 2:
            Levels.setRootLevel(Level.FINER);
            break;
         default:
            Levels.setRootLevel(Level.FINEST);
      }
      verbosity = flags.length;
   }
}
