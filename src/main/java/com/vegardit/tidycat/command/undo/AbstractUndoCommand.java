/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.undo;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import com.vegardit.tidycat.command.AbstractCommand;
import com.vegardit.tidycat.command.tidy.TidyCommandConfig;
import com.vegardit.tidycat.undo.TransactionStore;
import com.vegardit.tidycat.util.FileUtils;

import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public abstract class AbstractUndoCommand extends AbstractCommand {

   private Path undoDir = TidyCommandConfig.DEFAULT_UNDO_DIR;

   protected TransactionStore createStore() {
      return new TransactionStore(FileUtils.toAbsolute(undoDir));
   }

   @Option(names = "--undo-dir", paramLabel = "<path>", description = "Directory holding the undo records. Default: ~/.tidycat/undos")
   private void setUndoDir(final String undoDir) {
      try {
         this.undoDir = Path.of(undoDir);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Undo directory: " + ex.getMessage());
      }
   }
}
