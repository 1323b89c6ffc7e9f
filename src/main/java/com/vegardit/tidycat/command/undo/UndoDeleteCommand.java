/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.undo;

import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "undo-delete", //
   description = "Deletes undo records by id or age. Performs a dry run unless --apply is specified." //
)
public class UndoDeleteCommand extends AbstractUndoCommand {

   private static final Logger LOG = Logger.create();

   @Option(names = "--apply", description = "Delete the records. Without this option matching records are only counted.")
   private boolean apply;

   @Option(names = "--id", paramLabel = "<id>", description = "Id of the record to delete.")
   private @Nullable String id;

   private @Nullable Integer olderThanDays;

   @Override
   protected int execute() throws Exception {
      final var count = createStore().delete(id, olderThanDays, apply);
      if (apply) {
         LOG.info("deleted undo records=%d", count);
      } else {
         LOG.info("DRY-RUN delete count=%d", count);
      }
      return EXIT_OK;
   }

   @Option(names = "--older-than-days", paramLabel = "<days>", description = "Delete records created more than the given number of days ago.")
   private void setOlderThanDays(final int olderThanDays) {
      if (olderThanDays < 0)
         throw new ParameterException(commandSpec.commandLine(), "--older-than-days must be >= 0");
      this.olderThanDays = olderThanDays;
   }
}
