/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.undo;

import org.eclipse.jdt.annotation.Nullable;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Moves the files of a recorded tidy run back to their original locations.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "undo", //
   description = "Reverts a recorded tidy run. Performs a dry run unless --apply is specified." //
)
public class UndoCommand extends AbstractUndoCommand {

   private static final Logger LOG = Logger.create();

   @Option(names = "--apply", description = "Move the files back. Without this option only a dry run is performed.")
   private boolean apply;

   @Option(names = "--id", paramLabel = "<id>", description = "Id of the record to revert. Default: the latest record not yet undone.")
   private @Nullable String id;

   @Override
   protected int execute() throws Exception {
      final var store = createStore();
      final var record = store.pick(id);
      LOG.info("UNDO %s record [@|magenta %s|@] created at %s with %d moves", apply ? "applying" : "simulating", record.id,
         record.createdAt, record.getMoveCount());

      final var result = store.undo(record, apply);
      if (apply && !result.hasErrors()) {
         store.markUndone(record);
      }

      LOG.info("***************************************");
      if (!apply) {
         LOG.info("DRY RUN: no changes were made. Use --apply to restore the files.");
      }
      LOG.info("UNDO SUMMARY restored=%d collisions=%d errors=%d", result.getRestored(), result.getCollisions(), result.getErrors());
      LOG.info("***************************************");
      return result.hasErrors() ? EXIT_ERRORS : EXIT_OK;
   }
}
