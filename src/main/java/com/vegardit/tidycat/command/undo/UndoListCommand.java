/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.undo;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "undo-list", //
   description = "Lists the recorded tidy runs, newest first." //
)
public class UndoListCommand extends AbstractUndoCommand {

   private static final Logger LOG = Logger.create();

   @Override
   protected int execute() throws Exception {
      final var store = createStore();
      final var records = store.list();
      if (records.isEmpty()) {
         LOG.info("No undo records found in %s", store.getUndoDir());
         return EXIT_OK;
      }

      LOG.info("UNDO RECORDS: %d", records.size());
      for (final var record : records) {
         LOG.info("%s  %s  moves=%d  source=%s  destination=%s  created=%s", //
            record.id, record.isUndone() ? "done" : "pending", record.getMoveCount(), record.sourceDir, record.destinationDir,
            record.createdAt);
      }
      return EXIT_OK;
   }
}
