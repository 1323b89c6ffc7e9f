/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import com.vegardit.tidycat.undo.MoveRecord;
import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Performs or simulates planned moves.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class MoveExecutor {

   private static final Logger LOG = Logger.create();

   private final boolean apply;

   /**
    * @param apply if false moves are only logged
    */
   public MoveExecutor(final boolean apply) {
      this.apply = apply;
   }

   public ExecutionResult execute(final List<MovePlan> moves) {
      final var moved = new ArrayList<MoveRecord>();
      final var errors = new ArrayList<MoveError>();
      for (final var move : moves) {
         if (!apply) {
            LOG.info("DRY-RUN [@|magenta %s|@]: %s -> %s", move.ruleDescription(), move.source(), move.destination());
            continue;
         }

         try {
            final var parent = move.destination().getParent();
            if (parent != null) {
               Files.createDirectories(parent);
            }
            FileUtils.move(move.source(), move.destination());
            moved.add(new MoveRecord(move.source().toString(), move.destination().toString(), move.ruleId()));
            LOG.info("MOVE [@|magenta %s|@]: %s -> %s", move.ruleDescription(), move.source(), move.destination());
         } catch (final IOException | SecurityException ex) {
            final var error = MoveError.of(move, ex);
            errors.add(error);
            LOG.error("ERROR %s", error);
            if (LOG.isDebugEnabled()) {
               LOG.debug(ex);
            }
         }
      }
      return new ExecutionResult(moved, errors);
   }
}
