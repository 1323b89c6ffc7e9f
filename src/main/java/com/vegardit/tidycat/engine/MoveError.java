/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;

/**
 * A move that failed. Failed moves do not stop the run.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record MoveError(Path source, Path destination, String message) {

   public static MoveError of(final MovePlan move, final Exception ex) {
      return new MoveError(move.source(), move.destination(), ex.getClass().getSimpleName() + ": " + ex.getMessage());
   }

   @Override
   public String toString() {
      return "Moving [" + source + "] to [" + destination + "] failed. " + message;
   }
}
