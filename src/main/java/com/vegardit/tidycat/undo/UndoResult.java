/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

/**
 * Counters of an undo run.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class UndoResult {

   private int restored;
   private int collisions;
   private int errors;

   public int getCollisions() {
      return collisions;
   }

   public int getErrors() {
      return errors;
   }

   public int getRestored() {
      return restored;
   }

   public boolean hasErrors() {
      return errors > 0;
   }

   void onCollision() {
      collisions++;
   }

   void onError() {
      errors++;
   }

   void onRestored() {
      restored++;
   }

   @Override
   public String toString() {
      return "restored=" + restored + " collisions=" + collisions + " errors=" + errors;
   }
}
