/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

/**
 * Signals that an undo operation cannot be started, e.g. because the requested record does not exist or was already
 * undone.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class UndoException extends Exception {

   private static final long serialVersionUID = 1L;

   public UndoException(final String message) {
      super(message);
   }
}
