/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.util.List;

import com.vegardit.tidycat.undo.MoveRecord;

/**
 * @param moved the successfully executed moves, empty in dry-run mode
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record ExecutionResult(List<MoveRecord> moved, List<MoveError> errors) {

   public ExecutionResult {
      moved = List.copyOf(moved);
      errors = List.copyOf(errors);
   }
}
