/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.util.List;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record PlanResult(List<MovePlan> moves, TidySummary summary) {

   public PlanResult {
      moves = List.copyOf(moves);
   }
}
