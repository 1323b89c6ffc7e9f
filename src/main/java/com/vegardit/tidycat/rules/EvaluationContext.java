/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.time.Instant;

/**
 * Run-wide values needed to evaluate conditions. The reference time is fixed once per run so that all items are
 * compared against the same instant.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record EvaluationContext(Instant referenceTime, KindTable kinds) {

   public static EvaluationContext now() {
      return new EvaluationContext(Instant.now(), KindTable.DEFAULT);
   }
}
