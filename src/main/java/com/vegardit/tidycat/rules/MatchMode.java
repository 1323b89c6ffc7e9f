/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.Locale;

/**
 * How the conditions of a rule are combined.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public enum MatchMode {

   /** every condition must hold */
   ALL,

   /** at least one condition must hold */
   ANY;

   public static MatchMode parse(final String mode) {
      switch (mode.strip().toLowerCase(Locale.ROOT)) {
         case "all":
            return ALL;
         case "any":
            return ANY;
         default:
            throw new IllegalArgumentException("Unsupported rule mode [" + mode + "], must be one of [all, any].");
      }
   }

   public String id() {
      return name().toLowerCase(Locale.ROOT);
   }
}
