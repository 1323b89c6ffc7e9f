/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * User supplied modifications of the built-in rule set. All rule references are already resolved to rule ids.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RuleOverrides {

   public final Set<String> enable = new LinkedHashSet<>();
   public final Set<String> disable = new LinkedHashSet<>();

   /** rule id -> normalized extensions replacing all conditions of the rule */
   public final Map<String, List<String>> extensions = new LinkedHashMap<>();

   /** rule id -> normalized subfolder */
   public final Map<String, String> subfolders = new LinkedHashMap<>();

   public final List<String> order = new ArrayList<>();
   public final List<Rule> customRules = new ArrayList<>();

   public boolean isEmpty() {
      return enable.isEmpty() && disable.isEmpty() && extensions.isEmpty() && subfolders.isEmpty() && order.isEmpty() && customRules
         .isEmpty();
   }
}
