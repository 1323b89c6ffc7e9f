/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.List;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Finds the first enabled rule, in rule order, whose conditions hold for an item.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RuleMatcher {

   public static boolean matches(final Rule rule, final Item item, final EvaluationContext ctx) {
      if (!rule.enabled() || rule.conditions().isEmpty())
         return false;

      if (rule.mode() == MatchMode.ANY) {
         for (final var condition : rule.conditions()) {
            if (condition.evaluate(item, ctx))
               return true;
         }
         return false;
      }

      for (final var condition : rule.conditions()) {
         if (!condition.evaluate(item, ctx))
            return false;
      }
      return true;
   }

   private final List<Rule> enabledRules;
   private final EvaluationContext ctx;

   public RuleMatcher(final List<Rule> rules, final EvaluationContext ctx) {
      enabledRules = rules.stream().filter(Rule::enabled).toList();
      this.ctx = ctx;
   }

   /**
    * @return the matching rule or null if the item is unclassified
    */
   public @Nullable Rule match(final Item item) {
      for (final var rule : enabledRules) {
         if (matches(rule, item, ctx))
            return rule;
      }
      return null;
   }
}
