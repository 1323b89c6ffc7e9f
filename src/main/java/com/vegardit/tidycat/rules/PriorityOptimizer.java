/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;

/**
 * Reorders enabled rules so that narrow rules are tried before broad ones.
 * <p>
 * Each condition contributes a specificity score, e.g. an <code>extension_any</code> condition with a single
 * extension scores higher than one listing many extensions. Enabled rules are sorted by descending score, ties keep
 * their original order. Disabled rules are moved to the end in original order.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class PriorityOptimizer {

   public static final String STRATEGY = "specificity_v1";

   static final double DISABLED_SCORE = -1_000_000.0;

   public record Result(List<Rule> rules, PriorityOptimizationReport report) {
   }

   private record ScoredRule(Rule rule, double score, int originalIndex) {
   }

   static double conditionScore(final Condition condition) {
      switch (condition.type()) {
         case EXTENSION_ANY: {
            var valid = 0;
            for (final var ext : condition.values()) {
               if (!ext.toString().isBlank()) {
                  valid++;
               }
            }
            return 120.0 / Math.max(1, valid);
         }
         case NAME_CONTAINS: {
            var phrases = 0;
            for (final var phrase : condition.values()) {
               if (!phrase.toString().isBlank()) {
                  phrases++;
               }
            }
            return 70.0 + Math.min(phrases, 5) * 4.0;
         }
         case CREATED_WITHIN_DAYS:
         case SIZE_GTE:
         case SIZE_LTE:
            return 45.0;
         case HAS_TAG:
         case IS_ALIAS:
         case IS_FOLDER:
            return 40.0;
         case KIND:
            return 35.0;
         default:
            return 0.0;
      }
   }

   static double ruleScore(final Rule rule) {
      if (!rule.enabled())
         return DISABLED_SCORE;

      var score = 0.0;
      for (final var condition : rule.conditions()) {
         score += conditionScore(condition);
      }
      if (rule.mode() == MatchMode.ALL) {
         score += 12.0;
      }
      if (!rule.builtIn()) {
         score += 6.0;
      }
      score += Math.min(rule.conditions().size(), 5) * 3.0;
      return score;
   }

   public static Result optimize(final List<Rule> rules) {
      final var enabled = new ArrayList<ScoredRule>();
      final var disabled = new ArrayList<Rule>();
      for (var i = 0; i < rules.size(); i++) {
         final var rule = rules.get(i);
         if (rule.enabled()) {
            enabled.add(new ScoredRule(rule, ruleScore(rule), i));
         } else {
            disabled.add(rule);
         }
      }
      enabled.sort(Comparator.comparingDouble(ScoredRule::score).reversed().thenComparingInt(ScoredRule::originalIndex));

      final var optimized = new ArrayList<Rule>(rules.size());
      final var optimizedIndexes = new HashMap<String, Integer>();
      for (final var scored : enabled) {
         optimizedIndexes.put(scored.rule().id(), optimized.size());
         optimized.add(scored.rule());
      }
      optimized.addAll(disabled);

      final var scores = new ArrayList<PriorityOptimizationReport.RuleScore>(enabled.size());
      for (final var scored : enabled) {
         scores.add(new PriorityOptimizationReport.RuleScore( //
            scored.rule().id(), //
            scored.rule().description(), //
            Math.round(scored.score() * 1000.0) / 1000.0, //
            scored.originalIndex(), //
            optimizedIndexes.get(scored.rule().id())));
      }

      final var before = rules.stream().map(Rule::id).toList();
      final var after = optimized.stream().map(Rule::id).toList();
      return new Result(List.copyOf(optimized), new PriorityOptimizationReport(true, STRATEGY, !before.equals(after), before, after,
         scores));
   }

   private PriorityOptimizer() {
   }
}
