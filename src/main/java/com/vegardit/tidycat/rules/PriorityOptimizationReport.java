/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Explains how {@link PriorityOptimizer} reordered a rule list.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record PriorityOptimizationReport( //
   @JsonProperty("enabled") boolean enabled, //
   @JsonProperty("strategy") String strategy, //
   @JsonProperty("changed") boolean changed, //
   @JsonProperty("before_order") List<String> beforeOrder, //
   @JsonProperty("after_order") List<String> afterOrder, //
   @JsonProperty("scores") List<RuleScore> scores //
) {

   /**
    * @param score specificity score rounded to 3 decimals
    * @param optimizedIndex position among the enabled rules after optimization
    */
   public record RuleScore( //
      @JsonProperty("rule_id") String ruleId, //
      @JsonProperty("description") String description, //
      @JsonProperty("score") double score, //
      @JsonProperty("original_index") int originalIndex, //
      @JsonProperty("optimized_index") int optimizedIndex //
   ) {
   }

   /**
    * @return a report stating that no optimization took place
    */
   public static PriorityOptimizationReport notApplied(final List<Rule> rules) {
      final var order = rules.stream().map(Rule::id).toList();
      return new PriorityOptimizationReport(false, PriorityOptimizer.STRATEGY, false, order, order, List.of());
   }

   public PriorityOptimizationReport {
      beforeOrder = List.copyOf(beforeOrder);
      afterOrder = List.copyOf(afterOrder);
      scores = List.copyOf(scores);
   }
}
