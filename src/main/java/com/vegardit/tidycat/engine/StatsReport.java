/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vegardit.tidycat.rules.PriorityOptimizationReport;
import com.vegardit.tidycat.rules.Rule;

/**
 * Machine readable statistics of a tidy run.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@JsonPropertyOrder({"generated_at", "mode", "source_dir", "destination_dir", "total_targets", "rule_hits", "rule_hits_nonzero",
   "unclassified", "fallback_mime", "priority_optimization", "summary"})
public record StatsReport( //
   @JsonProperty("generated_at") String generatedAt, //
   @JsonProperty("mode") String mode, //
   @JsonProperty("source_dir") String sourceDir, //
   @JsonProperty("destination_dir") String destinationDir, //
   @JsonProperty("total_targets") int totalTargets, //
   @JsonProperty("rule_hits") List<RuleHit> ruleHits, //
   @JsonProperty("rule_hits_nonzero") Map<String, Integer> ruleHitsNonzero, //
   @JsonProperty("unclassified") int unclassified, //
   @JsonProperty("fallback_mime") int fallbackMime, //
   @JsonProperty("priority_optimization") PriorityOptimizationReport priorityOptimization, //
   @JsonProperty("summary") Summary summary //
) {

   private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

   public record RuleHit( //
      @JsonProperty("rule_id") String ruleId, //
      @JsonProperty("description") String description, //
      @JsonProperty("subfolder") String subfolder, //
      @JsonProperty("hits") int hits, //
      @JsonProperty("built_in") boolean builtIn, //
      @JsonProperty("enabled") boolean enabled //
   ) {
   }

   @JsonPropertyOrder({"scanned", "ignored", "matched", "planned_moves", "moved", "collisions", "errors", "rules_used"})
   public record Summary( //
      @JsonProperty("scanned") int scanned, //
      @JsonProperty("ignored") int ignored, //
      @JsonProperty("matched") int matched, //
      @JsonProperty("planned_moves") int plannedMoves, //
      @JsonProperty("moved") int moved, //
      @JsonProperty("collisions") int collisions, //
      @JsonProperty("errors") int errors, //
      @JsonProperty("rules_used") int rulesUsed //
   ) {
   }

   /**
    * @param rules the effective rule list, only enabled rules are reported
    */
   public static StatsReport create(final TidySummary summary, final List<Rule> rules, final Path sourceDir, final Path destinationDir,
         final boolean apply, final PriorityOptimizationReport priorityOptimization) {
      final var ruleHits = new ArrayList<RuleHit>();
      final var ruleHitsNonzero = new LinkedHashMap<String, Integer>();
      for (final var rule : rules) {
         if (!rule.enabled()) {
            continue;
         }
         final var hits = summary.getRuleHits(rule.id());
         ruleHits.add(new RuleHit(rule.id(), rule.description(), rule.subfolder(), hits, rule.builtIn(), rule.enabled()));
         if (hits > 0) {
            ruleHitsNonzero.put(rule.id(), hits);
         }
      }

      return new StatsReport( //
         Instant.now().toString(), //
         apply ? "apply" : "dry-run", //
         sourceDir.toString(), //
         destinationDir.toString(), //
         summary.getTotalTargets(), //
         ruleHits, //
         ruleHitsNonzero, //
         summary.getUnclassified(), //
         summary.getFallbackMime(), //
         priorityOptimization, //
         new Summary( //
            summary.getScanned(), //
            summary.getIgnored(), //
            summary.getMatched(), //
            summary.getPlannedMoves(), //
            summary.getMoved(), //
            summary.getCollisions(), //
            summary.getErrors(), //
            summary.getRulesUsed()));
   }

   public String toJson() throws IOException {
      return JSON.writeValueAsString(this);
   }

   /**
    * Writes the report as pretty printed JSON, missing parent directories are created.
    */
   public void write(final Path file) throws IOException {
      final var parent = file.toAbsolutePath().getParent();
      if (parent != null) {
         Files.createDirectories(parent);
      }
      Files.writeString(file, toJson());
   }
}
