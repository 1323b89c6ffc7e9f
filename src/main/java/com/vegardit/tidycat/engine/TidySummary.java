/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.time.DurationFormatUtils;

import com.vegardit.tidycat.rules.Rule;

import net.sf.jstuff.core.logging.Logger;

/**
 * Counters of a tidy run.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class TidySummary {
   private static final Logger LOG = Logger.create();

   /**
    * Id of a MIME type based catch-all rule. Hits of a rule with this id are reported as <code>fallback_mime</code>.
    */
   public static final String MIME_FALLBACK_RULE_ID = "mime_fallback";

   private int scanned;
   private int ignored;
   private int matched;
   private int fallbackMime;
   private final Map<String, Integer> ruleHits = new LinkedHashMap<>();
   private int plannedMoves;
   private long plannedBytes;
   private int moved;
   private int collisions;
   private final List<String> errors = new ArrayList<>();
   private final long startAt = System.currentTimeMillis();

   public int getCollisions() {
      return collisions;
   }

   public int getErrors() {
      return errors.size();
   }

   public List<String> getErrorMessages() {
      return Collections.unmodifiableList(errors);
   }

   public int getFallbackMime() {
      return fallbackMime;
   }

   public int getIgnored() {
      return ignored;
   }

   public int getMatched() {
      return matched;
   }

   public int getMoved() {
      return moved;
   }

   public int getPlannedMoves() {
      return plannedMoves;
   }

   public int getRuleHits(final String ruleId) {
      return ruleHits.getOrDefault(ruleId, 0);
   }

   /**
    * @return rule id -> hits of all rules with at least one hit
    */
   public Map<String, Integer> getRuleHits() {
      return Collections.unmodifiableMap(ruleHits);
   }

   /**
    * @return number of distinct rules that matched at least one item
    */
   public int getRulesUsed() {
      return ruleHits.size();
   }

   public int getScanned() {
      return scanned;
   }

   /**
    * @return number of candidates considered for matching, equals {@link #getScanned()}
    */
   public int getTotalTargets() {
      return scanned;
   }

   public int getUnclassified() {
      return scanned - matched;
   }

   public boolean hasErrors() {
      return !errors.isEmpty();
   }

   public void logStats(final boolean isDryRun, final List<Rule> rules) {
      if (!errors.isEmpty()) {
         LOG.warn("***************************************");
         LOG.warn("The following errors occurred:");
         for (final var error : errors) {
            LOG.error(error);
         }
      }
      LOG.info("***************************************");
      if (isDryRun) {
         LOG.info("DRY RUN: no changes were made. Use --apply to move the files.");
      }
      LOG.info("SUMMARY scanned=%d ignored=%d matched=%d planned=%d moved=%d collisions=%d errors=%d rules_used=%d", //
         scanned, ignored, matched, plannedMoves, moved, collisions, errors.size(), getRulesUsed());
      LOG.info("REPORT total_targets=%d unclassified=%d fallback_mime=%d", getTotalTargets(), getUnclassified(), fallbackMime);

      final var hits = rules.stream() //
         .filter(rule -> rule.enabled() && getRuleHits(rule.id()) > 0) //
         .map(rule -> rule.id() + ":" + getRuleHits(rule.id())) //
         .collect(Collectors.joining(", "));
      LOG.info("RULE_HITS %s", hits.isEmpty() ? "(none)" : hits);
      LOG.info(isDryRun ? "Size of files that would be moved: %s" : "Size of planned files: %s", //
         FileUtils.byteCountToDisplaySize(plannedBytes));
      LOG.info("Duration: %s", DurationFormatUtils.formatDurationWords(System.currentTimeMillis() - startAt, true, true));
      LOG.info("***************************************");
   }

   public void onCollision() {
      collisions++;
   }

   public void onError(final String message) {
      errors.add(message);
   }

   public void onIgnored(final int count) {
      ignored += count;
   }

   public void onMatched(final Rule rule) {
      matched++;
      ruleHits.merge(rule.id(), 1, Integer::sum);
      if (MIME_FALLBACK_RULE_ID.equals(rule.id())) {
         fallbackMime++;
      }
   }

   public void onMoved() {
      moved++;
   }

   public void onPlanned(final long sizeBytes) {
      plannedMoves++;
      plannedBytes += sizeBytes;
   }

   public void onScanned(final int count) {
      scanned += count;
   }
}
