/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

import com.vegardit.tidycat.rules.EvaluationContext;
import com.vegardit.tidycat.rules.Item;
import com.vegardit.tidycat.rules.Rule;
import com.vegardit.tidycat.rules.RuleMatcher;
import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Turns scanned items into a list of conflict free moves.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class MovePlanner {

   private static final Logger LOG = Logger.create();

   /**
    * Deepest entries first so that the content of a folder is moved before the folder itself.
    */
   static final Comparator<Item> PROCESSING_ORDER = Comparator //
      .comparingInt(Item::depth) //
      .thenComparing(Item::lowerName) //
      .reversed();

   /**
    * Determines the folders below the source that must not be scanned because they receive tidied files.
    * <p>
    * If the destination lies inside the source, the whole destination is protected. Otherwise, e.g. when source and
    * destination are the same directory, the top-level target folder of every enabled rule is protected.
    */
   public static List<Path> protectedRoots(final Path sourceRoot, final Path destinationRoot, final List<Rule> rules) {
      final var roots = new LinkedHashSet<Path>();
      if (!destinationRoot.equals(sourceRoot) && destinationRoot.startsWith(sourceRoot)) {
         roots.add(destinationRoot);
      } else {
         for (final var rule : rules) {
            if (rule.enabled()) {
               roots.add(FileUtils.resolveRelative(destinationRoot, rule.topFolder()));
            }
         }
      }
      return List.copyOf(roots);
   }

   private final RuleMatcher matcher;

   public MovePlanner(final List<Rule> rules, final EvaluationContext ctx) {
      matcher = new RuleMatcher(rules, ctx);
   }

   /**
    * Only existence checks touch the file system.
    */
   public PlanResult plan(final ScanResult scan, final Path destinationRoot) {
      final var summary = new TidySummary();
      summary.onIgnored(scan.ignored());
      summary.onScanned(scan.items().size());

      final var candidates = new ArrayList<>(scan.items());
      candidates.sort(PROCESSING_ORDER);

      final var collisionResolver = new CollisionResolver();
      final var moves = new ArrayList<MovePlan>();
      for (final var item : candidates) {
         final var rule = matcher.match(item);
         if (rule == null) {
            LOG.debug("UNCLASSIFIED: %s", item.path());
            continue;
         }
         LOG.debug("MATCH [%s]: %s", rule.id(), item.path());
         summary.onMatched(rule);

         final var target = FileUtils.resolveRelative(destinationRoot, rule.subfolder()).resolve(item.name());
         final var resolution = collisionResolver.resolve(target);
         if (resolution.renamed()) {
            summary.onCollision();
            LOG.debug("COLLISION: %s -> %s", target, resolution.path());
         }
         summary.onPlanned(item.sizeBytes());
         moves.add(new MovePlan(item.path(), resolution.path(), rule.id(), rule.description(), resolution.renamed()));
      }
      return new PlanResult(moves, summary);
   }
}
