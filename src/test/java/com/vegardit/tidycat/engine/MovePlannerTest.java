/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.vegardit.tidycat.rules.Condition;
import com.vegardit.tidycat.rules.EvaluationContext;
import com.vegardit.tidycat.rules.Item;
import com.vegardit.tidycat.rules.KindTable;
import com.vegardit.tidycat.rules.MatchMode;
import com.vegardit.tidycat.rules.Rule;
import com.vegardit.tidycat.rules.RuleCatalog;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class MovePlannerTest {

   private static final EvaluationContext CTX = new EvaluationContext(Instant.now(), KindTable.DEFAULT);

   @TempDir
   Path tempDir = lateNonNull();

   private Item item(final String relativePath, final long size) {
      final var relative = Path.of(relativePath);
      return new Item(tempDir.resolve(relative), relative, relative.getFileName().toString(), false, false, size, CTX.referenceTime(),
         false);
   }

   @Test
   void testPlanClassifiesAndCounts() {
      final var scan = new ScanResult(List.of(item("doc.pdf", 100), item("unknown.xyz", 5), item("pic.png", 50)), 1);
      final var plan = new MovePlanner(RuleCatalog.BUILT_IN.getRules(), CTX).plan(scan, tempDir);

      assertThat(plan.moves()).extracting(MovePlan::destination).containsExactly( //
         tempDir.resolve("Images").resolve("PNG").resolve("pic.png"), //
         tempDir.resolve("Documents").resolve("PDF").resolve("doc.pdf"));
      assertThat(plan.moves()).extracting(MovePlan::ruleId).containsExactly("png_images", "pdf_documents");
      assertThat(plan.moves()).noneMatch(MovePlan::renamedForCollision);

      final var summary = plan.summary();
      assertThat(summary.getScanned()).isEqualTo(3);
      assertThat(summary.getIgnored()).isEqualTo(1);
      assertThat(summary.getMatched()).isEqualTo(2);
      assertThat(summary.getUnclassified()).isEqualTo(1);
      assertThat(summary.getPlannedMoves()).isEqualTo(2);
      assertThat(summary.getRuleHits()).containsEntry("png_images", 1).containsEntry("pdf_documents", 1);
      assertThat(summary.getRulesUsed()).isEqualTo(2);
      assertThat(summary.getMoved()).isZero();
   }

   @Test
   void testCollisionsGetNumberedAndDestinationsAreDistinct() throws IOException {
      Files.createDirectories(tempDir.resolve("Documents/PDF"));
      Files.writeString(tempDir.resolve("Documents/PDF/doc.pdf"), "existing");

      final var scan = new ScanResult(List.of(item("doc.pdf", 1), item("a/doc.pdf", 1), item("a/b/doc.pdf", 1)), 0);
      final var plan = new MovePlanner(RuleCatalog.BUILT_IN.getRules(), CTX).plan(scan, tempDir);

      final var pdfDir = tempDir.resolve("Documents").resolve("PDF");
      // deepest entries are planned first
      assertThat(plan.moves()).extracting(MovePlan::destination).containsExactly( //
         pdfDir.resolve("doc (1).pdf"), //
         pdfDir.resolve("doc (2).pdf"), //
         pdfDir.resolve("doc (3).pdf"));
      assertThat(plan.moves()).extracting(MovePlan::source).containsExactly( //
         tempDir.resolve("a/b/doc.pdf"), tempDir.resolve("a/doc.pdf"), tempDir.resolve("doc.pdf"));
      assertThat(plan.moves()).allMatch(MovePlan::renamedForCollision);
      assertThat(plan.summary().getCollisions()).isEqualTo(3);
      assertThat(new HashSet<>(plan.moves().stream().map(MovePlan::destination).toList())).hasSize(3);
   }

   @Test
   void testPlanIsRepeatable() {
      final var scan = new ScanResult(List.of(item("x.pdf", 1), item("y.pdf", 1), item("z.zip", 1)), 0);
      final var planner = new MovePlanner(RuleCatalog.BUILT_IN.getRules(), CTX);
      assertThat(planner.plan(scan, tempDir).moves()).isEqualTo(planner.plan(scan, tempDir).moves());
   }

   @Test
   void testProtectedRoots() {
      final var source = tempDir.resolve("src");
      final var rules = List.of( //
         new Rule("a", "A", "Docs/A", true, false, MatchMode.ALL, List.of(Condition.extensionAny("a"))), //
         new Rule("b", "B", "Docs/B", true, false, MatchMode.ALL, List.of(Condition.extensionAny("b"))), //
         new Rule("c", "C", "Off", false, false, MatchMode.ALL, List.of(Condition.extensionAny("c"))));

      assertThat(MovePlanner.protectedRoots(source, source, rules)).containsExactly(source.resolve("Docs"));
      assertThat(MovePlanner.protectedRoots(source, source.resolve("sorted"), rules)).containsExactly(source.resolve("sorted"));
      final var outside = tempDir.resolve("elsewhere");
      assertThat(MovePlanner.protectedRoots(source, outside, rules)).containsExactly(outside.resolve("Docs"));
   }
}
