/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.eclipse.jdt.annotation.Nullable;
import org.junit.jupiter.api.Test;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class ConditionTypeTest {

   private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
   private static final EvaluationContext CTX = new EvaluationContext(NOW, KindTable.DEFAULT);

   private static Item file(final String name) {
      return new Item(Path.of("/dl", name), Path.of(name), name, false, false, 1_000, NOW, false);
   }

   private static Item folder(final String name) {
      return new Item(Path.of("/dl", name), Path.of(name), name, true, false, 1_000, NOW, false);
   }

   private static boolean eval(final ConditionType type, final @Nullable Object value, final Item item) {
      return Condition.of(type, value).evaluate(item, CTX);
   }

   @Test
   void testOfNormalizesNames() {
      assertThat(ConditionType.of("extension_any")).isEqualTo(ConditionType.EXTENSION_ANY);
      assertThat(ConditionType.of("Name Contains")).isEqualTo(ConditionType.NAME_CONTAINS);
      assertThat(ConditionType.of("size-gte")).isEqualTo(ConditionType.SIZE_GTE);
      assertThat(ConditionType.of("mime_type")).isEqualTo(ConditionType.UNKNOWN);
      assertThat(ConditionType.of("unknown")).isEqualTo(ConditionType.UNKNOWN);
   }

   @Test
   void testExtensionAny() {
      assertThat(eval(ConditionType.EXTENSION_ANY, List.of("pdf"), file("Report.PDF"))).isTrue();
      assertThat(eval(ConditionType.EXTENSION_ANY, ".tar.gz", file("backup.tar.gz"))).isTrue();
      assertThat(eval(ConditionType.EXTENSION_ANY, List.of(".pdf"), file("report.pdf.txt"))).isFalse();
      assertThat(eval(ConditionType.EXTENSION_ANY, List.of(".pdf"), folder("x.pdf"))).isFalse();
      assertThat(eval(ConditionType.EXTENSION_ANY, List.of("  "), file("a.pdf"))).isFalse();
   }

   @Test
   void testNameContains() {
      assertThat(eval(ConditionType.NAME_CONTAINS, List.of("screenshot"), file("Screenshot 2025.png"))).isTrue();
      assertThat(eval(ConditionType.NAME_CONTAINS, "invoice", file("Invoice-42.pdf"))).isTrue();
      assertThat(eval(ConditionType.NAME_CONTAINS, List.of("", " "), file("anything.pdf"))).isFalse();
   }

   @Test
   void testKind() {
      assertThat(eval(ConditionType.KIND, "image", file("a.JPG"))).isTrue();
      assertThat(eval(ConditionType.KIND, "image", file("a.pdf"))).isFalse();
      assertThat(eval(ConditionType.KIND, "folder", folder("stuff"))).isTrue();
      assertThat(eval(ConditionType.KIND, "folder", file("stuff"))).isFalse();
      assertThat(eval(ConditionType.KIND, "alias", new Item(Path.of("/dl/l"), Path.of("l"), "l", false, true, 0, NOW, false)))
         .isTrue();
      assertThat(eval(ConditionType.KIND, "hologram", file("a.png"))).isFalse();
      assertThat(eval(ConditionType.KIND, List.of("image"), file("a.png"))).isFalse();
   }

   @Test
   void testCreatedWithinDays() {
      final var twoDaysOld = new Item(Path.of("/dl/a.txt"), Path.of("a.txt"), "a.txt", false, false, 1, NOW.minus(Duration.ofDays(2)),
         false);
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, 3, twoDaysOld)).isTrue();
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, "2.5", twoDaysOld)).isTrue();
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, 1, twoDaysOld)).isFalse();
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, "abc", twoDaysOld)).isFalse();
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, Double.NaN, twoDaysOld)).isFalse();
      assertThat(eval(ConditionType.CREATED_WITHIN_DAYS, 1e300, twoDaysOld)).isTrue();
   }

   @Test
   void testSizeThresholds() {
      final var item = file("a.bin");
      assertThat(eval(ConditionType.SIZE_GTE, 1_000, item)).isTrue();
      assertThat(eval(ConditionType.SIZE_GTE, "1001", item)).isFalse();
      assertThat(eval(ConditionType.SIZE_LTE, 1_000L, item)).isTrue();
      assertThat(eval(ConditionType.SIZE_LTE, 999, item)).isFalse();
      assertThat(eval(ConditionType.SIZE_GTE, true, item)).isFalse();
      assertThat(eval(ConditionType.SIZE_GTE, "big", item)).isFalse();

      // directories have no size
      assertThat(eval(ConditionType.SIZE_LTE, 0, folder("dir"))).isTrue();
   }

   @Test
   void testBooleanConditions() {
      assertThat(eval(ConditionType.IS_FOLDER, true, folder("dir"))).isTrue();
      assertThat(eval(ConditionType.IS_FOLDER, "true", file("a"))).isFalse();
      assertThat(eval(ConditionType.IS_FOLDER, false, file("a"))).isTrue();
      assertThat(eval(ConditionType.IS_ALIAS, 0, file("a"))).isTrue();
      final var tagged = new Item(Path.of("/dl/t.pdf"), Path.of("t.pdf"), "t.pdf", false, false, 1, NOW, true);
      assertThat(eval(ConditionType.HAS_TAG, 1, tagged)).isTrue();
      assertThat(eval(ConditionType.HAS_TAG, "yes", tagged)).isFalse();

      // values that are not booleans never match
      assertThat(eval(ConditionType.IS_FOLDER, "yes", file("a"))).isFalse();
      assertThat(eval(ConditionType.IS_FOLDER, "yes", folder("dir"))).isFalse();
      assertThat(eval(ConditionType.IS_FOLDER, null, file("a"))).isFalse();
      assertThat(eval(ConditionType.IS_ALIAS, "no", file("a"))).isFalse();
      assertThat(eval(ConditionType.HAS_TAG, List.of(true), tagged)).isFalse();
   }

   @Test
   void testUnknownNeverMatches() {
      final var condition = Condition.of("mime_type", "application/pdf");
      assertThat(condition.type()).isEqualTo(ConditionType.UNKNOWN);
      assertThat(condition.typeName()).isEqualTo("mime_type");
      assertThat(condition.evaluate(file("a.pdf"), CTX)).isFalse();
   }
}
