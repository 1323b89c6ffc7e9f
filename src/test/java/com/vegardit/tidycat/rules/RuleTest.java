/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class RuleTest {

   @Test
   void testNormalizeIdentifier() {
      assertThat(Rule.normalizeIdentifier("PDF Documents")).isEqualTo("pdf_documents");
      assertThat(Rule.normalizeIdentifier("  Documents/PDF ")).isEqualTo("documents_pdf");
      assertThat(Rule.normalizeIdentifier("__a--b__")).isEqualTo("a_b");
      assertThat(Rule.normalizeIdentifier("!!!")).isEmpty();
   }

   @Test
   void testNormalizeSubfolder() {
      assertThat(Rule.normalizeSubfolder(" /Images/PNG/ ")).isEqualTo("Images/PNG");
      assertThatIllegalArgumentException().isThrownBy(() -> Rule.normalizeSubfolder(" / "));
      assertThatIllegalArgumentException().isThrownBy(() -> Rule.normalizeSubfolder("../outside"));
      assertThatIllegalArgumentException().isThrownBy(() -> Rule.normalizeSubfolder("a/../../b"));
   }

   @Test
   void testConstructorNormalizes() {
      final var rule = new Rule("My Rule", " Mine ", "/Stuff/Mine/", true, false, MatchMode.ANY, List.of(Condition.extensionAny("x")));
      assertThat(rule.id()).isEqualTo("my_rule");
      assertThat(rule.description()).isEqualTo("Mine");
      assertThat(rule.subfolder()).isEqualTo("Stuff/Mine");
      assertThat(rule.topFolder()).isEqualTo("Stuff");

      assertThatIllegalArgumentException().isThrownBy(() -> new Rule("---", "x", "x", true, false, MatchMode.ALL, List.of()));
   }

   @Test
   void testWithers() {
      final var rule = new Rule("r", "R", "R", true, true, MatchMode.ALL, List.of(Condition.extensionAny("x")));
      assertThat(rule.withEnabled(true)).isSameAs(rule);
      assertThat(rule.withEnabled(false).enabled()).isFalse();
      assertThat(rule.withSubfolder("Other/Sub").topFolder()).isEqualTo("Other");
      assertThat(rule.withConditions(List.of()).conditions()).isEmpty();
   }
}
