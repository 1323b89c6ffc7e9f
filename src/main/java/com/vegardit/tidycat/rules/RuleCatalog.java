/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Immutable, ordered set of rules. A rule registered with an id that is already present replaces the earlier rule at
 * its position.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RuleCatalog {

   /**
    * The rules shipped with tidycat. <code>aliases</code> and <code>folders</code> are disabled by default.
    */
   public static final RuleCatalog BUILT_IN = new RuleCatalog(List.of( //
      builtIn("aliases", "Aliases", "Aliases", false, Condition.of(ConditionType.IS_ALIAS, true)), //
      builtIn("folders", "Folders", "Folders", false, Condition.of(ConditionType.IS_FOLDER, true)), //
      builtIn("screenshots", "Screenshots", "Screenshots", true, //
         Condition.of(ConditionType.KIND, "image"), //
         Condition.of(ConditionType.NAME_CONTAINS, List.of("screenshot", "screen shot", "スクリーンショット"))), //
      builtIn("png_images", "PNG Images", "Images/PNG", true, Condition.extensionAny(".png")), //
      builtIn("jpeg_images", "JPEG Images", "Images/JPEG", true, Condition.extensionAny(".jpg", ".jpeg")), //
      builtIn("gif_images", "GIF Images", "Images/GIF", true, Condition.extensionAny(".gif")), //
      builtIn("web_images", "Web Images", "Images/Web", true, Condition.extensionAny(".webp", ".svg", ".avif")), //
      builtIn("other_images", "Other Images", "Images/Other", true, //
         Condition.extensionAny(".bmp", ".heic", ".tif", ".tiff", ".ico", ".jfif")), //
      builtIn("pdf_documents", "PDF Documents", "Documents/PDF", true, Condition.extensionAny(".pdf")), //
      builtIn("word_documents", "Word Documents", "Documents/Word", true, //
         Condition.extensionAny(".doc", ".docx", ".odt", ".pages", ".rtf", ".epub")), //
      builtIn("plain_text", "Plain Text", "Documents/Text", true, Condition.extensionAny(".txt", ".text")), //
      builtIn("markdown", "Markdown", "Documents/Markdown", true, Condition.extensionAny(".md", ".markdown")), //
      builtIn("spreadsheets", "Spreadsheets", "Documents/Spreadsheets", true, //
         Condition.extensionAny(".xls", ".xlsx", ".csv", ".tsv", ".ods", ".numbers")), //
      builtIn("presentations", "Presentations", "Documents/Presentations", true, //
         Condition.extensionAny(".ppt", ".pptx", ".pps", ".ppsx", ".key", ".odp")), //
      builtIn("code", "Code", "Code", true, Condition.extensionAny(KindTable.CODE_EXTENSIONS.toArray(String[]::new))), //
      builtIn("audio", "Audio", "Audio", true, Condition.extensionAny(KindTable.AUDIO_EXTENSIONS.toArray(String[]::new))), //
      builtIn("videos", "Videos", "Videos", true, Condition.extensionAny(KindTable.VIDEO_EXTENSIONS.toArray(String[]::new))), //
      builtIn("archives", "Archives", "Archives", true, Condition.extensionAny(KindTable.ARCHIVE_EXTENSIONS.toArray(String[]::new))), //
      builtIn("disk_images", "Disk Images", "Disk Images", true, Condition.extensionAny(".dmg", ".iso", ".img")), //
      builtIn("installers", "Installers", "Installers", true, Condition.extensionAny(".pkg", ".msi", ".exe", ".deb", ".rpm", ".apk")), //
      builtIn("fonts", "Fonts", "Fonts", true, Condition.extensionAny(".ttf", ".ttc", ".otf", ".woff", ".woff2")), //
      builtIn("torrents", "Torrents", "Torrents", true, Condition.extensionAny(".torrent")) //
   ));

   private static Rule builtIn(final String id, final String description, final String subfolder, final boolean enabled,
         final Condition... conditions) {
      return new Rule(id, description, subfolder, enabled, true, MatchMode.ALL, List.of(conditions));
   }

   /**
    * Builds a lookup table from rule references to rule ids. A rule can be referenced by its id, its description or
    * its subfolder, each in normalized form. Ids take precedence over descriptions and subfolders.
    */
   public static Map<String, String> aliasesOf(final Collection<Rule> rules) {
      final var aliases = new HashMap<String, String>();
      for (final var rule : rules) {
         aliases.put(rule.id(), rule.id());
      }
      for (final var rule : rules) {
         aliases.putIfAbsent(Rule.normalizeIdentifier(rule.description()), rule.id());
         aliases.putIfAbsent(Rule.normalizeIdentifier(rule.subfolder()), rule.id());
      }
      aliases.remove("");
      return aliases;
   }

   private final List<Rule> rules;

   public RuleCatalog(final Collection<Rule> rules) {
      final var byId = new LinkedHashMap<String, Rule>();
      for (final var rule : rules) {
         byId.put(rule.id(), rule);
      }
      this.rules = List.copyOf(byId.values());
   }

   public Map<String, String> getAliases() {
      return aliasesOf(rules);
   }

   public List<Rule> getRules() {
      return rules;
   }

   public @Nullable Rule getRule(final String id) {
      for (final var rule : rules) {
         if (rule.id().equals(id))
            return rule;
      }
      return null;
   }

   /**
    * Derives the effective rule list by applying the given overrides to the rules of this catalog.
    * <p>
    * Custom rules are appended (or replace a rule with the same id in place), then subfolder and extension
    * substitutions and the enable/disable flags are applied, disable winning over enable. Finally the rules named in
    * the explicit order are moved to the front in that order, unknown and duplicate ids being ignored.
    */
   public List<Rule> resolve(final RuleOverrides overrides) {
      final var byId = new LinkedHashMap<String, Rule>();
      for (final var rule : rules) {
         byId.put(rule.id(), rule);
      }
      for (final var rule : overrides.customRules) {
         byId.put(rule.id(), rule);
      }

      final var resolved = new ArrayList<Rule>(byId.size());
      for (var rule : byId.values()) {
         final var subfolder = overrides.subfolders.get(rule.id());
         if (subfolder != null) {
            rule = rule.withSubfolder(subfolder);
         }
         final var extensions = overrides.extensions.get(rule.id());
         if (extensions != null) {
            rule = rule.withConditions(List.of(Condition.of(ConditionType.EXTENSION_ANY, extensions)));
         }
         if (overrides.enable.contains(rule.id())) {
            rule = rule.withEnabled(true);
         }
         if (overrides.disable.contains(rule.id())) {
            rule = rule.withEnabled(false);
         }
         resolved.add(rule);
      }

      if (overrides.order.isEmpty())
         return List.copyOf(resolved);

      final var ordered = new ArrayList<Rule>(resolved.size());
      final var used = new HashSet<String>();
      for (final var id : overrides.order) {
         final var rule = byIdIn(resolved, id);
         if (rule != null && used.add(id)) {
            ordered.add(rule);
         }
      }
      for (final var rule : resolved) {
         if (!used.contains(rule.id())) {
            ordered.add(rule);
         }
      }
      return List.copyOf(ordered);
   }

   private static @Nullable Rule byIdIn(final List<Rule> rules, final String id) {
      for (final var rule : rules) {
         if (rule.id().equals(id))
            return rule;
      }
      return null;
   }
}
