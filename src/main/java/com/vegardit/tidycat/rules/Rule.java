/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A named classification rule that moves matching items into a subfolder of the destination directory.
 *
 * @param id normalized identifier, unique within a rule set
 * @param subfolder relative target folder using <code>/</code> as separator
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record Rule( //
   String id, //
   String description, //
   String subfolder, //
   boolean enabled, //
   boolean builtIn, //
   MatchMode mode, //
   List<Condition> conditions //
) {

   public static final String CUSTOM_ID_PREFIX = "custom_";

   private static final Pattern NON_IDENTIFIER_CHARS = Pattern.compile("[^a-z0-9]+");

   /**
    * Lower-cases the given value and replaces each run of characters other than <code>[a-z0-9]</code> by a single
    * underscore. Leading and trailing underscores are removed.
    */
   public static String normalizeIdentifier(final String value) {
      final var id = NON_IDENTIFIER_CHARS.matcher(value.strip().toLowerCase(Locale.ROOT)).replaceAll("_");
      var start = 0;
      var end = id.length();
      while (start < end && id.charAt(start) == '_') {
         start++;
      }
      while (end > start && id.charAt(end - 1) == '_') {
         end--;
      }
      return id.substring(start, end);
   }

   /**
    * @throws IllegalArgumentException if the subfolder is empty after removing surrounding whitespace and slashes
    */
   public static String normalizeSubfolder(final String subfolder) {
      var cleaned = subfolder.strip();
      var start = 0;
      var end = cleaned.length();
      while (start < end && cleaned.charAt(start) == '/') {
         start++;
      }
      while (end > start && cleaned.charAt(end - 1) == '/') {
         end--;
      }
      cleaned = cleaned.substring(start, end);
      if (cleaned.isEmpty())
         throw new IllegalArgumentException("Subfolder cannot be empty.");
      for (final var segment : cleaned.split("/")) {
         if ("..".equals(segment.strip()))
            throw new IllegalArgumentException("Subfolder [" + subfolder + "] must not point outside of the destination.");
      }
      return cleaned;
   }

   public Rule {
      id = normalizeIdentifier(id);
      if (id.isEmpty())
         throw new IllegalArgumentException("Rule id cannot be empty.");
      description = description.strip();
      subfolder = normalizeSubfolder(subfolder);
      conditions = List.copyOf(conditions);
   }

   /**
    * @return the first path segment of the subfolder, e.g. <code>Images</code> for <code>Images/PNG</code>
    */
   public String topFolder() {
      final var slash = subfolder.indexOf('/');
      return slash < 0 ? subfolder : subfolder.substring(0, slash).strip();
   }

   public Rule withConditions(final List<Condition> newConditions) {
      return new Rule(id, description, subfolder, enabled, builtIn, mode, newConditions);
   }

   public Rule withEnabled(final boolean newEnabled) {
      return newEnabled == enabled ? this : new Rule(id, description, subfolder, newEnabled, builtIn, mode, conditions);
   }

   public Rule withSubfolder(final String newSubfolder) {
      return new Rule(id, description, newSubfolder, enabled, builtIn, mode, conditions);
   }
}
