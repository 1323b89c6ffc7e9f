/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.Collection;
import java.util.Locale;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Helpers for file name extensions. Extensions are handled in normalized form: lower-case with a leading dot, e.g.
 * <code>.tar.gz</code>.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class Extensions {

   /**
    * @throws IllegalArgumentException if the given extension is blank
    */
   public static String normalize(final String extension) {
      final var ext = extension.strip().toLowerCase(Locale.ROOT);
      if (ext.isEmpty())
         throw new IllegalArgumentException("Extension cannot be empty.");
      return ext.startsWith(".") ? ext : "." + ext;
   }

   /**
    * @return the normalized extension or null if the given value is null or blank
    */
   public static @Nullable String normalizeOrNull(final @Nullable Object extension) {
      if (extension == null)
         return null;
      final var str = extension.toString();
      return str.isBlank() ? null : normalize(str);
   }

   /**
    * @return the longest of the given extensions the file name ends with, or null if none matches
    */
   public static @Nullable String longestMatch(final String fileName, final Collection<?> extensions) {
      final var lowerName = fileName.toLowerCase(Locale.ROOT);
      String best = null;
      for (final var candidate : extensions) {
         final var ext = normalizeOrNull(candidate);
         if (ext != null && lowerName.endsWith(ext) && (best == null || ext.length() > best.length())) {
            best = ext;
         }
      }
      return best;
   }

   public static boolean matchesAny(final String fileName, final Collection<?> extensions) {
      return longestMatch(fileName, extensions) != null;
   }

   private Extensions() {
   }
}
