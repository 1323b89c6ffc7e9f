/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.vegardit.tidycat.util.FileUtils;

/**
 * Hands out target paths that neither exist on disk nor were handed out before by the same resolver.
 * <p>
 * A colliding name is made unique by inserting <code>" (n)"</code> before its extension, e.g.
 * <code>doc.pdf</code> becomes <code>doc (1).pdf</code> and <code>backup.tar.gz</code> becomes
 * <code>backup (1).tar.gz</code>.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class CollisionResolver {

   static final List<String> COMPOUND_SUFFIXES = List.of(".tar.gz", ".tar.bz2", ".tar.xz", ".tar.zst");

   /**
    * @param renamed true if the path differs from the requested one
    */
   public record Resolution(Path path, boolean renamed) {
   }

   /**
    * Splits a file name into base name and extension suffix. The suffix is either a known compound suffix like
    * <code>.tar.gz</code> or the last extension. Names without extension and dot files have an empty suffix.
    *
    * @return a two element array of base name and suffix
    */
   static String[] splitBaseAndSuffix(final String fileName) {
      final var lowerName = fileName.toLowerCase(Locale.ROOT);
      for (final var compound : COMPOUND_SUFFIXES) {
         if (lowerName.endsWith(compound) && lowerName.length() > compound.length()) {
            final var split = fileName.length() - compound.length();
            return new String[] {fileName.substring(0, split), fileName.substring(split)};
         }
      }

      final var dot = fileName.lastIndexOf('.');
      if (dot <= 0 || dot == fileName.length() - 1)
         return new String[] {fileName, ""};
      return new String[] {fileName.substring(0, dot), fileName.substring(dot)};
   }

   private final Set<Path> claimed = new HashSet<>();

   private boolean isTaken(final Path path) {
      return claimed.contains(path) || FileUtils.exists(path);
   }

   /**
    * Returns a free path for the given target and claims it.
    */
   public Resolution resolve(final Path target) {
      if (!isTaken(target)) {
         claimed.add(target);
         return new Resolution(target, false);
      }

      final var baseAndSuffix = splitBaseAndSuffix(target.getFileName().toString());
      for (var index = 1;; index++) {
         final var candidate = target.resolveSibling(baseAndSuffix[0] + " (" + index + ")" + baseAndSuffix[1]);
         if (!isTaken(candidate)) {
            claimed.add(candidate);
            return new Resolution(candidate, true);
         }
      }
   }
}
