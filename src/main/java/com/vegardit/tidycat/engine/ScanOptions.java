/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.vegardit.tidycat.util.FileUtils;

/**
 * Inclusion and exclusion policy of the {@link ItemScanner}.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ScanOptions {

   /**
    * Extensions of incomplete downloads that are never touched.
    */
   public static final Set<String> DEFAULT_IGNORE_EXTENSIONS = Set.of( //
      ".crdownload", ".part", ".partial", ".download", ".opdownload", ".!qb", ".tmp");

   /**
    * Directory suffixes of macOS bundles that are treated as opaque.
    */
   public static final Set<String> BUNDLE_SUFFIXES = Set.of(".app", ".bundle", ".framework", ".plugin");

   public boolean includeSubfolders;
   public boolean includeFolders;

   /** with {@link #includeFolders}, only empty folders become candidates */
   public boolean includeEmptyFolders;
   public boolean includeTagged;
   public boolean ignoreTagged;
   public boolean ignoreAliases;
   public boolean ignoreFolders;
   public boolean skipBundles = true;

   /** normalized extensions */
   public final Set<String> ignoreExtensions = new LinkedHashSet<>(DEFAULT_IGNORE_EXTENSIONS);

   /** lower-cased tokens matched against the relative path, the file name or the absolute path */
   public final Set<String> ignorePaths = new LinkedHashSet<>();

   /** absolute paths whose subtrees are never scanned, e.g. the destination folders */
   public final List<Path> protectedRoots = new ArrayList<>();

   /**
    * @return the given path in the form used for ignore path matching
    */
   public static String toIgnorePathToken(final String path) {
      var token = path.strip().replace('\\', '/').toLowerCase(Locale.ROOT);
      while (token.length() > 1 && token.endsWith("/")) {
         token = token.substring(0, token.length() - 1);
      }
      return token;
   }

   /**
    * @return true if the given directory is an application bundle that is treated as opaque
    */
   public boolean isBundle(final Path dir) {
      if (!skipBundles)
         return false;
      final var name = dir.getFileName().toString().toLowerCase(Locale.ROOT);
      final var dot = name.lastIndexOf('.');
      return dot > 0 && BUNDLE_SUFFIXES.contains(name.substring(dot));
   }

   /**
    * @return true if the given path is listed in {@link #ignorePaths} by its path relative to the scan root, its name
    *         or its absolute path
    */
   public boolean isOnIgnoreList(final Path root, final Path path) {
      if (ignorePaths.isEmpty())
         return false;
      final var relative = toIgnorePathToken(root.relativize(path).toString());
      final var name = path.getFileName().toString().toLowerCase(Locale.ROOT);
      final var absolute = toIgnorePathToken(path.toString());
      return ignorePaths.contains(relative) || ignorePaths.contains(name) || ignorePaths.contains(absolute);
   }

   /**
    * @return true if the given directory below the scan root must not be modified, i.e. it is located in a protected
    *         root, is on the ignore list or is a skipped bundle
    */
   public boolean isUntouchableDir(final Path root, final Path dir) {
      for (final var protectedRoot : protectedRoots) {
         if (FileUtils.isSameOrUnder(dir, protectedRoot))
            return true;
      }
      return isOnIgnoreList(root, dir) || isBundle(dir);
   }

   /**
    * @return true if tag information needs to be read while scanning
    */
   public boolean isTagProbingRequired() {
      return includeTagged || ignoreTagged;
   }
}
