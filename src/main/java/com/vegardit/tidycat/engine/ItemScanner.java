/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

import com.vegardit.tidycat.rules.Extensions;
import com.vegardit.tidycat.rules.Item;
import com.vegardit.tidycat.util.FileAttrs;
import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Enumerates the entries of a directory that are candidates for tidying.
 * <p>
 * Without {@link ScanOptions#includeSubfolders} only the direct children of the root are considered, otherwise the
 * whole tree is walked. Symlinked directories are never descended into. Children are visited in case-insensitive name
 * order.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class ItemScanner {

   private static final Logger LOG = Logger.create();

   private static final Comparator<Path> BY_NAME_IGNORE_CASE = Comparator //
      .comparing((final Path p) -> p.getFileName().toString().toLowerCase(Locale.ROOT)) //
      .thenComparing(p -> p.getFileName().toString());

   private final ScanOptions options;
   private final TagProbe tagProbe;

   private Path root = Path.of("");
   private List<Item> items = new ArrayList<>();
   private int ignored;

   public ItemScanner(final ScanOptions options, final TagProbe tagProbe) {
      this.options = options;
      this.tagProbe = tagProbe;
   }

   /**
    * @throws IllegalArgumentException if the given root is not an existing directory
    */
   public synchronized ScanResult scan(final Path root) throws IOException {
      final var rootAbsolute = FileUtils.toAbsolute(root);
      if (!Files.isDirectory(rootAbsolute))
         throw new IllegalArgumentException("Source path [" + root + "] is not a directory!");

      this.root = rootAbsolute;
      items = new ArrayList<>();
      ignored = 0;

      if (options.includeSubfolders) {
         scanRecursive(rootAbsolute);
      } else {
         scanTopLevel(rootAbsolute);
      }
      return new ScanResult(items, ignored);
   }

   private Item createItem(final Path path, final FileAttrs attrs) {
      final var hasTag = options.isTagProbingRequired() && tagProbe.hasTag(path);
      return new Item( //
         path, //
         root.relativize(path), //
         path.getFileName().toString(), //
         attrs.isDirLike(), //
         attrs.isSymlink(), //
         attrs.size(), //
         attrs.lastModifiedTime().toInstant(), //
         hasTag);
   }

   private boolean isBundle(final Path dir) {
      return options.isBundle(dir);
   }

   private boolean isIgnoredPath(final Path path) {
      for (final var protectedRoot : options.protectedRoots) {
         if (FileUtils.isSameOrUnder(path, protectedRoot)) {
            skip(path, "destination subtree");
            return true;
         }
      }
      if (options.isOnIgnoreList(root, path)) {
         skip(path, "ignore list");
         return true;
      }
      return false;
   }

   private List<Path> listChildren(final Path dir) throws IOException {
      final var children = new ArrayList<Path>();
      try (var entries = Files.newDirectoryStream(dir)) {
         entries.forEach(children::add);
      }
      children.sort(BY_NAME_IGNORE_CASE);
      return children;
   }

   /**
    * Applies the exclusion policy for non-directory entries.
    */
   private void offerFile(final Path file, final FileAttrs attrs) {
      if (options.ignoreAliases && attrs.isSymlink()) {
         skip(file, "alias");
         return;
      }
      final var item = createItem(file, attrs);
      if (options.ignoreTagged && item.hasTag()) {
         skip(file, "tagged");
         return;
      }
      if (Extensions.matchesAny(item.name(), options.ignoreExtensions)) {
         skip(file, "ignored extension");
         return;
      }
      items.add(item);
   }

   /**
    * Applies the exclusion policy for directory entries in recursive mode.
    */
   private void offerFolder(final Path dir, final FileAttrs attrs) throws IOException {
      if (!options.includeFolders)
         return;
      if (options.ignoreFolders) {
         skip(dir, "folder");
         return;
      }
      if (options.ignoreAliases && attrs.isSymlink()) {
         skip(dir, "alias");
         return;
      }
      if (options.includeEmptyFolders && !FileUtils.isEmptyDir(dir)) {
         LOG.debug("SKIP non-empty folder: %s", dir);
         return;
      }
      final var item = createItem(dir, attrs);
      if (options.ignoreTagged && item.hasTag()) {
         skip(dir, "tagged");
         return;
      }
      items.add(item);
   }

   private void scanRecursive(final Path dir) throws IOException {
      final var folders = new ArrayList<Path>();
      final var folderAttrs = new ArrayList<FileAttrs>();
      final var files = new ArrayList<Path>();
      final var fileAttrs = new ArrayList<FileAttrs>();

      for (final var child : listChildren(dir)) {
         final var attrs = FileAttrs.get(child);
         if (attrs.isDirLike()) {
            if (isIgnoredPath(child)) {
               continue;
            }
            if (isBundle(child)) {
               skip(child, "bundle");
               continue;
            }
            folders.add(child);
            folderAttrs.add(attrs);
         } else {
            files.add(child);
            fileAttrs.add(attrs);
         }
      }

      for (var i = 0; i < folders.size(); i++) {
         offerFolder(folders.get(i), folderAttrs.get(i));
      }
      for (var i = 0; i < files.size(); i++) {
         final var file = files.get(i);
         if (!isIgnoredPath(file)) {
            offerFile(file, fileAttrs.get(i));
         }
      }
      for (var i = 0; i < folders.size(); i++) {
         if (folderAttrs.get(i).isDir()) {
            scanRecursive(folders.get(i));
         }
      }
   }

   private void scanTopLevel(final Path dir) throws IOException {
      for (final var child : listChildren(dir)) {
         if (isIgnoredPath(child)) {
            continue;
         }
         final var attrs = FileAttrs.get(child);
         if (!attrs.isDirLike()) {
            offerFile(child, attrs);
            continue;
         }

         if (isBundle(child)) {
            skip(child, "bundle");
            continue;
         }
         if (!options.includeFolders || options.ignoreFolders) {
            skip(child, "folder");
            continue;
         }
         if (options.ignoreAliases && attrs.isSymlink()) {
            skip(child, "alias");
            continue;
         }
         if (options.includeEmptyFolders && !FileUtils.isEmptyDir(child)) {
            skip(child, "non-empty folder");
            continue;
         }
         final var item = createItem(child, attrs);
         if (options.ignoreTagged && item.hasTag()) {
            skip(child, "tagged");
            continue;
         }
         items.add(item);
      }
   }

   private void skip(final Path path, final String reason) {
      ignored++;
      LOG.debug("SKIP %s: %s", reason, path);
   }
}
