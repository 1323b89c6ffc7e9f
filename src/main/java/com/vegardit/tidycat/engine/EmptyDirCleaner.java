/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Removes directories left empty after tidying.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class EmptyDirCleaner {

   private static final Logger LOG = Logger.create();

   /**
    * Removes empty directories below the given root bottom-up. The root itself and the subtrees of the excluded roots
    * are never touched. Symlinks are not followed.
    *
    * @return the removed directories in removal order
    */
   public static List<Path> removeEmptyDirs(final Path root, final Collection<Path> excludedRoots) throws IOException {
      return removeEmptyDirs(root, excludedRoots, dir -> false);
   }

   /**
    * Like {@link #removeEmptyDirs(Path, Collection)} but additionally leaves the subtrees of all directories alone that
    * are matched by <code>excludedDirs</code>.
    */
   public static List<Path> removeEmptyDirs(final Path root, final Collection<Path> excludedRoots, final Predicate<Path> excludedDirs)
         throws IOException {
      final var removed = new ArrayList<Path>();
      Files.walkFileTree(root, new SimpleFileVisitor<>() {

         @Override
         public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
            for (final var excluded : excludedRoots) {
               if (FileUtils.isSameOrUnder(dir, excluded))
                  return FileVisitResult.SKIP_SUBTREE;
            }
            if (!dir.equals(root) && excludedDirs.test(dir))
               return FileVisitResult.SKIP_SUBTREE;
            return FileVisitResult.CONTINUE;
         }

         @Override
         public FileVisitResult postVisitDirectory(final Path dir, final @Nullable IOException exc) {
            if (exc != null) {
               LOG.warn("Cannot list directory [%s]: %s", dir, exc.getMessage());
               return FileVisitResult.CONTINUE;
            }
            if (dir.equals(root))
               return FileVisitResult.CONTINUE;
            try {
               if (FileUtils.isEmptyDir(dir)) {
                  Files.delete(dir);
                  removed.add(dir);
                  LOG.info("REMOVE EMPTY DIR: %s", dir);
               }
            } catch (final IOException ex) {
               LOG.warn("Cannot remove directory [%s]: %s", dir, ex.getMessage());
            }
            return FileVisitResult.CONTINUE;
         }

         @Override
         public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
            LOG.warn("Cannot access [%s]: %s", file, exc.getMessage());
            return FileVisitResult.CONTINUE;
         }
      });
      return removed;
   }

   private EmptyDirCleaner() {
   }
}
