/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.apache.commons.lang3.CharUtils;
import org.eclipse.jdt.annotation.NonNull;

import net.sf.jstuff.core.Strings;
import net.sf.jstuff.core.SystemUtils;
import net.sf.jstuff.core.logging.Logger;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FileUtils {
   private static final Logger LOG = Logger.create();

   public static final @NonNull LinkOption[] NOFOLLOW_LINKS = {LinkOption.NOFOLLOW_LINKS};

   /**
    * @return true if the given path exists, symlinks are not followed so a dangling symlink also counts as existing
    */
   public static boolean exists(final Path path) {
      return Files.exists(path, NOFOLLOW_LINKS);
   }

   /**
    * @return true if the given path is a directory without any entries
    */
   public static boolean isEmptyDir(final Path dir) throws IOException {
      try (var entries = Files.newDirectoryStream(dir)) {
         return !entries.iterator().hasNext();
      }
   }

   /**
    * @return true if <code>path</code> equals <code>root</code> or is located somewhere below it
    */
   public static boolean isSameOrUnder(final Path path, final Path root) {
      return path.equals(root) || path.startsWith(root);
   }

   public static boolean isWritable(final Path path) {
      // Files.isWritable(targetRoot) seems to always return false SMB network shares
      return path.toFile().canWrite();
   }

   /**
    * Moves the given file system entry. An atomic rename is attempted first, if the target is located on a
    * different file store a regular move (copy + delete) is performed instead. Existing targets are never replaced.
    */
   public static void move(final Path source, final Path target) throws IOException {
      // an atomic rename silently replaces existing files on POSIX systems
      if (exists(target))
         throw new FileAlreadyExistsException(target.toString());
      try {
         Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
      } catch (final AtomicMoveNotSupportedException ex) {
         LOG.debug("Atomic move of [%s] not supported, falling back to regular move...", source);
         Files.move(source, target, LinkOption.NOFOLLOW_LINKS);
      }
   }

   /**
    * Resolves a relative path using <code>/</code> as separator against the given directory.
    */
   public static Path resolveRelative(final Path dir, final String relativePath) {
      var result = dir;
      for (final var segment : relativePath.split("/")) {
         if (!segment.isBlank()) {
            result = result.resolve(segment.strip());
         }
      }
      return result.normalize();
   }

   /**
    * Converts the given path into a normalized absolute path, a leading <code>~</code> is expanded to the user's home
    * directory.
    */
   public static Path toAbsolute(Path path) {
      final var pathStr = path.toString();
      if ("~".equals(pathStr)) {
         path = Path.of(System.getProperty("user.home"));
      } else if (pathStr.startsWith("~/") || pathStr.startsWith("~\\")) {
         path = Path.of(System.getProperty("user.home"), pathStr.substring(2));
      }
      path = path.toAbsolutePath().normalize();

      if (SystemUtils.IS_OS_WINDOWS) {
         // ensure drive letter is uppercase
         final var absolutePathStr = path.toString();
         if (!CharUtils.isAsciiAlphaUpper(absolutePathStr.charAt(0)))
            return Path.of(Strings.capitalize(absolutePathStr));
      }
      return path;
   }

   private FileUtils() {
   }
}
