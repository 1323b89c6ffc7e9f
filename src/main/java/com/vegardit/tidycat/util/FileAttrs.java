/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;

/**
 * Snapshot of the attributes of a file system entry read without following symlinks.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class FileAttrs {

   /**
    * Represents the type of a file system entry
    */
   public enum Type {
      BROKEN_SYMLINK,
      DIRECTORY,
      DIRECTORY_SYMLINK,
      FILE,
      FILE_SYMLINK,
      OTHER,
      OTHER_SYMLINK
   }

   public static FileAttrs get(final Path path) throws IOException {
      final var attrs = Files.readAttributes(path, BasicFileAttributes.class, FileUtils.NOFOLLOW_LINKS);
      return new FileAttrs(path, attrs);
   }

   private final BasicFileAttributes attrs;
   private final Type type;

   private FileAttrs(final Path path, final BasicFileAttributes attrs) {
      this.attrs = attrs;
      if (attrs.isSymbolicLink()) {
         Type resolvedType;
         try {
            // follow the link once to find out what it points to
            final var targetAttrs = Files.readAttributes(path, BasicFileAttributes.class);
            if (targetAttrs.isDirectory()) {
               resolvedType = Type.DIRECTORY_SYMLINK;
            } else if (targetAttrs.isRegularFile()) {
               resolvedType = Type.FILE_SYMLINK;
            } else {
               resolvedType = Type.OTHER_SYMLINK;
            }
         } catch (final NoSuchFileException | FileNotFoundException ex) {
            resolvedType = Type.BROKEN_SYMLINK;
         } catch (final SecurityException | IOException ex) {
            resolvedType = Type.FILE_SYMLINK;
         }
         type = resolvedType;
      } else if (attrs.isDirectory()) {
         type = Type.DIRECTORY;
      } else if (attrs.isRegularFile()) {
         type = Type.FILE;
      } else {
         type = Type.OTHER;
      }
   }

   /**
    * @return true for real directories and for symlinks pointing to directories
    */
   public boolean isDirLike() {
      return type == Type.DIRECTORY || type == Type.DIRECTORY_SYMLINK;
   }

   public boolean isDir() {
      return type == Type.DIRECTORY;
   }

   public boolean isSymlink() {
      return type == Type.BROKEN_SYMLINK || type == Type.DIRECTORY_SYMLINK || type == Type.FILE_SYMLINK || type == Type.OTHER_SYMLINK;
   }

   public FileTime lastModifiedTime() {
      return attrs.lastModifiedTime();
   }

   /**
    * @return the size in bytes, always 0 for directories
    */
   public long size() {
      return isDirLike() ? 0 : attrs.size();
   }

   public Type type() {
      return type;
   }
}
