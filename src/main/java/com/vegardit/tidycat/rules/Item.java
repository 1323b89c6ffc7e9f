/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Locale;

/**
 * A file system entry that is a candidate for being moved.
 *
 * @param path absolute path of the entry
 * @param relativePath path relative to the scanned root directory
 * @param sizeBytes size of the entry, always 0 for directories
 * @param timestamp last modification time of the entry
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record Item( //
   Path path, //
   Path relativePath, //
   String name, //
   boolean isDirectory, //
   boolean isSymlink, //
   long sizeBytes, //
   Instant timestamp, //
   boolean hasTag //
) {

   public Item {
      if (isDirectory) {
         sizeBytes = 0;
      }
   }

   /**
    * @return number of parent directories between the scanned root and this entry
    */
   public int depth() {
      return relativePath.getNameCount() - 1;
   }

   public String lowerName() {
      return name.toLowerCase(Locale.ROOT);
   }
}
