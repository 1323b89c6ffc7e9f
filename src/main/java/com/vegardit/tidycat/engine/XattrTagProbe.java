/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.Set;

import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Detects tags stored in extended file attributes: Finder tags on macOS and XDG tags on Linux desktops.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class XattrTagProbe implements TagProbe {

   private static final Logger LOG = Logger.create();

   static final Set<String> TAG_ATTRIBUTES = Set.of( //
      "com.apple.metadata:_kMDItemUserTags", //
      "xdg.tags" //
   );

   /**
    * @return an xattr based probe if the file store of the given directory supports user defined attributes, otherwise
    *         {@link TagProbe#NONE}
    */
   public static TagProbe forDirectory(final Path dir) {
      try {
         if (Files.getFileStore(dir).supportsFileAttributeView(UserDefinedFileAttributeView.class))
            return new XattrTagProbe();
      } catch (final IOException ex) {
         LOG.debug("Cannot determine file store of [%s]: %s", dir, ex.getMessage());
      }
      LOG.debug("Extended attributes are not supported for [%s], tags are not detected.", dir);
      return TagProbe.NONE;
   }

   @Override
   public boolean hasTag(final Path path) {
      final var view = Files.getFileAttributeView(path, UserDefinedFileAttributeView.class, FileUtils.NOFOLLOW_LINKS);
      if (view == null)
         return false;
      try {
         for (final var name : view.list()) {
            if (TAG_ATTRIBUTES.contains(name))
               return true;
         }
      } catch (final IOException | UnsupportedOperationException ex) {
         LOG.debug("Cannot read extended attributes of [%s]: %s", path, ex.getMessage());
      }
      return false;
   }
}
