/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;

/**
 * Determines whether a file system entry carries user assigned tags, e.g. Finder tags on macOS.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@FunctionalInterface
public interface TagProbe {

   /**
    * Probe for platforms without tag support.
    */
   TagProbe NONE = path -> false;

   boolean hasTag(Path path);
}
