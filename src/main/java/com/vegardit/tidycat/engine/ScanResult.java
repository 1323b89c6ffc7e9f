/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.util.List;

import com.vegardit.tidycat.rules.Item;

/**
 * @param ignored number of entries skipped because of an exclusion policy
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record ScanResult(List<Item> items, int ignored) {

   public ScanResult {
      items = List.copyOf(items);
   }
}
