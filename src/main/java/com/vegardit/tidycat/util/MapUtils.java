/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

/**
 * Lenient accessors for loosely typed maps as produced by the YAML parser.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class MapUtils {

   private static <T> @Nullable Object getValue(final Map<T, ?> map, final T key, final boolean remove) {
      return remove ? map.remove(key) : map.get(key);
   }

   public static @Nullable <T> Boolean getBoolean(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null; // CHECKSTYLE:IGNORE .*
      if (value instanceof final Boolean b)
         return b;
      return Boolean.parseBoolean(value.toString());
   }

   public static @Nullable <T> Integer getInteger(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof final Number n)
         return n.intValue();
      try {
         return Integer.parseInt(value.toString().strip());
      } catch (final NumberFormatException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as integer. " + ex
            .getMessage(), ex);
      }
   }

   public static @Nullable <T> Path getPath(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      try {
         return Path.of(value.toString());
      } catch (final InvalidPathException ex) {
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as path. " + ex.getMessage(),
            ex);
      }
   }

   public static @Nullable <T> String getString(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof Map || value instanceof List)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a string.");
      return value.toString();
   }

   /**
    * @return the value as list of strings, a single scalar value is treated as a one element list
    */
   public static @Nullable <T> List<String> getStringList(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof final List<?> list) {
         final var result = new ArrayList<String>(list.size());
         for (final var item : list) {
            if (item != null) {
               result.add(item.toString());
            }
         }
         return result;
      }
      if (value instanceof Map)
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list.");
      return List.of(value.toString());
   }

   /**
    * @return the value as insertion ordered map with string keys
    */
   public static @Nullable <T> Map<String, Object> getMap(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (value instanceof final Map<?, ?> valueMap) {
         final var result = new LinkedHashMap<String, Object>();
         valueMap.forEach((k, v) -> result.put(String.valueOf(k), v));
         return result;
      }
      throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a map.");
   }

   /**
    * @return the value as list of maps with string keys
    */
   public static @Nullable <T> List<Map<String, Object>> getMapList(final Map<T, ?> map, final T key, final boolean remove) {
      final var value = getValue(map, key, remove);
      if (value == null)
         return null;
      if (!(value instanceof final List<?> list))
         throw new IllegalArgumentException("Cannot parse attribute [" + key + "] with value [" + value + "] as a list.");

      final var result = new ArrayList<Map<String, Object>>(list.size());
      for (final var item : list) {
         if (!(item instanceof final Map<?, ?> itemMap))
            throw new IllegalArgumentException("Cannot parse entry [" + item + "] of attribute [" + key + "] as a map.");
         final var entry = new LinkedHashMap<String, Object>();
         itemMap.forEach((k, v) -> entry.put(String.valueOf(k), v));
         result.add(entry);
      }
      return result;
   }

   private MapUtils() {
   }
}
