/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

import org.eclipse.jdt.annotation.Nullable;

/**
 * The supported condition types. Each constant evaluates condition values of its type against an item.
 * <p>
 * Evaluation never throws: malformed values simply do not match.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public enum ConditionType {

   EXTENSION_ANY("extension_any") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         if (item.isDirectory())
            return false;
         try {
            return Extensions.matchesAny(item.name(), valuesOf(value));
         } catch (final IllegalArgumentException ex) {
            return false;
         }
      }
   },

   NAME_CONTAINS("name_contains") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var lowerName = item.lowerName();
         for (final var phrase : valuesOf(value)) {
            if (phrase == null) {
               continue;
            }
            final var lowerPhrase = phrase.toString().toLowerCase(Locale.ROOT);
            if (!lowerPhrase.isBlank() && lowerName.contains(lowerPhrase))
               return true;
         }
         return false;
      }
   },

   KIND("kind") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         if (!(value instanceof final String kindName))
            return false;
         final var kind = Rule.normalizeIdentifier(kindName);
         switch (kind) {
            case "folder":
               return item.isDirectory();
            case "alias":
            case "symlink":
               return item.isSymlink();
            default:
               final var extensions = ctx.kinds().getExtensions(kind);
               return extensions != null && !item.isDirectory() && Extensions.matchesAny(item.name(), extensions);
         }
      }
   },

   CREATED_WITHIN_DAYS("created_within_days") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var days = toDouble(value);
         if (days == null || days.isNaN())
            return false;
         final Instant cutoff;
         try {
            cutoff = ctx.referenceTime().minus(Duration.ofMillis((long) (days * Duration.ofDays(1).toMillis())));
         } catch (final ArithmeticException | DateTimeException ex) {
            // out of the representable time range
            return days > 0;
         }
         return !item.timestamp().isBefore(cutoff);
      }
   },

   SIZE_GTE("size_gte") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var threshold = toLong(value);
         return threshold != null && item.sizeBytes() >= threshold;
      }
   },

   SIZE_LTE("size_lte") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var threshold = toLong(value);
         return threshold != null && item.sizeBytes() <= threshold;
      }
   },

   IS_FOLDER("is_folder") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var expected = toBoolean(value);
         return expected != null && item.isDirectory() == expected;
      }
   },

   IS_ALIAS("is_alias") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var expected = toBoolean(value);
         return expected != null && item.isSymlink() == expected;
      }
   },

   HAS_TAG("has_tag") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         final var expected = toBoolean(value);
         return expected != null && item.hasTag() == expected;
      }
   },

   /**
    * Placeholder for condition types this version does not know. Never matches.
    */
   UNKNOWN("unknown") {
      @Override
      boolean evaluate(final @Nullable Object value, final Item item, final EvaluationContext ctx) {
         return false;
      }
   };

   public static ConditionType of(final String type) {
      final var id = Rule.normalizeIdentifier(type);
      for (final var candidate : values()) {
         if (candidate != UNKNOWN && candidate.id.equals(id))
            return candidate;
      }
      return UNKNOWN;
   }

   static List<?> valuesOf(final @Nullable Object value) {
      if (value == null)
         return List.of();
      if (value instanceof final List<?> list)
         return list;
      return List.of(value);
   }

   /**
    * @return null if the value is neither a boolean, a number nor the string <code>true</code> or <code>false</code>
    */
   private static @Nullable Boolean toBoolean(final @Nullable Object value) {
      if (value instanceof final Boolean b)
         return b;
      if (value instanceof final Number n)
         return n.doubleValue() != 0;
      if (value instanceof final String s) {
         final var str = s.strip();
         if ("true".equalsIgnoreCase(str))
            return Boolean.TRUE;
         if ("false".equalsIgnoreCase(str))
            return Boolean.FALSE;
      }
      return null;
   }

   private static @Nullable Double toDouble(final @Nullable Object value) {
      if (value instanceof final Number n)
         return n.doubleValue();
      if (value instanceof final String s) {
         try {
            return Double.valueOf(s.strip());
         } catch (final NumberFormatException ex) {
            return null;
         }
      }
      return null;
   }

   private static @Nullable Long toLong(final @Nullable Object value) {
      if (value instanceof Boolean)
         return null;
      if (value instanceof final Number n)
         return n.longValue();
      if (value instanceof final String s) {
         try {
            return Long.valueOf(s.strip());
         } catch (final NumberFormatException ex) {
            return null;
         }
      }
      return null;
   }

   private final String id;

   ConditionType(final String id) {
      this.id = id;
   }

   abstract boolean evaluate(@Nullable Object value, Item item, EvaluationContext ctx);

   /**
    * @return the identifier used for this type in configuration files
    */
   public String id() {
      return id;
   }
}
