/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.eclipse.jdt.annotation.Nullable;

/**
 * A single predicate of a rule.
 *
 * @param typeName the type as configured, retained for unknown types
 * @param value a scalar value or a list of scalar values
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record Condition(ConditionType type, String typeName, @Nullable Object value) {

   public static Condition of(final String typeName, final @Nullable Object value) {
      return new Condition(ConditionType.of(typeName), Rule.normalizeIdentifier(typeName), value);
   }

   public static Condition of(final ConditionType type, final @Nullable Object value) {
      return new Condition(type, type.id(), value);
   }

   public static Condition extensionAny(final String... extensions) {
      final var normalized = new ArrayList<String>(extensions.length);
      for (final var ext : extensions) {
         normalized.add(Extensions.normalize(ext));
      }
      return of(ConditionType.EXTENSION_ANY, List.copyOf(normalized));
   }

   public Condition {
      if (value instanceof final List<?> list) {
         value = list.stream().filter(Objects::nonNull).toList();
      }
   }

   public boolean evaluate(final Item item, final EvaluationContext ctx) {
      return type.evaluate(value, item, ctx);
   }

   /**
    * @return the value as list, a scalar value is returned as a one element list
    */
   public List<?> values() {
      return ConditionType.valuesOf(value);
   }

   @Override
   public String toString() {
      return typeName + "=" + value;
   }
}
