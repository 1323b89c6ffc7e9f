/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.rules;

import static com.vegardit.tidycat.util.MapUtils.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.tidycat.util.YamlUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Converts the loosely typed <code>rules:</code> section of a config file into {@link RuleOverrides}.
 *
 * <pre>
 * rules:
 *   enable: [folders]
 *   disable: [Torrents]
 *   order: [pdf_documents, custom_invoices]
 *   extensions:
 *     plain_text: [txt, log]
 *   subfolders:
 *     videos: Media/Videos
 *   custom:
 *   - id: invoices
 *     subfolder: Finance/Invoices
 *     mode: all
 *     conditions:
 *     - type: name_contains
 *       value: [invoice, rechnung]
 *     - type: extension_any
 *       value: [pdf]
 * </pre>
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public final class RuleOverridesParser {

   private static final Logger LOG = Logger.create();

   /**
    * @throws IllegalArgumentException if the section contains unknown keys or invalid values
    */
   public static RuleOverrides parse(final @Nullable Map<String, Object> rulesSection, final RuleCatalog catalog) {
      final var overrides = new RuleOverrides();
      if (rulesSection == null || rulesSection.isEmpty())
         return overrides;

      final var cfg = new LinkedHashMap<>(rulesSection);

      final var customRules = getMapList(cfg, "custom", true);
      if (customRules != null) {
         var index = 0;
         for (final var customRule : customRules) {
            overrides.customRules.add(parseCustomRule(customRule, ++index));
         }
      }

      final var knownRules = new ArrayList<>(catalog.getRules());
      knownRules.addAll(overrides.customRules);
      final var aliases = RuleCatalog.aliasesOf(knownRules);

      final var enable = getStringList(cfg, "enable", true);
      if (enable != null) {
         for (final var ref : enable) {
            final var id = aliases.get(Rule.normalizeIdentifier(ref));
            if (id == null) {
               LOG.warn("Ignoring unknown rule [%s] listed in 'enable'.", ref);
            } else {
               overrides.enable.add(id);
            }
         }
      }

      final var disable = getStringList(cfg, "disable", true);
      if (disable != null) {
         for (final var ref : disable) {
            final var id = aliases.get(Rule.normalizeIdentifier(ref));
            if (id == null) {
               LOG.warn("Ignoring unknown rule [%s] listed in 'disable'.", ref);
            } else {
               overrides.disable.add(id);
            }
         }
      }

      final var order = getStringList(cfg, "order", true);
      if (order != null) {
         for (final var ref : order) {
            final var token = Rule.normalizeIdentifier(ref);
            if (!token.isEmpty()) {
               overrides.order.add(aliases.getOrDefault(token, token));
            }
         }
      }

      final var extensions = getMap(cfg, "extensions", true);
      if (extensions != null) {
         for (final var ref : List.copyOf(extensions.keySet())) {
            final var values = getStringList(extensions, ref, false);
            if (values == null)
               throw new IllegalArgumentException("Extensions of rule [" + ref + "] are not specified.");
            final var normalized = new ArrayList<String>(values.size());
            for (final var ext : values) {
               normalized.add(Extensions.normalize(ext));
            }
            final var token = Rule.normalizeIdentifier(ref);
            overrides.extensions.put(aliases.getOrDefault(token, token), List.copyOf(normalized));
         }
      }

      final var subfolders = getMap(cfg, "subfolders", true);
      if (subfolders != null) {
         for (final var ref : List.copyOf(subfolders.keySet())) {
            final var subfolder = getString(subfolders, ref, false);
            if (subfolder == null)
               throw new IllegalArgumentException("Subfolder of rule [" + ref + "] is not specified.");
            final var token = Rule.normalizeIdentifier(ref);
            overrides.subfolders.put(aliases.getOrDefault(token, token), Rule.normalizeSubfolder(subfolder));
         }
      }

      if (!cfg.isEmpty())
         throw new IllegalArgumentException("The following settings found in the 'rules' section of the config file are unknown:\n"
               + YamlUtils.toYamlString(cfg));
      return overrides;
   }

   /**
    * Parses a custom rule definition. Conditions are either given as an explicit <code>conditions</code> list or via
    * the shortcut keys <code>kind</code>, <code>name-contains</code>, <code>created-within-days</code>,
    * <code>size-gte</code>, <code>size-lte</code> and <code>extensions</code>.
    *
    * @param index 1-based position of the definition, used to derive an id if none is given
    */
   static Rule parseCustomRule(final Map<String, Object> definition, final int index) {
      final var cfg = new LinkedHashMap<>(definition);
      final var rawId = Objects.requireNonNullElse(getString(cfg, "id", true), "rule_" + index).strip();
      final var description = getString(cfg, "description", true);
      final var subfolder = getString(cfg, "subfolder", true);
      final var enabled = getBoolean(cfg, "enabled", true);
      final var mode = getString(cfg, "mode", true);

      final var conditions = new ArrayList<Condition>();
      final var conditionDefs = getMapList(cfg, "conditions", true);
      if (conditionDefs != null) {
         for (final var conditionDef : conditionDefs) {
            conditions.add(parseCondition(rawId, conditionDef));
         }
      }

      final var shortcuts = new ArrayList<Condition>();
      addShortcut(shortcuts, cfg, "kind", ConditionType.KIND);
      addShortcut(shortcuts, cfg, "name-contains", ConditionType.NAME_CONTAINS);
      addShortcut(shortcuts, cfg, "created-within-days", ConditionType.CREATED_WITHIN_DAYS);
      addShortcut(shortcuts, cfg, "size-gte", ConditionType.SIZE_GTE);
      addShortcut(shortcuts, cfg, "size-lte", ConditionType.SIZE_LTE);
      final var extensions = getStringList(cfg, "extensions", true);
      if (extensions != null) {
         shortcuts.add(Condition.extensionAny(extensions.toArray(String[]::new)));
      }

      if (!cfg.isEmpty())
         throw new IllegalArgumentException("The following settings of custom rule [" + rawId + "] are unknown:\n" + YamlUtils
            .toYamlString(cfg));
      if (!conditions.isEmpty() && !shortcuts.isEmpty())
         throw new IllegalArgumentException("Custom rule [" + rawId + "] cannot combine 'conditions' with shortcut condition keys.");
      conditions.addAll(shortcuts);
      if (conditions.isEmpty())
         throw new IllegalArgumentException("Custom rule [" + rawId + "] must define at least one condition.");

      try {
         return new Rule( //
            Rule.CUSTOM_ID_PREFIX + rawId, //
            description == null || description.isBlank() ? "Custom rule " + rawId : description, //
            subfolder == null || subfolder.isBlank() ? "Custom/" + rawId : subfolder, //
            enabled == null || enabled, //
            false, //
            mode == null ? MatchMode.ALL : MatchMode.parse(mode), //
            conditions);
      } catch (final IllegalArgumentException ex) {
         throw new IllegalArgumentException("Custom rule [" + rawId + "] is invalid: " + ex.getMessage(), ex);
      }
   }

   private static void addShortcut(final List<Condition> conditions, final Map<String, Object> cfg, final String key,
         final ConditionType type) {
      if (cfg.containsKey(key)) {
         conditions.add(Condition.of(type, cfg.remove(key)));
      }
   }

   private static Condition parseCondition(final String ruleId, final Map<String, Object> definition) {
      final var cfg = new LinkedHashMap<>(definition);
      final var type = getString(cfg, "type", true);
      if (type == null || type.isBlank())
         throw new IllegalArgumentException("Condition of custom rule [" + ruleId + "] has no 'type'.");
      if (!cfg.containsKey("value"))
         throw new IllegalArgumentException("Condition [" + type + "] of custom rule [" + ruleId + "] has no 'value'.");
      final var value = cfg.remove("value");
      if (!cfg.isEmpty())
         throw new IllegalArgumentException("The following settings of condition [" + type + "] of custom rule [" + ruleId
               + "] are unknown:\n" + YamlUtils.toYamlString(cfg));

      final var condition = Condition.of(type, value);
      if (condition.type() == ConditionType.UNKNOWN) {
         LOG.warn("Custom rule [%s] uses unknown condition type [%s] which never matches.", ruleId, type);
      }
      return condition;
   }

   private RuleOverridesParser() {
   }
}
