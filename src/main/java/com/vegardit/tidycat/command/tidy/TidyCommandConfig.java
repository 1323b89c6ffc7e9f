/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.tidy;

import static com.vegardit.tidycat.util.MapUtils.*;
import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.tidycat.engine.ScanOptions;
import com.vegardit.tidycat.rules.Extensions;
import com.vegardit.tidycat.rules.RuleCatalog;
import com.vegardit.tidycat.rules.RuleOverrides;
import com.vegardit.tidycat.rules.RuleOverridesParser;
import com.vegardit.tidycat.util.FileUtils;
import com.vegardit.tidycat.util.YamlUtils;
import com.vegardit.tidycat.util.YamlUtils.ToYamlString;

import net.sf.jstuff.core.SystemUtils;

/**
 * Settings of a tidy run. Values are collected from the command line and the YAML config file, unset values fall back
 * to defaults.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class TidyCommandConfig {

   public static final Path DEFAULT_SOURCE = Path.of("~", "Downloads");
   public static final Path DEFAULT_UNDO_DIR = Path.of("~", ".tidycat", "undos");

   /**
    * Loads the given YAML config file.
    *
    * @throws IllegalArgumentException if the file contains unknown settings or invalid values
    */
   public static TidyCommandConfig load(final Path yamlFile) throws IOException {
      if (!Files.isRegularFile(yamlFile))
         throw new IllegalArgumentException("Config file [" + yamlFile + "] does not exist!");

      final var cfg = new TidyCommandConfig();
      final var unused = cfg.applyFrom(YamlUtils.parseYaml(yamlFile), true);
      if (!unused.isEmpty())
         throw new IllegalArgumentException("The following settings found in the config file are unknown:\n" + YamlUtils.toYamlString(
            unused));
      return cfg;
   }

   public @Nullable @ToYamlString(ignore = true) Path source;
   public @ToYamlString(name = "source") Path sourceRootAbsolute = lateNonNull(); // computed value

   public @Nullable @ToYamlString(ignore = true) Path destination;
   public @ToYamlString(name = "destination") Path destinationRootAbsolute = lateNonNull(); // computed value

   public @Nullable @ToYamlString(ignore = true) Path undoDir;
   public @ToYamlString(name = "undoDir") Path undoDirAbsolute = lateNonNull(); // computed value

   public @Nullable Path statsJson;

   public @Nullable Boolean includeSubfolders;
   public @Nullable Boolean includeFolders;
   public @Nullable Boolean includeEmptyFolders;
   public @Nullable Boolean includeTagged;
   public @Nullable Boolean ignoreTagged;
   public @Nullable Boolean ignoreAliases;
   public @Nullable Boolean ignoreFolders;
   public @Nullable Boolean skipBundles;
   public @Nullable Boolean removeEmptyFolders;
   public @Nullable Boolean createDatedTopFolder;
   public @Nullable Boolean optimizePriority;
   public @Nullable Boolean extraLogging;

   /**
    * Additional extensions to ignore. Values from different sources are merged.
    */
   public @Nullable List<String> ignoreExtensions;

   /**
    * Relative paths, names or absolute paths to ignore. Values from different sources are merged.
    */
   public @Nullable List<String> ignorePaths;

   /**
    * The raw <code>rules:</code> section of the config file.
    */
   public @Nullable Map<String, Object> rules;

   private @ToYamlString(ignore = true) RuleOverrides ruleOverrides = new RuleOverrides(); // computed value

   private static @Nullable List<String> merge(final @Nullable List<String> values, final @Nullable List<String> otherValues) {
      if (values == null)
         return otherValues;
      if (otherValues == null)
         return values;
      final var merged = new LinkedHashSet<>(values);
      merged.addAll(otherValues);
      return new ArrayList<>(merged);
   }

   /**
    * Applies default values to null settings
    */
   public void applyDefaults() {
      final var defaults = new TidyCommandConfig();
      defaults.source = DEFAULT_SOURCE;
      defaults.undoDir = DEFAULT_UNDO_DIR;
      defaults.includeSubfolders = false;
      defaults.includeFolders = false;
      defaults.includeEmptyFolders = false;
      defaults.includeTagged = false;
      defaults.ignoreTagged = false;
      defaults.ignoreAliases = false;
      defaults.ignoreFolders = false;
      defaults.skipBundles = true;
      defaults.removeEmptyFolders = false;
      defaults.createDatedTopFolder = false;
      defaults.optimizePriority = false;
      defaults.extraLogging = false;
      defaults.ignoreExtensions = Collections.emptyList();
      defaults.ignorePaths = Collections.emptyList();
      applyFrom(defaults, false);
   }

   /**
    * Applies all non-null settings from the given config object to this config object. The ignore lists are merged.
    */
   public void applyFrom(final @Nullable TidyCommandConfig other, final boolean override) {
      if (other == null)
         return;

      if (override && other.source != null || source == null) {
         source = other.source;
      }
      if (override && other.destination != null || destination == null) {
         destination = other.destination;
      }
      if (override && other.undoDir != null || undoDir == null) {
         undoDir = other.undoDir;
      }
      if (override && other.statsJson != null || statsJson == null) {
         statsJson = other.statsJson;
      }
      if (override && other.includeSubfolders != null || includeSubfolders == null) {
         includeSubfolders = other.includeSubfolders;
      }
      if (override && other.includeFolders != null || includeFolders == null) {
         includeFolders = other.includeFolders;
      }
      if (override && other.includeEmptyFolders != null || includeEmptyFolders == null) {
         includeEmptyFolders = other.includeEmptyFolders;
      }
      if (override && other.includeTagged != null || includeTagged == null) {
         includeTagged = other.includeTagged;
      }
      if (override && other.ignoreTagged != null || ignoreTagged == null) {
         ignoreTagged = other.ignoreTagged;
      }
      if (override && other.ignoreAliases != null || ignoreAliases == null) {
         ignoreAliases = other.ignoreAliases;
      }
      if (override && other.ignoreFolders != null || ignoreFolders == null) {
         ignoreFolders = other.ignoreFolders;
      }
      if (override && other.skipBundles != null || skipBundles == null) {
         skipBundles = other.skipBundles;
      }
      if (override && other.removeEmptyFolders != null || removeEmptyFolders == null) {
         removeEmptyFolders = other.removeEmptyFolders;
      }
      if (override && other.createDatedTopFolder != null || createDatedTopFolder == null) {
         createDatedTopFolder = other.createDatedTopFolder;
      }
      if (override && other.optimizePriority != null || optimizePriority == null) {
         optimizePriority = other.optimizePriority;
      }
      if (override && other.extraLogging != null || extraLogging == null) {
         extraLogging = other.extraLogging;
      }
      if (override && other.rules != null || rules == null) {
         rules = other.rules;
      }
      ignoreExtensions = merge(ignoreExtensions, other.ignoreExtensions);
      ignorePaths = merge(ignorePaths, other.ignorePaths);
   }

   /**
    * @return a map with any unused config parameters
    */
   public Map<String, Object> applyFrom(final @Nullable Map<String, Object> config, final boolean override) {
      if (config == null || config.isEmpty())
         return Collections.emptyMap();

      final var cfg = new LinkedHashMap<>(config);
      final var defaults = new TidyCommandConfig();
      defaults.source = getPath(cfg, "source", true);
      defaults.destination = getPath(cfg, "destination", true);
      defaults.undoDir = getPath(cfg, "undo-dir", true);
      defaults.statsJson = getPath(cfg, "stats-json", true);
      defaults.includeSubfolders = getBoolean(cfg, "include-subfolders", true);
      defaults.includeFolders = getBoolean(cfg, "include-folders", true);
      defaults.includeEmptyFolders = getBoolean(cfg, "include-empty-folders", true);
      defaults.includeTagged = getBoolean(cfg, "include-tagged", true);
      defaults.ignoreTagged = getBoolean(cfg, "ignore-tagged", true);
      defaults.ignoreAliases = getBoolean(cfg, "ignore-aliases", true);
      defaults.ignoreFolders = getBoolean(cfg, "ignore-folders", true);
      defaults.skipBundles = getBoolean(cfg, "skip-bundles", true);
      defaults.removeEmptyFolders = getBoolean(cfg, "remove-empty-folders", true);
      defaults.createDatedTopFolder = getBoolean(cfg, "create-dated-top-folder", true);
      defaults.optimizePriority = getBoolean(cfg, "optimize-priority", true);
      defaults.extraLogging = getBoolean(cfg, "extra-logging", true);
      defaults.ignoreExtensions = getStringList(cfg, "ignore-extensions", true);
      defaults.ignorePaths = getStringList(cfg, "ignore-paths", true);
      if (cfg.containsKey("rules")) {
         final var rulesSection = getMap(cfg, "rules", true);
         defaults.rules = rulesSection == null ? new LinkedHashMap<>() : rulesSection;
      }
      applyFrom(defaults, override);
      return cfg;
   }

   /**
    * Validates the settings and computes derived values.
    *
    * @throws IllegalArgumentException if a setting is invalid
    */
   public void compute(final RuleCatalog catalog) {
      final var source = this.source;
      if (source == null)
         throw new IllegalArgumentException("Source is not specified!");
      sourceRootAbsolute = FileUtils.toAbsolute(source);
      if (!Files.exists(sourceRootAbsolute))
         throw new IllegalArgumentException("Source path [" + source + "] does not exist!");
      if (!Files.isDirectory(sourceRootAbsolute))
         throw new IllegalArgumentException("Source path [" + source + "] is not a directory!");
      if (!Files.isReadable(sourceRootAbsolute))
         throw new IllegalArgumentException("Source path [" + source + "] is not readable by user [" + SystemUtils.USER_NAME + "]!");

      final var destination = this.destination;
      destinationRootAbsolute = destination == null ? sourceRootAbsolute : FileUtils.toAbsolute(destination);
      if (Files.exists(destinationRootAbsolute) && !Files.isDirectory(destinationRootAbsolute))
         throw new IllegalArgumentException("Destination path [" + destinationRootAbsolute + "] is not a directory!");
      if (Files.exists(destinationRootAbsolute) && !FileUtils.isWritable(destinationRootAbsolute))
         throw new IllegalArgumentException("Destination path [" + destinationRootAbsolute + "] is not writable by user ["
               + SystemUtils.USER_NAME + "]!");

      final var undoDir = this.undoDir;
      if (undoDir == null)
         throw new IllegalArgumentException("Undo directory is not specified!");
      undoDirAbsolute = FileUtils.toAbsolute(undoDir);
      if (Files.exists(undoDirAbsolute) && !Files.isDirectory(undoDirAbsolute))
         throw new IllegalArgumentException("Undo directory [" + undoDir + "] is not a directory!");

      final var ignoreExtensions = this.ignoreExtensions;
      if (ignoreExtensions != null) {
         for (final var ext : ignoreExtensions) {
            Extensions.normalize(ext);
         }
      }

      ruleOverrides = RuleOverridesParser.parse(rules, catalog);
   }

   public RuleOverrides getRuleOverrides() {
      return ruleOverrides;
   }

   public boolean isExtraLogging() {
      return Boolean.TRUE.equals(extraLogging);
   }

   /**
    * @return the scan options derived from this config, without protected roots
    */
   public ScanOptions toScanOptions() {
      final var options = new ScanOptions();
      options.includeSubfolders = Boolean.TRUE.equals(includeSubfolders);
      options.includeFolders = Boolean.TRUE.equals(includeFolders);
      options.includeEmptyFolders = Boolean.TRUE.equals(includeEmptyFolders);
      options.includeTagged = Boolean.TRUE.equals(includeTagged);
      options.ignoreTagged = Boolean.TRUE.equals(ignoreTagged);
      options.ignoreAliases = Boolean.TRUE.equals(ignoreAliases);
      options.ignoreFolders = Boolean.TRUE.equals(ignoreFolders);
      options.skipBundles = !Boolean.FALSE.equals(skipBundles);

      final var ignoreExtensions = this.ignoreExtensions;
      if (ignoreExtensions != null) {
         for (final var ext : ignoreExtensions) {
            options.ignoreExtensions.add(Extensions.normalize(ext));
         }
      }
      final var ignorePaths = this.ignorePaths;
      if (ignorePaths != null) {
         for (final var path : ignorePaths) {
            if (!path.isBlank()) {
               options.ignorePaths.add(ScanOptions.toIgnorePathToken(path));
            }
         }
      }
      return options;
   }
}
