/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.tidy;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.logging.Level;
import java.util.stream.Collectors;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.tidycat.command.AbstractCommand;
import com.vegardit.tidycat.engine.EmptyDirCleaner;
import com.vegardit.tidycat.engine.ItemScanner;
import com.vegardit.tidycat.engine.MoveExecutor;
import com.vegardit.tidycat.engine.MovePlanner;
import com.vegardit.tidycat.engine.StatsReport;
import com.vegardit.tidycat.engine.TagProbe;
import com.vegardit.tidycat.engine.XattrTagProbe;
import com.vegardit.tidycat.rules.EvaluationContext;
import com.vegardit.tidycat.rules.PriorityOptimizationReport;
import com.vegardit.tidycat.rules.PriorityOptimizer;
import com.vegardit.tidycat.rules.Rule;
import com.vegardit.tidycat.rules.RuleCatalog;
import com.vegardit.tidycat.undo.TransactionStore;
import com.vegardit.tidycat.util.FileUtils;
import com.vegardit.tidycat.util.JdkLoggingUtils;
import com.vegardit.tidycat.util.YamlUtils;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;

/**
 * Classifies the entries of a directory using the rule set and moves them into categorized subfolders.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "tidy", //
   description = "Sorts the files of a directory into categorized subfolders. Performs a dry run unless --apply is specified." //
)
public class TidyCommand extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   static final DateTimeFormatter DATED_FOLDER_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

   private final RuleCatalog catalog;
   final TidyCommandConfig cfgCLI = new TidyCommandConfig();
   private @Nullable Path configPath;
   private boolean apply;

   public TidyCommand() {
      this(RuleCatalog.BUILT_IN);
   }

   public TidyCommand(final RuleCatalog catalog) {
      this.catalog = catalog;
   }

   @Override
   protected int execute() throws Exception {
      final var cfg = cfgCLI;
      final var configPath = this.configPath;
      if (configPath != null) {
         LOG.info("Loading config [%s]...", configPath);
         cfg.applyFrom(TidyCommandConfig.load(configPath), false);
      }
      cfg.applyDefaults();
      cfg.compute(catalog);

      if (cfg.isExtraLogging()) {
         JdkLoggingUtils.ensureRootLogLevel(Level.FINE);
      }
      JdkLoggingUtils.withRootLogLevel(Level.INFO, () -> LOG.info("Effective tidy config:\n%s", YamlUtils.toYamlString(cfg)));
      LOG.info("MODE: %s", apply ? "@|bold,red APPLY|@" : "@|bold DRY-RUN|@");

      var rules = catalog.resolve(cfg.getRuleOverrides());
      final PriorityOptimizationReport optimization;
      if (Boolean.TRUE.equals(cfg.optimizePriority)) {
         final var optimized = PriorityOptimizer.optimize(rules);
         rules = optimized.rules();
         optimization = optimized.report();
         LOG.info("OPTIMIZE_PRIORITY enabled=%s changed=%s strategy=%s", optimization.enabled(), optimization.changed(), optimization
            .strategy());
         LOG.info("OPTIMIZE_ORDER before=%s", String.join(",", optimization.beforeOrder()));
         LOG.info("OPTIMIZE_ORDER after=%s", String.join(",", optimization.afterOrder()));
      } else {
         optimization = PriorityOptimizationReport.notApplied(rules);
      }
      LOG.debug("Active rules: %s", rules.stream().filter(Rule::enabled).map(Rule::id).collect(Collectors.joining(",")));

      final var sourceRoot = cfg.sourceRootAbsolute;
      final var destinationRoot = cfg.destinationRootAbsolute;
      final var runDestination = Boolean.TRUE.equals(cfg.createDatedTopFolder) //
            ? destinationRoot.resolve(LocalDateTime.now().format(DATED_FOLDER_FORMAT))
            : destinationRoot;
      if (!runDestination.equals(destinationRoot)) {
         LOG.info("Using dated destination folder [%s]", runDestination);
      }

      final var protectedRoots = new LinkedHashSet<>(MovePlanner.protectedRoots(sourceRoot, runDestination, rules));
      protectedRoots.addAll(MovePlanner.protectedRoots(sourceRoot, destinationRoot, rules));

      final var scanOptions = cfg.toScanOptions();
      scanOptions.protectedRoots.addAll(protectedRoots);
      final var scanner = new ItemScanner(scanOptions, scanOptions.isTagProbingRequired() //
            ? XattrTagProbe.forDirectory(sourceRoot)
            : TagProbe.NONE);

      LOG.info("Scanning [%s]...", sourceRoot);
      final var scan = scanner.scan(sourceRoot);
      final var plan = new MovePlanner(rules, EvaluationContext.now()).plan(scan, runDestination);
      final var summary = plan.summary();

      final var execution = new MoveExecutor(apply).execute(plan.moves());
      for (final var error : execution.errors()) {
         summary.onError(error.toString());
      }
      execution.moved().forEach(m -> summary.onMoved());

      final var removedDirs = new ArrayList<Path>();
      if (apply && Boolean.TRUE.equals(cfg.removeEmptyFolders)) {
         final var excluded = new ArrayList<>(protectedRoots);
         if (FileUtils.isSameOrUnder(destinationRoot, sourceRoot) && !destinationRoot.equals(sourceRoot)) {
            excluded.add(destinationRoot);
         }
         removedDirs.addAll(EmptyDirCleaner.removeEmptyDirs(sourceRoot, excluded, //
            dir -> scanOptions.isUntouchableDir(sourceRoot, dir)));
      }

      if (apply && !execution.moved().isEmpty()) {
         final var record = new TransactionStore(cfg.undoDirAbsolute).write(sourceRoot, runDestination, execution.moved(), removedDirs);
         LOG.info("UNDO RECORD: %s", record.file);
      }

      final var statsJson = cfg.statsJson;
      if (statsJson != null) {
         final var statsFile = FileUtils.toAbsolute(statsJson);
         try {
            StatsReport.create(summary, rules, sourceRoot, runDestination, apply, optimization).write(statsFile);
            LOG.info("STATS JSON: %s", statsFile);
         } catch (final IOException ex) {
            summary.onError("Cannot write stats report [" + statsFile + "]: " + ex.getMessage());
         }
      }

      summary.logStats(!apply, rules);
      return summary.hasErrors() ? EXIT_ERRORS : EXIT_OK;
   }

   @Option(names = "--apply", description = "Move the files. Without this option only a dry run is performed.")
   private void setApply(final boolean apply) {
      this.apply = apply;
   }

   @Option(names = "--config", paramLabel = "<path>", description = "Path to a YAML config file.")
   private void setConfig(final String configPath) {
      try {
         this.configPath = Path.of(configPath);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Config path: " + ex.getMessage());
      }
   }

   @Option(names = "--create-dated-top-folder", description = "Move files into a new folder named after the current date and time.")
   private void setCreateDatedTopFolder(final boolean createDatedTopFolder) {
      cfgCLI.createDatedTopFolder = createDatedTopFolder;
   }

   @Option(names = "--destination", paramLabel = "<path>", description = "Directory to move files to. Default: the source directory.")
   private void setDestination(final String destination) {
      cfgCLI.destination = toPath(destination, "Destination path");
   }

   @Option(names = "--extra-logging", description = "Log skip reasons and match decisions.")
   private void setExtraLogging(final boolean extraLogging) {
      cfgCLI.extraLogging = extraLogging;
   }

   @Option(names = "--ignore-aliases", description = "Don't process symlinks.")
   private void setIgnoreAliases(final boolean ignoreAliases) {
      cfgCLI.ignoreAliases = ignoreAliases;
   }

   @Option(names = "--ignore-ext", paramLabel = "<ext>", description = "Additional file extension to ignore, e.g. '.iso'.")
   private void setIgnoreExtensions(final List<String> ignoreExtensions) {
      cfgCLI.ignoreExtensions = ignoreExtensions;
   }

   @Option(names = "--ignore-folders", description = "Don't process directories, not even when --include-folders is specified.")
   private void setIgnoreFolders(final boolean ignoreFolders) {
      cfgCLI.ignoreFolders = ignoreFolders;
   }

   @Option(names = "--ignore-path", paramLabel = "<path>", description = "Relative path, name or absolute path to ignore.")
   private void setIgnorePaths(final List<String> ignorePaths) {
      cfgCLI.ignorePaths = ignorePaths;
   }

   @Option(names = "--ignore-tagged", description = "Don't process entries carrying a user tag.")
   private void setIgnoreTagged(final boolean ignoreTagged) {
      cfgCLI.ignoreTagged = ignoreTagged;
   }

   @Option(names = "--include-empty-folders", description = "Process empty directories.")
   private void setIncludeEmptyFolders(final boolean includeEmptyFolders) {
      cfgCLI.includeEmptyFolders = includeEmptyFolders;
   }

   @Option(names = "--include-folders", description = "Process top-level directories as items.")
   private void setIncludeFolders(final boolean includeFolders) {
      cfgCLI.includeFolders = includeFolders;
   }

   @Option(names = "--include-subfolders", description = "Recurse into subdirectories.")
   private void setIncludeSubfolders(final boolean includeSubfolders) {
      cfgCLI.includeSubfolders = includeSubfolders;
   }

   @Option(names = "--include-tagged", description = "Detect user tags so tag based rules can match.")
   private void setIncludeTagged(final boolean includeTagged) {
      cfgCLI.includeTagged = includeTagged;
   }

   @Option(names = "--optimize-priority", description = "Reorder the rules so that more specific rules are evaluated first.")
   private void setOptimizePriority(final boolean optimizePriority) {
      cfgCLI.optimizePriority = optimizePriority;
   }

   @Option(names = "--remove-empty-folders", description = "Remove directories left empty after moving files.")
   private void setRemoveEmptyFolders(final boolean removeEmptyFolders) {
      cfgCLI.removeEmptyFolders = removeEmptyFolders;
   }

   @Option(names = "--skip-bundles", negatable = true, description = "Skip application bundles like '*.app'. Enabled by default.")
   private void setSkipBundles(final boolean skipBundles) {
      cfgCLI.skipBundles = skipBundles;
   }

   @Parameters(index = "0", arity = "0..1", paramLabel = "SOURCE", description = "Directory to tidy up. Default: ~/Downloads")
   private void setSource(final String source) {
      cfgCLI.source = toPath(source, "Source path");
   }

   @Option(names = "--stats-json", paramLabel = "<path>", description = "Write a JSON report with statistics to the given file.")
   private void setStatsJson(final String statsJson) {
      cfgCLI.statsJson = toPath(statsJson, "Stats report path");
   }

   @Option(names = "--undo-dir", paramLabel = "<path>", description = "Directory holding the undo records. Default: ~/.tidycat/undos")
   private void setUndoDir(final String undoDir) {
      cfgCLI.undoDir = toPath(undoDir, "Undo directory");
   }

   private Path toPath(final String value, final String label) {
      try {
         return Path.of(value);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), label + ": " + ex.getMessage());
      }
   }
}
