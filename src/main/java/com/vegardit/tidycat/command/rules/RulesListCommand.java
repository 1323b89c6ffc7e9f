/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.rules;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import org.eclipse.jdt.annotation.Nullable;

import com.vegardit.tidycat.command.AbstractCommand;
import com.vegardit.tidycat.command.tidy.TidyCommandConfig;
import com.vegardit.tidycat.rules.Rule;
import com.vegardit.tidycat.rules.RuleCatalog;
import com.vegardit.tidycat.rules.RuleOverrides;
import com.vegardit.tidycat.rules.RuleOverridesParser;

import net.sf.jstuff.core.logging.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;

/**
 * Lists the effective rule set in evaluation order.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
@Command(name = "rules-list", //
   description = "Lists the built-in and custom rules in evaluation order." //
)
public class RulesListCommand extends AbstractCommand {

   private static final Logger LOG = Logger.create();

   private final RuleCatalog catalog;
   private @Nullable Path configPath;

   public RulesListCommand() {
      this(RuleCatalog.BUILT_IN);
   }

   public RulesListCommand(final RuleCatalog catalog) {
      this.catalog = catalog;
   }

   @Override
   protected int execute() throws Exception {
      final var configPath = this.configPath;
      var overrides = new RuleOverrides();
      if (configPath != null) {
         LOG.info("Loading config [%s]...", configPath);
         overrides = RuleOverridesParser.parse(TidyCommandConfig.load(configPath).rules, catalog);
      }
      final var rules = catalog.resolve(overrides);

      final var builtIn = rules.stream().filter(Rule::builtIn).count();
      LOG.info("RULE COUNT: %d (built-in=%d custom=%d)", rules.size(), builtIn, rules.size() - builtIn);
      for (final var rule : rules) {
         LOG.info(String.format("%-16s %-3s %-8s %s :: %s", //
            rule.id(), //
            rule.enabled() ? "on" : "off", //
            rule.builtIn() ? "[lock]" : "[custom]", //
            rule.subfolder(), //
            rule.description()));
      }
      return EXIT_OK;
   }

   @Option(names = "--config", paramLabel = "<path>", description = "Path to a YAML config file with rule overrides.")
   private void setConfig(final String configPath) {
      try {
         this.configPath = Path.of(configPath);
      } catch (final InvalidPathException ex) {
         throw new ParameterException(commandSpec.commandLine(), "Config path: " + ex.getMessage());
      }
   }
}
