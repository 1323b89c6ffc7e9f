/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.command.tidy;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.lateNonNull;
import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vegardit.tidycat.LogCapture;
import com.vegardit.tidycat.TidyCatMain;
import com.vegardit.tidycat.command.AbstractCommand;

/**
 * End-to-end tests of the tidy and undo commands against temporary directories.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class TidyCommandTest {

   @TempDir
   Path tempDir = lateNonNull();

   private Path downloads = lateNonNull();
   private Path undoDir = lateNonNull();
   private Path statsFile = lateNonNull();

   private static int execute(final String... args) {
      return TidyCatMain.createCommandLine().execute(args);
   }

   private static List<Path> listFiles(final Path dir) throws IOException {
      if (!Files.isDirectory(dir))
         return List.of();
      try (Stream<Path> files = Files.list(dir)) {
         return files.toList();
      }
   }

   private JsonNode readStats() throws IOException {
      return new ObjectMapper().readTree(statsFile.toFile());
   }

   @BeforeEach
   void setUp() throws IOException {
      downloads = Files.createDirectories(tempDir.resolve("Downloads"));
      undoDir = tempDir.resolve("undos");
      statsFile = tempDir.resolve("stats.json");
      Files.writeString(downloads.resolve("doc.pdf"), "pdf");
      Files.writeString(downloads.resolve("video.mp4.part"), "partial");
      Files.writeString(downloads.resolve("unknown.xyz"), "?");
   }

   @Test
   void testDryRunDoesNotMutate() throws IOException {
      final var exitCode = execute("tidy", downloads.toString(), "--undo-dir", undoDir.toString(), "--stats-json", statsFile.toString());
      assertThat(exitCode).isEqualTo(AbstractCommand.EXIT_OK);

      assertThat(listFiles(downloads)).extracting(p -> p.getFileName().toString()) //
         .containsExactlyInAnyOrder("doc.pdf", "video.mp4.part", "unknown.xyz");
      assertThat(undoDir).doesNotExist();

      final var stats = readStats();
      assertThat(stats.get("mode").asText()).isEqualTo("dry-run");
      assertThat(stats.get("summary").get("scanned").asInt()).isEqualTo(2);
      assertThat(stats.get("summary").get("ignored").asInt()).isEqualTo(1);
      assertThat(stats.get("summary").get("matched").asInt()).isEqualTo(1);
      assertThat(stats.get("summary").get("planned_moves").asInt()).isEqualTo(1);
      assertThat(stats.get("summary").get("moved").asInt()).isZero();
      assertThat(stats.get("unclassified").asInt()).isEqualTo(1);
      assertThat(stats.get("rule_hits_nonzero").get("pdf_documents").asInt()).isEqualTo(1);

      // a second dry run yields the same plan
      final var firstSummary = stats.get("summary");
      assertThat(execute("tidy", downloads.toString(), "--undo-dir", undoDir.toString(), "--stats-json", statsFile.toString()))
         .isZero();
      assertThat(readStats().get("summary")).isEqualTo(firstSummary);
   }

   @Test
   void testApplyAndUndo() throws IOException {
      final var exitCode = execute("tidy", downloads.toString(), "--undo-dir", undoDir.toString(), "--apply", "--stats-json", statsFile
         .toString());
      assertThat(exitCode).isEqualTo(AbstractCommand.EXIT_OK);

      final var moved = downloads.resolve("Documents/PDF/doc.pdf");
      assertThat(moved).hasContent("pdf");
      assertThat(downloads.resolve("doc.pdf")).doesNotExist();
      assertThat(downloads.resolve("video.mp4.part")).exists();
      assertThat(downloads.resolve("unknown.xyz")).exists();
      assertThat(readStats().get("summary").get("moved").asInt()).isEqualTo(1);

      final var records = listFiles(undoDir);
      assertThat(records).hasSize(1);
      final var record = new ObjectMapper().readTree(records.get(0).toFile());
      assertThat(record.get("moves")).hasSize(1);
      assertThat(record.get("moves").get(0).get("to").asText()).isEqualTo(moved.toString());

      // the destination folders are not scanned again
      assertThat(execute("tidy", downloads.toString(), "--undo-dir", undoDir.toString(), "--apply")).isZero();
      assertThat(moved).exists();
      assertThat(listFiles(undoDir)).hasSize(1);

      // dry run undo
      assertThat(execute("undo", "--undo-dir", undoDir.toString())).isZero();
      assertThat(moved).exists();

      assertThat(execute("undo", "--undo-dir", undoDir.toString(), "--apply")).isZero();
      assertThat(downloads.resolve("doc.pdf")).hasContent("pdf");
      assertThat(moved).doesNotExist();
      assertThat(new ObjectMapper().readTree(records.get(0).toFile()).get("undone_at").isNull()).isFalse();

      // nothing left to undo
      assertThat(execute("undo", "--undo-dir", undoDir.toString(), "--apply")).isEqualTo(AbstractCommand.EXIT_FATAL);
      final var id = records.get(0).getFileName().toString().replace(".json", "");
      assertThat(execute("undo", "--undo-dir", undoDir.toString(), "--id", id, "--apply")).isEqualTo(AbstractCommand.EXIT_FATAL);
   }

   @Test
   void testSeparateDestinationWithDatedFolder() throws IOException {
      final var sorted = tempDir.resolve("sorted");
      assertThat(execute("tidy", downloads.toString(), "--destination", sorted.toString(), "--create-dated-top-folder", "--undo-dir",
         undoDir.toString(), "--apply")).isZero();

      final var datedFolders = listFiles(sorted);
      assertThat(datedFolders).hasSize(1);
      final var datedFolder = datedFolders.get(0);
      assertThat(datedFolder.getFileName().toString()).matches("\\d{4}-\\d{2}-\\d{2}_\\d{2}-\\d{2}-\\d{2}");
      assertThat(datedFolder.resolve("Documents/PDF/doc.pdf")).hasContent("pdf");
   }

   @Test
   void testDatedFolderIsNotCreatedInDryRun() {
      final var sorted = tempDir.resolve("sorted");
      assertThat(execute("tidy", downloads.toString(), "--destination", sorted.toString(), "--create-dated-top-folder", "--undo-dir",
         undoDir.toString())).isZero();
      assertThat(sorted).doesNotExist();
   }

   @Test
   void testRemoveEmptyFoldersAndUndoRecreatesThem() throws IOException {
      Files.createDirectories(downloads.resolve("nested/deeper"));
      Files.writeString(downloads.resolve("nested/deeper/report.pdf"), "report");

      assertThat(execute("tidy", downloads.toString(), "--include-subfolders", "--remove-empty-folders", "--undo-dir", undoDir
         .toString(), "--apply")).isZero();

      assertThat(downloads.resolve("nested")).doesNotExist();
      assertThat(downloads.resolve("Documents/PDF/report.pdf")).hasContent("report");
      assertThat(downloads.resolve("Documents/PDF/doc.pdf")).hasContent("pdf");

      final var record = new ObjectMapper().readTree(listFiles(undoDir).get(0).toFile());
      assertThat(record.get("removed_empty_dirs")).hasSize(2);

      assertThat(execute("undo", "--undo-dir", undoDir.toString(), "--apply")).isZero();
      assertThat(downloads.resolve("nested/deeper/report.pdf")).hasContent("report");
      assertThat(downloads.resolve("doc.pdf")).hasContent("pdf");
   }

   @Test
   void testRemoveEmptyFoldersKeepsIgnoredAndBundleDirs() throws IOException {
      final var ignoredDir = Files.createDirectories(downloads.resolve("Projects/empty"));
      final var bundle = Files.createDirectories(downloads.resolve("Editor.app/Contents"));
      Files.createDirectories(downloads.resolve("stale/empty"));

      assertThat(execute("tidy", downloads.toString(), "--include-subfolders", "--remove-empty-folders", "--ignore-path", "Projects",
         "--undo-dir", undoDir.toString(), "--apply")).isZero();

      assertThat(downloads.resolve("stale")).doesNotExist();
      assertThat(ignoredDir).isDirectory();
      assertThat(bundle).isDirectory();
   }

   @Test
   void testConfigFile() throws IOException {
      Files.writeString(downloads.resolve("invoice-42.pdf"), "invoice");
      Files.writeString(downloads.resolve("notes.txt"), "notes");
      final var config = Files.writeString(tempDir.resolve("tidycat.yaml"), """
         ignore-extensions: [.txt]
         rules:
           custom:
           - id: invoices
             subfolder: Finance/Invoices
             name-contains: invoice
           order: [custom_invoices]
           subfolders:
             PDF Documents: Papers
         """);

      try (var logs = new LogCapture()) {
         assertThat(execute("tidy", downloads.toString(), "--config", config.toString(), "--undo-dir", undoDir.toString(), "--apply"))
            .isZero();
         assertThat(logs.contains("Effective tidy config")).isTrue();
      }

      assertThat(downloads.resolve("Finance/Invoices/invoice-42.pdf")).hasContent("invoice");
      assertThat(downloads.resolve("Papers/doc.pdf")).hasContent("pdf");
      assertThat(downloads.resolve("notes.txt")).exists();
   }

   @Test
   void testOptimizePriorityIsLogged() {
      try (var logs = new LogCapture()) {
         assertThat(execute("tidy", downloads.toString(), "--undo-dir", undoDir.toString(), "--optimize-priority", "--stats-json",
            statsFile.toString())).isZero();
         assertThat(logs.contains("OPTIMIZE_PRIORITY enabled=true")).isTrue();
         assertThat(logs.contains("OPTIMIZE_ORDER before=")).isTrue();
      }
   }

   @Test
   void testFatalErrors() throws IOException {
      assertThat(execute("tidy", tempDir.resolve("missing").toString(), "--undo-dir", undoDir.toString())) //
         .isEqualTo(AbstractCommand.EXIT_FATAL);

      final var config = Files.writeString(tempDir.resolve("bad.yaml"), "colour: red\n");
      assertThat(execute("tidy", downloads.toString(), "--config", config.toString(), "--undo-dir", undoDir.toString())) //
         .isEqualTo(AbstractCommand.EXIT_FATAL);
      assertThat(execute("tidy", downloads.toString(), "--config", tempDir.resolve("missing.yaml").toString())) //
         .isEqualTo(AbstractCommand.EXIT_FATAL);

      assertThat(downloads.resolve("doc.pdf")).exists();
   }
}
