/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

import static net.sf.jstuff.core.validation.NullAnalysisHelper.*;
import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
class TransactionStoreTest {

   @TempDir
   Path tempDir = lateNonNull();

   private Path source = lateNonNull();
   private Path destination = lateNonNull();
   private TransactionStore store = lateNonNull();

   @BeforeEach
   void setUp() throws IOException {
      source = Files.createDirectories(tempDir.resolve("Downloads"));
      destination = Files.createDirectories(tempDir.resolve("Downloads/Documents/PDF"));
      store = new TransactionStore(tempDir.resolve("undos"));
   }

   private TransactionRecord moveAndRecord(final String fileName) throws IOException {
      final var from = source.resolve(fileName);
      final var to = destination.resolve(fileName);
      Files.writeString(to, fileName);
      return store.write(source, destination, List.of(new MoveRecord(from.toString(), to.toString(), "pdf_documents")), List.of());
   }

   @Test
   void testNewTransactionId() {
      assertThat(TransactionStore.newTransactionId()).matches("\\d{8}-\\d{6}-[0-9a-f]{8}");
   }

   @Test
   void testWriteAndList() throws IOException {
      assertThat(store.list()).isEmpty();

      final var record = moveAndRecord("doc.pdf");
      assertThat(record.file).isEqualTo(tempDir.resolve("undos").resolve(record.id + ".json"));
      assertThat(asNonNull(record.file)).exists();

      final var json = Files.readString(asNonNull(record.file));
      assertThat(json).contains("\"source_dir\"", "\"destination_dir\"", "\"moves\"", "\"rule_id\" : \"pdf_documents\"",
         "\"undone_at\" : null");

      final var records = store.list();
      assertThat(records).hasSize(1);
      final var loaded = records.get(0);
      assertThat(loaded.id).isEqualTo(record.id);
      assertThat(loaded.getMoveCount()).isEqualTo(1);
      assertThat(loaded.isUndone()).isFalse();
      assertThat(loaded.getCreatedAtInstant()).isNotNull();
   }

   @Test
   void testListSkipsUnreadableFilesAndSortsNewestFirst() throws IOException {
      final var undoDir = Files.createDirectories(tempDir.resolve("undos"));
      Files.writeString(undoDir.resolve("broken.json"), "{ not json");
      Files.writeString(undoDir.resolve("no-id.json"), "{\"created_at\": \"2024-01-01T00:00:00Z\"}");
      Files.writeString(undoDir.resolve("old.json"), """
         {"id": "old", "created_at": "2024-01-01T00:00:00Z", "moves": []}""");
      Files.writeString(undoDir.resolve("new.json"), """
         {"id": "new", "created_at": "2024-02-01T00:00:00", "moves": [], "extra": 1}""");
      Files.writeString(undoDir.resolve("bad-moves.json"), """
         {"id": "bad", "created_at": "2024-03-01T00:00:00Z", "moves": "oops"}""");

      final var records = store.list();
      assertThat(records).extracting(r -> r.id).containsExactly("bad", "new", "old");
      assertThat(records.get(0).movesMalformed).isTrue();
      assertThat(records.get(1).movesMalformed).isFalse();
   }

   @Test
   void testMalformedRecordBlocksUndo() throws IOException, UndoException {
      final var valid = moveAndRecord("doc.pdf");
      Files.writeString(tempDir.resolve("undos/29990101-000000-deadbeef.json"), """
         {"id": "29990101-000000-deadbeef", "created_at": "2999-01-01T00:00:00Z", "moves": "not-a-list"}""");

      // the latest pending record is the malformed one, older records are not undone instead
      final var latest = store.pick(null);
      assertThat(latest.id).isEqualTo("29990101-000000-deadbeef");
      assertThat(latest.getMoveCount()).isZero();
      assertThatThrownBy(() -> store.undo(latest, true)).isInstanceOf(UndoException.class).hasMessageContaining("malformed");
      assertThatThrownBy(() -> store.undo(store.pick("29990101-000000-deadbeef"), false)) //
         .isInstanceOf(UndoException.class) //
         .hasMessageContaining("malformed");

      assertThat(destination.resolve("doc.pdf")).exists();
      assertThat(store.pick(valid.id).isUndone()).isFalse();
   }

   @Test
   void testMalformedEntriesAreCountedAsErrors() throws IOException, UndoException {
      final var to = Files.writeString(destination.resolve("ok.pdf"), "ok");
      final var json = TransactionStore.JSON.createObjectNode() //
         .put("id", "mixed") //
         .put("created_at", Instant.now().toString());
      final var moves = json.putArray("moves");
      moves.add("not-an-object");
      moves.addObject().put("from", source.resolve("ok.pdf").toString()).put("to", to.toString());
      moves.addObject().putObject("from");
      Files.createDirectories(tempDir.resolve("undos"));
      Files.writeString(tempDir.resolve("undos/mixed.json"), json.toString());

      final var record = store.pick("mixed");
      assertThat(record.movesMalformed).isFalse();
      assertThat(record.getMoveCount()).isEqualTo(3);

      final var result = store.undo(record, true);
      assertThat(result.getRestored()).isEqualTo(1);
      assertThat(result.getErrors()).isEqualTo(2);
      assertThat(source.resolve("ok.pdf")).hasContent("ok");
   }

   @Test
   void testPick() throws IOException, UndoException {
      assertThatThrownBy(() -> store.pick(null)).isInstanceOf(UndoException.class).hasMessageContaining("No pending undo record");

      final var record = moveAndRecord("doc.pdf");
      assertThat(store.pick(null).id).isEqualTo(record.id);
      assertThat(store.pick(record.id).id).isEqualTo(record.id);
      assertThatThrownBy(() -> store.pick("nope")).isInstanceOf(UndoException.class).hasMessageContaining("[nope] not found");

      store.markUndone(store.pick(record.id));
      assertThatThrownBy(() -> store.pick(null)).isInstanceOf(UndoException.class);
      assertThat(store.pick(record.id).isUndone()).isTrue();
   }

   @Test
   void testUndoDryRunAndApply() throws IOException, UndoException {
      final var record = moveAndRecord("doc.pdf");
      final var original = source.resolve("doc.pdf");
      final var moved = destination.resolve("doc.pdf");

      var result = store.undo(record, false);
      assertThat(result.getRestored()).isZero();
      assertThat(result.hasErrors()).isFalse();
      assertThat(moved).exists();
      assertThat(original).doesNotExist();

      result = store.undo(record, true);
      assertThat(result.getRestored()).isEqualTo(1);
      assertThat(result.getErrors()).isZero();
      assertThat(result.toString()).isEqualTo("restored=1 collisions=0 errors=0");
      assertThat(original).hasContent("doc.pdf");
      assertThat(moved).doesNotExist();

      store.markUndone(record);
      assertThatThrownBy(() -> store.undo(store.pick(record.id), true)) //
         .isInstanceOf(UndoException.class) //
         .hasMessageContaining("already undone");
   }

   @Test
   void testUndoHandlesCollisionsAndMissingFiles() throws IOException, UndoException {
      final var first = moveAndRecord("a.pdf");
      Files.writeString(source.resolve("a.pdf"), "newer download");

      var result = store.undo(first, true);
      assertThat(result.getRestored()).isEqualTo(1);
      assertThat(result.getCollisions()).isEqualTo(1);
      assertThat(source.resolve("a (1).pdf")).hasContent("a.pdf");
      assertThat(source.resolve("a.pdf")).hasContent("newer download");

      final var second = moveAndRecord("b.pdf");
      Files.delete(destination.resolve("b.pdf"));
      result = store.undo(second, true);
      assertThat(result.getRestored()).isZero();
      assertThat(result.getErrors()).isEqualTo(1);
   }

   @Test
   void testUndoRecreatesRemovedDirs() throws IOException, UndoException {
      final var removedDir = source.resolve("old/empty");
      final var to = Files.writeString(destination.resolve("c.pdf"), "c");
      final var record = store.write(source, destination, List.of(new MoveRecord(removedDir.resolve("c.pdf").toString(), to.toString(),
         "pdf_documents")), List.of(removedDir));

      final var result = store.undo(record, true);
      assertThat(result.hasErrors()).isFalse();
      assertThat(removedDir).isDirectory();
      assertThat(removedDir.resolve("c.pdf")).hasContent("c");
   }

   @Test
   void testUndoRejectsMalformedRecord() {
      final var record = new TransactionRecord();
      record.id = "broken";
      record.createdAt = Instant.now().toString();
      record.moves = null;
      assertThatThrownBy(() -> store.undo(record, false)).isInstanceOf(UndoException.class).hasMessageContaining("malformed");
   }

   @Test
   void testDelete() throws IOException {
      final var undoDir = Files.createDirectories(tempDir.resolve("undos"));
      final var oldCreatedAt = Instant.now().minus(Duration.ofDays(40)).toString();
      Files.writeString(undoDir.resolve("old.json"), "{\"id\": \"old\", \"created_at\": \"" + oldCreatedAt + "\", \"moves\": []}");
      final var recent = moveAndRecord("doc.pdf");

      assertThatIllegalArgumentException().isThrownBy(() -> store.delete(null, null, true));

      assertThat(store.delete(null, 30, false)).isEqualTo(1);
      assertThat(undoDir.resolve("old.json")).exists();

      assertThat(store.delete(null, 30, true)).isEqualTo(1);
      assertThat(undoDir.resolve("old.json")).doesNotExist();

      assertThat(store.delete("nope", null, true)).isZero();
      assertThat(store.delete(recent.id, null, true)).isEqualTo(1);
      assertThat(store.list()).isEmpty();
   }

   @Test
   void testParseTimestamp() {
      assertThat(TransactionRecord.parseTimestamp("2024-01-01T00:00:00Z")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
      assertThat(TransactionRecord.parseTimestamp("2024-01-01T01:00:00+01:00")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
      assertThat(TransactionRecord.parseTimestamp("2024-01-01T00:00:00")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
      assertThat(TransactionRecord.parseTimestamp("yesterday")).isNull();
      assertThat(TransactionRecord.parseTimestamp(null)).isNull();
   }
}
