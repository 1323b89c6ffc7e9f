/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import org.eclipse.jdt.annotation.Nullable;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vegardit.tidycat.engine.CollisionResolver;
import com.vegardit.tidycat.util.FileUtils;

import net.sf.jstuff.core.logging.Logger;

/**
 * Directory based store of {@link TransactionRecord}s.
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public class TransactionStore {

   private static final Logger LOG = Logger.create();

   private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

   static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

   /**
    * Newest first. Records with unparseable creation time are sorted last.
    */
   static final Comparator<TransactionRecord> NEWEST_FIRST = Comparator //
      .comparing(TransactionRecord::getCreatedAtInstant, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())) //
      .thenComparing(r -> r.id) //
      .reversed();

   static String newTransactionId() {
      return LocalDateTime.now().format(ID_TIMESTAMP) + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
   }

   private final Path undoDir;

   public TransactionStore(final Path undoDir) {
      this.undoDir = undoDir;
   }

   /**
    * Deletes records by id and/or age.
    *
    * @param id if not null only the record with this id is deleted
    * @param olderThanDays if not null only records created more than the given number of days ago are deleted
    * @param apply if false nothing is deleted and only the matching records are counted
    * @return number of deleted (or in dry-run mode deletable) records
    */
   public int delete(final @Nullable String id, final @Nullable Integer olderThanDays, final boolean apply) throws IOException {
      if (id == null && olderThanDays == null)
         throw new IllegalArgumentException("Either a transaction id or an age threshold must be specified.");

      final var cutoff = olderThanDays == null ? null : Instant.now().minus(Duration.ofDays(olderThanDays));
      var count = 0;
      for (final var record : list()) {
         if (id != null && !id.equals(record.id)) {
            continue;
         }
         if (cutoff != null) {
            final var createdAt = record.getCreatedAtInstant();
            if (createdAt == null || !createdAt.isBefore(cutoff)) {
               continue;
            }
         }
         final var file = record.file;
         if (file == null || !FileUtils.exists(file)) {
            continue;
         }
         if (apply) {
            Files.delete(file);
            LOG.info("DELETE undo record [@|magenta %s|@]", record.id);
         } else {
            LOG.info("DRY-RUN DELETE undo record [@|magenta %s|@]", record.id);
         }
         count++;
      }
      return count;
   }

   public Path getUndoDir() {
      return undoDir;
   }

   /**
    * @return all readable records, newest first. Files that are no valid JSON or have no id are skipped with a warning.
    *         Records with a malformed list of moves are included so that undoing them fails.
    */
   public List<TransactionRecord> list() throws IOException {
      if (!Files.isDirectory(undoDir))
         return List.of();

      final var files = new ArrayList<Path>();
      try (var entries = Files.newDirectoryStream(undoDir, "*.json")) {
         entries.forEach(files::add);
      }
      files.sort(Comparator.naturalOrder());

      final var records = new ArrayList<TransactionRecord>(files.size());
      for (final var file : files) {
         final TransactionRecord record;
         try {
            record = JSON.readValue(file.toFile(), TransactionRecord.class);
         } catch (final IOException ex) {
            LOG.warn("Skipping unreadable undo record [%s]: %s", file, ex.getMessage());
            continue;
         }
         if (record == null || record.id == null || record.id.isBlank()) {
            LOG.warn("Skipping undo record [%s] without id.", file);
            continue;
         }
         record.file = file;
         records.add(record);
      }
      records.sort(NEWEST_FIRST);
      return records;
   }

   public void markUndone(final TransactionRecord record) throws IOException {
      record.undoneAt = Instant.now().toString();
      save(record);
   }

   /**
    * Selects the record to undo.
    *
    * @param id the id of the record or null for the latest record not undone yet
    */
   public TransactionRecord pick(final @Nullable String id) throws IOException, UndoException {
      final var records = list();
      if (id == null) {
         for (final var record : records) {
            if (!record.isUndone())
               return record;
         }
         throw new UndoException("No pending undo record found in [" + undoDir + "]!");
      }
      for (final var record : records) {
         if (id.equals(record.id))
            return record;
      }
      throw new UndoException("Undo record [" + id + "] not found in [" + undoDir + "]!");
   }

   private void save(final TransactionRecord record) throws IOException {
      var file = record.file;
      if (file == null) {
         file = record.file = undoDir.resolve(record.id + ".json");
      }
      Files.createDirectories(undoDir);
      JSON.writeValue(file.toFile(), record);
   }

   /**
    * Reverts the moves of the given record in reverse order. Entries whose recorded destination is missing are counted
    * as errors, the remaining entries are still processed. Directories removed during the tidy run are recreated.
    *
    * @param apply if false nothing is changed on disk and only the intended operations are logged
    * @throws UndoException if the record was already undone or is malformed
    */
   public UndoResult undo(final TransactionRecord record, final boolean apply) throws UndoException {
      if (record.isUndone())
         throw new UndoException("Undo record [" + record.id + "] was already undone at " + record.undoneAt + "!");
      final var moves = record.moves;
      if (moves == null || record.movesMalformed)
         throw new UndoException("Undo record [" + record.id + "] is malformed: moves must be a list!");

      final var result = new UndoResult();
      final var collisionResolver = new CollisionResolver();
      for (var i = moves.size() - 1; i >= 0; i--) {
         final var move = moves.get(i);
         final var from = move == null ? null : move.from();
         final var to = move == null ? null : move.to();
         if (from == null || from.isBlank() || to == null || to.isBlank()) {
            result.onError();
            LOG.error("UNDO entry #%d of record [%s] is malformed.", i + 1, record.id);
            continue;
         }

         final var source = Path.of(to);
         if (!FileUtils.exists(source)) {
            result.onError();
            LOG.error("UNDO source missing: %s", source);
            continue;
         }

         final var resolution = collisionResolver.resolve(Path.of(from));
         if (resolution.renamed()) {
            result.onCollision();
         }
         final var destination = resolution.path();
         if (!apply) {
            LOG.info("DRY-RUN UNDO: %s -> %s", source, destination);
            continue;
         }
         try {
            final var parent = destination.getParent();
            if (parent != null) {
               Files.createDirectories(parent);
            }
            FileUtils.move(source, destination);
            result.onRestored();
            LOG.info("UNDO MOVE: %s -> [@|magenta %s|@]", source, destination);
         } catch (final IOException ex) {
            result.onError();
            LOG.error("UNDO ERROR: %s -> %s (%s: %s)", source, destination, ex.getClass().getSimpleName(), ex.getMessage());
         }
      }

      final var removedDirs = record.removedEmptyDirs;
      if (removedDirs != null) {
         for (final var removedDir : removedDirs) {
            final var dir = Path.of(removedDir);
            if (!apply) {
               LOG.info("DRY-RUN UNDO DIR CREATE: %s", dir);
               continue;
            }
            try {
               Files.createDirectories(dir);
            } catch (final IOException ex) {
               result.onError();
               LOG.error("UNDO ERROR: cannot recreate directory %s (%s)", dir, ex.getMessage());
            }
         }
      }
      return result;
   }

   /**
    * Persists a new record for the given executed moves.
    */
   public TransactionRecord write(final Path sourceDir, final Path destinationDir, final List<MoveRecord> moves,
         final Collection<Path> removedEmptyDirs) throws IOException {
      final var record = new TransactionRecord();
      record.id = newTransactionId();
      record.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS).toString();
      record.sourceDir = sourceDir.toString();
      record.destinationDir = destinationDir.toString();
      record.moves = List.copyOf(moves);
      record.removedEmptyDirs = removedEmptyDirs.stream().map(Path::toString).toList();
      record.file = undoDir.resolve(record.id + ".json");
      if (FileUtils.exists(record.file))
         throw new IOException("Undo record [" + record.file + "] already exists!");
      save(record);
      return record;
   }
}
